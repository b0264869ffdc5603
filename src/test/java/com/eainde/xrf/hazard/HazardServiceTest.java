package com.eainde.xrf.hazard;

import com.eainde.xrf.model.AreaType;
import com.eainde.xrf.model.Verdict;
import com.eainde.xrf.summary.AverageComponentSummary;
import com.eainde.xrf.summary.ClassificationType;
import com.eainde.xrf.summary.DatasetSummary;
import com.eainde.xrf.summary.NonUniformComponentSummary;
import com.eainde.xrf.summary.UniformComponentSummary;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HazardServiceTest {

    private static final HazardReference REFERENCE = HazardReference.load(new ObjectMapper());

    @Mock private HazardAssessor assessor;

    private HazardService service;

    @BeforeEach
    void setUp() {
        service = new HazardService(assessor, REFERENCE);
        lenient().when(assessor.isAvailable()).thenReturn(true);
    }

    private static PositiveComponentInput input(String component) {
        return new PositiveComponentInput(component, "Wood", AreaType.UNITS, 4, 4, ClassificationType.UNIFORM);
    }

    @Test
    @DisplayName("collectPositiveComponents() keeps positive groups and every mixed group")
    void collect() {
        DatasetSummary commonArea = new DatasetSummary(AreaType.COMMON_AREA, 45, 5, 40, 2,
                List.of(new AverageComponentSummary("Wall", "Drywall", 40, 3, 37, 7.5, 92.5, Verdict.POSITIVE)),
                List.of(new UniformComponentSummary("Door", "Wood", 5, Verdict.NEGATIVE)),
                List.of());
        DatasetSummary units = new DatasetSummary(AreaType.UNITS, 9, 3, 6, 2,
                List.of(),
                List.of(new UniformComponentSummary("Window", "Wood", 3, Verdict.POSITIVE)),
                List.of(new NonUniformComponentSummary("Sill", null, 6, 0, 6, 0.0, 100.0, List.of())));

        List<PositiveComponentInput> inputs = service.collectPositiveComponents(commonArea, units);

        assertThat(inputs).containsExactly(
                new PositiveComponentInput("Wall", "Drywall", AreaType.COMMON_AREA, 40, 3, ClassificationType.AVERAGE),
                new PositiveComponentInput("Window", "Wood", AreaType.UNITS, 3, 3, ClassificationType.UNIFORM),
                new PositiveComponentInput("Sill", null, AreaType.UNITS, 6, 0, ClassificationType.NON_UNIFORM));
    }

    @Nested
    @DisplayName("generateHazards()")
    class Generate {

        @Test
        @DisplayName("expands codes and pairs replies by position")
        void expandsCodes() {
            when(assessor.assess(anyList())).thenReturn(List.of(
                    new AssessedHazard("Deteriorated paint on window sash", "High", "Immediate", "D", "5"),
                    new AssessedHazard("Friction surface on door", null, null, "z", null)));

            List<LeadPaintHazard> hazards = service.generateHazards(List.of(input("Window"), input("Door")));

            assertThat(hazards).hasSize(2);
            LeadPaintHazard first = hazards.get(0);
            assertThat(first.component()).isEqualTo("Window");
            assertThat(first.abateCode()).isEqualTo("d");
            assertThat(first.abatementOptions()).startsWith("Enclose the component");
            assertThat(first.interimControlOptions()).startsWith("Paint stabilization");

            LeadPaintHazard second = hazards.get(1);
            assertThat(second.component()).isEqualTo("Door");
            assertThat(second.severity()).isEqualTo(HazardService.DEFAULT_SEVERITY);
            assertThat(second.priority()).isEqualTo(HazardService.DEFAULT_PRIORITY);
            assertThat(second.icCode()).isEqualTo(HazardService.DEFAULT_IC_CODE);
            assertThat(second.abatementOptions()).isEqualTo("[Abatement option z not found]");
        }

        @Test
        @DisplayName("skips replies without a description")
        void skipsBlank() {
            when(assessor.assess(anyList())).thenReturn(Arrays.asList(
                    null,
                    new AssessedHazard(" ", "High", "Immediate", "a", "1"),
                    new AssessedHazard("Chipping paint", "Low", "Schedule", "e", "2")));

            List<LeadPaintHazard> hazards = service.generateHazards(
                    List.of(input("Door"), input("Wall"), input("Stair")));

            assertThat(hazards).extracting(LeadPaintHazard::component).containsExactly("Stair");
        }

        @Test
        @DisplayName("assessor failure yields no hazards")
        void failure() {
            when(assessor.assess(anyList())).thenThrow(new IllegalStateException("model offline"));

            assertThat(service.generateHazards(List.of(input("Door")))).isEmpty();
        }

        @Test
        @DisplayName("unavailable assessor is not called")
        void unavailable() {
            when(assessor.isAvailable()).thenReturn(false);

            assertThat(service.isAvailable()).isFalse();
            assertThat(service.generateHazards(List.of(input("Door")))).isEmpty();
            verify(assessor, never()).assess(anyList());
        }

        @Test
        @DisplayName("empty input needs no assessment")
        void emptyInput() {
            assertThat(service.generateHazards(List.of())).isEmpty();
            verify(assessor, never()).assess(anyList());
        }
    }
}
