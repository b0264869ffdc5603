package com.eainde.xrf.parse;

import com.eainde.xrf.config.ColumnAliasTable;
import com.eainde.xrf.exception.MissingRequiredColumnsException;
import com.eainde.xrf.model.CanonicalField;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ColumnMapperTest {

    @Mock private AiColumnMapper aiColumnMapper;

    private ColumnMapper mapper;

    private static final List<Map<String, Object>> SAMPLES = List.of(
            Map.of("a", 1), Map.of("a", 2), Map.of("a", 3), Map.of("a", 4), Map.of("a", 5));

    @BeforeEach
    void setUp() {
        mapper = new ColumnMapper(ColumnAliasTable.defaults(), aiColumnMapper);
        lenient().when(aiColumnMapper.isAvailable()).thenReturn(true);
    }

    @Nested
    @DisplayName("static mapping")
    class StaticMapping {

        @Test
        @DisplayName("resolves truncated device headers without AI")
        void truncatedHeaders() {
            List<String> headers = List.of("Rdg", "COMPONE", "SUBSTRAT", "COLOR", "CONDITIO", "ROOM TY", "Concentra");

            ColumnMappingResult result = mapper.resolve(headers, SAMPLES, ParseOptions.defaults());

            assertThat(result.usedAiMapping()).isFalse();
            assertThat(result.aiMappingConfidence()).isNull();
            assertThat(result.mapping().asKeyMap())
                    .containsEntry("readingId", "Rdg")
                    .containsEntry("component", "COMPONE")
                    .containsEntry("substrate", "SUBSTRAT")
                    .containsEntry("condition", "CONDITIO")
                    .containsEntry("roomType", "ROOM TY")
                    .containsEntry("leadContent", "Concentra");
            verify(aiColumnMapper, never()).mapColumns(anyList(), anyList());
        }

        @Test
        @DisplayName("numeric concentration column beats a result column")
        void concentrationPreferred() {
            List<String> headers = List.of("Reading #", "Component", "Color", "Result", "PbC");

            ColumnMappingResult result = mapper.resolve(headers, SAMPLES, ParseOptions.staticOnly());

            assertThat(result.mapping().column(CanonicalField.LEAD_CONTENT)).contains("PbC");
        }

        @Test
        @DisplayName("reports unmapped headers as a warning")
        void unmappedWarning() {
            List<String> headers = List.of("Reading #", "Component", "Color", "PbC", "Inspector");

            ColumnMappingResult result = mapper.resolve(headers, SAMPLES, ParseOptions.staticOnly());

            assertThat(result.unmappedColumns()).containsExactly("Inspector");
            assertThat(result.warnings()).contains("Unmapped columns found: Inspector");
        }

        @Test
        @DisplayName("missing required columns without fallback is an error listing them")
        void missingColumns() {
            List<String> headers = List.of("Reading #", "Component", "Notes");

            assertThatThrownBy(() -> mapper.resolve(headers, SAMPLES, ParseOptions.staticOnly()))
                    .isInstanceOfSatisfying(MissingRequiredColumnsException.class, e -> {
                        assertThat(e.getMissingFields())
                                .containsExactly(CanonicalField.COLOR, CanonicalField.LEAD_CONTENT);
                        assertThat(e.getAvailableHeaders()).isEqualTo(headers);
                    });
        }
    }

    @Nested
    @DisplayName("AI fallback")
    class AiFallback {

        private final List<String> headers = List.of("Shot", "Item", "Paint", "Value", "Notes");

        @Test
        @DisplayName("fills missing fields, keeping only columns that exist")
        void overlaysValidAssignments() {
            when(aiColumnMapper.mapColumns(eq(headers), anyList())).thenReturn(new AiColumnMapping(
                    Map.of("readingId", "shot", "component", "Item", "color", "Paint",
                            "leadContent", "Value", "substrate", "Material"),
                    List.of("Notes"), 0.82));

            ColumnMappingResult result = mapper.resolve(headers, SAMPLES, ParseOptions.defaults());

            assertThat(result.usedAiMapping()).isTrue();
            assertThat(result.aiMappingConfidence()).isEqualTo(0.82);
            assertThat(result.mapping().column(CanonicalField.READING_ID)).contains("Shot");
            assertThat(result.mapping().column(CanonicalField.SUBSTRATE)).isEmpty();
            assertThat(result.unmappedColumns()).containsExactly("Notes");
            assertThat(result.warnings()).contains("Static column mapping incomplete. Using AI to map columns...");
        }

        @Test
        @DisplayName("sends at most three sample rows")
        @SuppressWarnings("unchecked")
        void samplesCapped() {
            ArgumentCaptor<List<Map<String, Object>>> samples = ArgumentCaptor.forClass(List.class);
            when(aiColumnMapper.mapColumns(eq(headers), samples.capture())).thenReturn(new AiColumnMapping(
                    Map.of("readingId", "Shot", "component", "Item", "color", "Paint", "leadContent", "Value"),
                    List.of(), 0.9));

            mapper.resolve(headers, SAMPLES, ParseOptions.defaults());

            assertThat(samples.getValue()).hasSize(ColumnMapper.AI_SAMPLE_ROWS);
        }

        @Test
        @DisplayName("AI failure is a warning, then validation fails")
        void aiFailure() {
            when(aiColumnMapper.mapColumns(anyList(), anyList())).thenThrow(new IllegalStateException("timeout"));

            assertThatThrownBy(() -> mapper.resolve(headers, SAMPLES, ParseOptions.defaults()))
                    .isInstanceOf(MissingRequiredColumnsException.class);
        }

        @Test
        @DisplayName("unavailable mapper is never called")
        void unavailable() {
            when(aiColumnMapper.isAvailable()).thenReturn(false);

            assertThatThrownBy(() -> mapper.resolve(headers, SAMPLES, ParseOptions.defaults()))
                    .isInstanceOf(MissingRequiredColumnsException.class);
            verify(aiColumnMapper, never()).mapColumns(anyList(), anyList());
        }

        @Test
        @DisplayName("alwaysUseAi skips the alias table")
        void alwaysUseAi() {
            List<String> standard = List.of("Reading #", "Component", "Color", "PbC");
            when(aiColumnMapper.mapColumns(eq(standard), anyList())).thenReturn(new AiColumnMapping(
                    Map.of("readingId", "Reading #", "component", "Component", "color", "Color", "leadContent", "PbC"),
                    List.of(), 0.95));
            Runnable beforeAiCall = mock(Runnable.class);

            ColumnMappingResult result = mapper.resolve(standard, SAMPLES, new ParseOptions(true, true), beforeAiCall);

            assertThat(result.usedAiMapping()).isTrue();
            assertThat(result.mapping().size()).isEqualTo(4);
            verify(beforeAiCall).run();
        }
    }

    @Test
    @DisplayName("works without any AI mapper")
    void nullMapper() {
        ColumnMapper staticOnly = new ColumnMapper(ColumnAliasTable.defaults(), null);

        ColumnMappingResult result = staticOnly.resolve(List.of("ID", "Component", "Color", "Lead"), SAMPLES,
                ParseOptions.defaults());

        assertThat(result.mapping().column(CanonicalField.LEAD_CONTENT)).isEqualTo(Optional.of("Lead"));
    }
}
