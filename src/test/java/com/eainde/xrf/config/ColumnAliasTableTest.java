package com.eainde.xrf.config;

import com.eainde.xrf.model.CanonicalField;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ColumnAliasTableTest {

    private final ColumnAliasTable table = ColumnAliasTable.defaults();

    @Nested
    @DisplayName("findColumnMatch()")
    class FindColumnMatch {

        @Test
        @DisplayName("exact match ignores case and surrounding whitespace")
        void exactMatch() {
            String match = ColumnAliasTable.findColumnMatch(
                    List.of("Reading #", "  component ", "Color"),
                    table.aliases(CanonicalField.COMPONENT));

            assertThat(match).isEqualTo("  component ");
        }

        @Test
        @DisplayName("alias order wins among exact matches")
        void aliasOrderWins() {
            String match = ColumnAliasTable.findColumnMatch(
                    List.of("Lead", "PbC"),
                    table.aliases(CanonicalField.LEAD_CONTENT));

            assertThat(match).isEqualTo("PbC");
        }

        @Test
        @DisplayName("truncated header resolves by prefix")
        void truncatedHeader() {
            String match = ColumnAliasTable.findColumnMatch(
                    List.of("Rdg", "COMPO", "SUBST"),
                    table.aliases(CanonicalField.SUBSTRATE));

            assertThat(match).isEqualTo("SUBST");
        }

        @Test
        @DisplayName("short header and short alias never prefix-match")
        void shortPrefixesIgnored() {
            String match = ColumnAliasTable.findColumnMatch(List.of("Co"), List.of("Col"));

            assertThat(match).isNull();
        }

        @Test
        @DisplayName("returns null when nothing matches")
        void noMatch() {
            assertThat(ColumnAliasTable.findColumnMatch(List.of("Foo", "Bar"),
                    table.aliases(CanonicalField.COLOR))).isNull();
        }
    }

    @Test
    @DisplayName("unmappedHeaders() lists headers that are no exact alias")
    void unmappedHeaders() {
        List<String> unmapped = table.unmappedHeaders(List.of("Reading #", "Component", "Inspector", "", "Color"));

        assertThat(unmapped).containsExactly("Inspector");
    }

    @Nested
    @DisplayName("withExtraAliases()")
    class ExtraAliases {

        @Test
        @DisplayName("appends configured spellings after the defaults")
        void appends() {
            ColumnAliasTable extended = table.withExtraAliases(Map.of("component", List.of("Bauteil")));

            assertThat(extended.aliases(CanonicalField.COMPONENT))
                    .startsWith("Component")
                    .endsWith("Bauteil");
            assertThat(table.aliases(CanonicalField.COMPONENT)).doesNotContain("Bauteil");
        }

        @Test
        @DisplayName("rejects an unknown field key")
        void unknownKey() {
            assertThatThrownBy(() -> table.withExtraAliases(Map.of("colour", List.of("Farbe"))))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("colour");
        }
    }
}
