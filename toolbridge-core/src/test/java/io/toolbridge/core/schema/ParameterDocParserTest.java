package io.toolbridge.core.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class ParameterDocParserTest {

    @Test
    void returnsEmptyListWhenSectionIsMissing() {
        assertThat(ParameterDocParser.parse("Echo the input back.")).isEmpty();
        assertThat(ParameterDocParser.parse(null)).isEmpty();
        assertThat(ParameterDocParser.hasSection("Echo the input back.")).isFalse();
    }

    @Test
    void parsesEntriesAfterMarker() {
        String doc = """
            Look up a symbol.

            MCP Parameters:
              symbol - the symbol to look up
              scope - where to search, e.g. buffer-local
            """;

        List<ParameterDoc> entries = ParameterDocParser.parse(doc);

        assertThat(entries).containsExactly(
            new ParameterDoc("symbol", "the symbol to look up"),
            new ParameterDoc("scope", "where to search, e.g. buffer-local")
        );
    }

    @Test
    void ignoresLinesBeforeMarkerAndLinesThatAreNotEntries() {
        String doc = """
            before - this line is above the marker
            MCP Parameters:
              text - the text to echo
                continued explanation without a dash
            """;

        assertThat(ParameterDocParser.parse(doc))
            .extracting(ParameterDoc::name)
            .containsExactly("text");
    }

    @Test
    void sectionEndsAtBlankLineAfterEntries() {
        String doc = """
            Echo text.

            MCP Parameters:

              text - the text to echo

            Returns - the same text, unchanged.
            """;

        assertThat(ParameterDocParser.parse(doc))
            .extracting(ParameterDoc::name)
            .containsExactly("text");
    }

    @Test
    void keepsDashesInsideNamesAndDescriptions() {
        List<ParameterDoc> entries = ParameterDocParser.parse("MCP Parameters:\n  file-path - path, relative - or absolute");

        assertThat(entries).containsExactly(new ParameterDoc("file-path", "path, relative - or absolute"));
    }

    @Test
    void allowsEmptyDescription() {
        List<ParameterDoc> entries = ParameterDocParser.parse("MCP Parameters:\n  text -");

        assertThat(entries).hasSize(1);
        assertThat(entries.get(0).hasDescription()).isFalse();
    }

    @Test
    void rejectsDuplicateNames() {
        String doc = "MCP Parameters:\n  text - first\n  text - second";

        assertThatThrownBy(() -> ParameterDocParser.parse(doc))
            .isInstanceOf(SchemaDerivationException.class)
            .hasMessageContaining("Duplicate parameter 'text'");
    }
}
