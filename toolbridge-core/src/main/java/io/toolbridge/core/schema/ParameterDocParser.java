package io.toolbridge.core.schema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the {@code MCP Parameters:} section of a tool's documentation.
 *
 * <p>Lines after the marker are scanned one by one. A line of the form {@code name - description}
 * documents one parameter; any other line is ignored. The section ends at the first blank line that follows
 * an entry, so prose after it is not read as parameters. Text before the marker is never inspected.
 */
public final class ParameterDocParser {
    public static final String SECTION_MARKER = "MCP Parameters:";

    private static final Pattern ENTRY = Pattern.compile("^\\s*(\\S+)\\s*-\\s*(.*)$");

    private ParameterDocParser() {
    }

    public static boolean hasSection(String documentation) {
        return documentation != null && documentation.contains(SECTION_MARKER);
    }

    public static List<ParameterDoc> parse(String documentation) {
        if (!hasSection(documentation)) {
            return List.of();
        }
        String section = documentation.substring(documentation.indexOf(SECTION_MARKER) + SECTION_MARKER.length());
        Map<String, ParameterDoc> entries = new LinkedHashMap<>();
        for (String line : section.split("\\R")) {
            if (line.isBlank()) {
                if (!entries.isEmpty()) {
                    break;
                }
                continue;
            }
            Matcher matcher = ENTRY.matcher(line);
            if (!matcher.matches()) {
                continue;
            }
            ParameterDoc doc = new ParameterDoc(matcher.group(1), matcher.group(2));
            if (entries.containsKey(doc.name())) {
                throw new SchemaDerivationException("Duplicate parameter '" + doc.name() + "' in MCP Parameters");
            }
            entries.put(doc.name(), doc);
        }
        return new ArrayList<>(entries.values());
    }
}
