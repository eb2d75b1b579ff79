package com.fedivotes.adapter.out.federation;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts instance host names from the awesome-lemmy-instances CSV.
 * The {@code Instance} column holds a markdown link such as {@code [Lemmy World](https://lemmy.world)}.
 */
final class InstanceListParser {

    private static final String INSTANCE_COLUMN = "Instance";
    private static final Pattern MARKDOWN_LINK = Pattern.compile("\\[.*?]\\((.*?)\\)");

    private InstanceListParser() {}

    static Set<String> parse(String csv) {
        Set<String> hosts = new LinkedHashSet<>();
        if (csv == null || csv.isBlank()) {
            return hosts;
        }
        String[] lines = csv.split("\\R");
        int column = splitRow(lines[0]).indexOf(INSTANCE_COLUMN);
        if (column < 0) {
            throw new IllegalArgumentException("Instance list has no '" + INSTANCE_COLUMN + "' column");
        }
        for (int i = 1; i < lines.length; i++) {
            List<String> cells = splitRow(lines[i]);
            if (cells.size() <= column) {
                continue;
            }
            String host = extractHost(cells.get(column));
            if (host != null) {
                hosts.add(host);
            }
        }
        return hosts;
    }

    static String extractHost(String cell) {
        Matcher matcher = MARKDOWN_LINK.matcher(cell);
        if (!matcher.find()) {
            return null;
        }
        String target = matcher.group(1).trim();
        target = target.replaceFirst("^https?://", "");
        int slash = target.indexOf('/');
        if (slash >= 0) {
            target = target.substring(0, slash);
        }
        return target.isEmpty() ? null : target.toLowerCase(Locale.ROOT);
    }

    /**
     * Splits one CSV row, honouring double-quoted cells and doubled quotes inside them.
     */
    static List<String> splitRow(String line) {
        List<String> cells = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"' && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    cell.append('"');
                    i++;
                } else if (c == '"') {
                    quoted = false;
                } else {
                    cell.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                cells.add(cell.toString());
                cell.setLength(0);
            } else {
                cell.append(c);
            }
        }
        cells.add(cell.toString());
        return cells;
    }
}
