package com.opsdesk.runner.support;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Plain-text framing for command output: the execution header and footer
 * written around every run, section headers and simple tables.
 */
public final class OutputFormatter {

    public static final int WIDTH = 60;

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");
    private static final Pattern ANSI = Pattern.compile("\u001B\\[[0-9;]*m");
    private static final Pattern TAGS = Pattern.compile("<[^>]+>");

    private OutputFormatter() {}

    public static String executionHeader(String command, String operator, ZonedDateTime startedAt,
                                         String environment, Map<String, ?> options) {
        StringBuilder out = new StringBuilder();
        out.append(sectionHeader("COMMAND EXECUTION")).append('\n');
        out.append("Command: ").append(command).append('\n');
        out.append("User: ").append(operator).append('\n');
        out.append("Started: ").append(TIMESTAMP.format(startedAt)).append('\n');
        out.append("Environment: ").append(environment).append('\n');
        if (options != null && !options.isEmpty()) {
            out.append("Options:\n");
            options.forEach((key, value) -> out.append("  - ").append(key).append(": ").append(value).append('\n'));
        }
        out.append("═".repeat(WIDTH)).append("\n\n");
        return out.toString();
    }

    /**
     * @param error when non-null the footer reports an execution error
     *              instead of the completion summary
     */
    public static String executionFooter(ZonedDateTime completedAt, double elapsedSeconds,
                                         int exitCode, String error) {
        StringBuilder out = new StringBuilder("\n").append("═".repeat(WIDTH)).append('\n');
        if (error != null) {
            out.append("EXECUTION ERROR\n");
            out.append("Error: ").append(error).append('\n');
        } else {
            out.append("Completed: ").append(TIMESTAMP.format(completedAt)).append('\n');
            out.append("Duration: ").append(elapsedSeconds).append("s\n");
            out.append("Exit Code: ").append(exitCode).append('\n');
            out.append("Status: ").append(exitCode == 0 ? "SUCCESS" : "FAILED").append('\n');
        }
        return out.toString();
    }

    public static String sectionHeader(String title) {
        int inner = WIDTH - 2;
        int padding = Math.max(0, inner - title.length());
        int left = padding / 2;
        return "╭" + "─".repeat(inner) + "╮\n"
                + "│" + " ".repeat(left) + title + " ".repeat(padding - left) + "│\n"
                + "╰" + "─".repeat(inner) + "╯\n";
    }

    /** Renders rows under headers; missing cells print empty, null cells print {@code NULL}. */
    public static String table(List<String> headers, List<? extends List<?>> rows) {
        List<Integer> widths = new ArrayList<>();
        headers.forEach(h -> widths.add(h.length()));
        for (List<?> row : rows) {
            for (int i = 0; i < row.size(); i++) {
                int w = cell(row, i).length();
                if (i < widths.size()) {
                    widths.set(i, Math.max(widths.get(i), w));
                } else {
                    widths.add(w);
                }
            }
        }

        StringBuilder out = new StringBuilder();
        out.append(rule('┌', '┬', '┐', widths)).append('\n');
        out.append(line(headers, widths)).append('\n');
        out.append(rule('├', '┼', '┤', widths)).append('\n');
        for (List<?> row : rows) {
            out.append(line(row, widths)).append('\n');
        }
        out.append(rule('└', '┴', '┘', widths));
        return out.toString();
    }

    /** Removes markup tags and terminal colour codes. */
    public static String stripFormatting(String output) {
        if (output == null) return "";
        String plain = TAGS.matcher(output).replaceAll("");
        return ANSI.matcher(plain).replaceAll("").strip();
    }

    private static String rule(char left, char middle, char right, List<Integer> widths) {
        StringBuilder out = new StringBuilder().append(left);
        for (int i = 0; i < widths.size(); i++) {
            if (i > 0) out.append(middle);
            out.append("─".repeat(widths.get(i) + 2));
        }
        return out.append(right).toString();
    }

    private static String line(List<?> cells, List<Integer> widths) {
        StringBuilder out = new StringBuilder("│");
        for (int i = 0; i < widths.size(); i++) {
            String text = cell(cells, i);
            out.append(' ').append(text).append(" ".repeat(widths.get(i) - text.length())).append(" │");
        }
        return out.toString();
    }

    private static String cell(List<?> cells, int index) {
        if (index >= cells.size()) return "";
        Object value = cells.get(index);
        return value == null ? "NULL" : value.toString();
    }
}
