package com.example.research.model;

/**
 * One line of a report, tagged with the section it belongs to.
 *
 * @param lineNumber 1-based line number
 * @param section    current level-2 heading, or the default section before the first heading
 * @param text       the raw line
 */
public record ReportLine(int lineNumber, String section, String text) {

    public boolean isBlank() {
        return text.isBlank();
    }

    /** Heading lines ({@code #}, {@code ##}, ...) never carry claims. */
    public boolean isHeading() {
        return text.strip().startsWith("#");
    }
}
