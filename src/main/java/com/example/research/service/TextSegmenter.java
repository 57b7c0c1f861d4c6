package com.example.research.service;

import com.example.research.model.ReportLine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Light segmentation of markdown report text, shared by both extractors.
 * <p>
 * Only three things are recognised: level-2 headings ({@code ## }) that open a section,
 * sentence boundaries ({@code .}, {@code !}, {@code ?} followed by whitespace), and
 * URL tokens. This is not a markdown parser.
 */
public final class TextSegmenter {

    /** Section assigned to lines before the first level-2 heading. */
    public static final String DEFAULT_SECTION = "Introduction";

    private static final String SECTION_MARKER = "## ";

    /** http/https scheme, then anything up to whitespace or one of {@code ) ] " ' > ,}. */
    public static final Pattern URL_PATTERN =
            Pattern.compile("https?://[^\\s)\\]\"'>,]+", Pattern.CASE_INSENSITIVE);

    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+");
    private static final Pattern TERMINATOR_THEN_SPACE = Pattern.compile("[.!?]\\s");
    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");

    private TextSegmenter() {
        // utility class
    }

    /**
     * Splits text into lines tagged with their section. Heading lines are kept
     * (and tagged with the section they open).
     */
    public static List<ReportLine> segment(String text) {
        if (text == null || text.isEmpty()) return List.of();

        String[] lines = LINE_BREAK.split(text, -1);
        List<ReportLine> result = new ArrayList<>(lines.length);
        String currentSection = DEFAULT_SECTION;
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (line.startsWith(SECTION_MARKER)) {
                currentSection = line.substring(SECTION_MARKER.length()).strip();
            }
            result.add(new ReportLine(i + 1, currentSection, line));
        }
        return result;
    }

    /**
     * Splits a line at whitespace preceded by a sentence terminator.
     * Sentences are trimmed; empty fragments are dropped.
     */
    public static List<String> splitSentences(String line) {
        return Arrays.stream(SENTENCE_BOUNDARY.split(line.strip()))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    /** All URL tokens in the text, in order, duplicates kept. */
    public static List<String> findUrls(String text) {
        List<String> urls = new ArrayList<>();
        Matcher m = URL_PATTERN.matcher(text);
        while (m.find()) {
            urls.add(m.group());
        }
        return urls;
    }

    /**
     * The sentence of {@code line} that encloses the span {@code [start, end)}.
     * The start boundary is just after the nearest terminator-plus-whitespace before
     * {@code start}; the end boundary is the first terminator at or after {@code end}
     * that is followed by whitespace or ends the line. Line bounds are used when no
     * terminator is found.
     */
    public static String containingSentence(String line, int start, int end) {
        int sentenceStart = 0;
        Matcher back = TERMINATOR_THEN_SPACE.matcher(line);
        back.region(0, start);
        while (back.find()) {
            sentenceStart = back.end();
        }

        int sentenceEnd = line.length();
        for (int i = end; i < line.length(); i++) {
            char c = line.charAt(i);
            if ((c == '.' || c == '!' || c == '?')
                    && (i + 1 == line.length() || Character.isWhitespace(line.charAt(i + 1)))) {
                sentenceEnd = i + 1;
                break;
            }
        }
        return line.substring(sentenceStart, sentenceEnd).strip();
    }

    /** Up to {@code radius} characters either side of {@code [start, end)}, clipped to the text. */
    public static String window(String text, int start, int end, int radius) {
        return text.substring(Math.max(0, start - radius), Math.min(text.length(), end + radius));
    }

    /**
     * Host part of a URL: the third {@code /}-delimited segment.
     *
     * @return the host, or {@code null} when the URL has no such segment
     */
    public static String domainOf(String url) {
        String[] parts = url.split("/");
        if (parts.length < 3 || parts[2].isEmpty()) return null;
        return parts[2];
    }
}
