package io.docgraph.processing.service.text;

import io.docgraph.processing.dto.text.NormalizedText;
import io.docgraph.processing.dto.text.TextSpan;
import io.docgraph.processing.exception.EmptyInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Cleans raw extracted text and splits it into sentences.
 */
@Service
public class TextNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(TextNormalizer.class);

    private static final Pattern LINE_END_HYPHENATION = Pattern.compile("(\\p{L})-\\n[ \\t]*(\\p{Ll})");
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n[ \\t\\x0B]*\\n");
    private static final Pattern WHITESPACE_OR_CONTROL = Pattern.compile("[\\s\\p{Cntrl}]+");
    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private static final int MIN_PAGES_FOR_RUNNING_HEADERS = 3;

    // A period after one of these does not end a sentence
    private static final Set<String> ABBREVIATIONS = Set.of(
            "mr", "mrs", "ms", "dr", "prof", "sr", "jr", "st", "mt", "rev", "hon",
            "gen", "col", "capt", "lt", "sgt", "gov", "sen", "rep",
            "vs", "no", "fig", "al", "cf", "approx", "dept", "e.g", "i.e", "u.s", "u.k"
    );

    private static final String CLOSING_PUNCTUATION = ".!?\"')]”’";

    public NormalizedText normalize(String rawText) {
        if (rawText == null) {
            throw new EmptyInputException();
        }

        String text = rawText.replace("\uFEFF", "")
                .replace("\r\n", "\n")
                .replace('\r', '\n');

        text = stripRunningHeaders(text);
        text = LINE_END_HYPHENATION.matcher(text).replaceAll("$1$2");
        String cleaned = collapseWhitespace(text);

        if (cleaned.isBlank()) {
            throw new EmptyInputException();
        }

        List<TextSpan> sentences = splitSentences(cleaned);

        logger.debug("Normalized {} raw characters into {} characters, {} sentences",
                rawText.length(), cleaned.length(), sentences.size());

        return new NormalizedText(cleaned, sentences);
    }

    private String collapseWhitespace(String text) {
        List<String> paragraphs = new ArrayList<>();
        for (String paragraph : PARAGRAPH_BREAK.split(text)) {
            String collapsed = WHITESPACE_OR_CONTROL.matcher(paragraph).replaceAll(" ").trim();
            if (!collapsed.isEmpty()) {
                paragraphs.add(collapsed);
            }
        }
        return String.join("\n", paragraphs);
    }

    /**
     * Pages are separated by form feeds. Lines that open or close most pages
     * (digits ignored, so "Page 3" matches "Page 4") are dropped from every page.
     */
    private String stripRunningHeaders(String text) {
        List<String> pages = Arrays.asList(text.split("\f", -1));
        if (pages.size() < MIN_PAGES_FOR_RUNNING_HEADERS) {
            return String.join("\n\n", pages);
        }

        List<List<String>> pageLines = pages.stream()
                .map(page -> (List<String>) new ArrayList<>(Arrays.asList(page.split("\n", -1))))
                .toList();

        int threshold = Math.max(2, (pages.size() + 1) / 2);
        String header = repeatedKey(pageLines, true, threshold);
        String footer = repeatedKey(pageLines, false, threshold);

        if (header != null || footer != null) {
            logger.debug("Removing running header '{}' and footer '{}' from {} pages", header, footer, pages.size());
        }

        List<String> cleanedPages = new ArrayList<>();
        for (List<String> lines : pageLines) {
            if (header != null) {
                removeEdgeLine(lines, true, header);
            }
            if (footer != null) {
                removeEdgeLine(lines, false, footer);
            }
            cleanedPages.add(String.join("\n", lines));
        }
        return String.join("\n\n", cleanedPages);
    }

    private String repeatedKey(List<List<String>> pageLines, boolean first, int threshold) {
        Map<String, Integer> counts = new HashMap<>();
        for (List<String> lines : pageLines) {
            int index = edgeLineIndex(lines, first);
            if (index >= 0) {
                counts.merge(lineKey(lines.get(index)), 1, Integer::sum);
            }
        }
        return counts.entrySet().stream()
                .filter(entry -> entry.getValue() >= threshold)
                .map(Map.Entry::getKey)
                .sorted()
                .findFirst()
                .orElse(null);
    }

    private void removeEdgeLine(List<String> lines, boolean first, String key) {
        int index = edgeLineIndex(lines, first);
        if (index >= 0 && lineKey(lines.get(index)).equals(key)) {
            lines.remove(index);
        }
    }

    private int edgeLineIndex(List<String> lines, boolean first) {
        if (first) {
            for (int i = 0; i < lines.size(); i++) {
                if (!lines.get(i).isBlank()) {
                    return i;
                }
            }
        } else {
            for (int i = lines.size() - 1; i >= 0; i--) {
                if (!lines.get(i).isBlank()) {
                    return i;
                }
            }
        }
        return -1;
    }

    private String lineKey(String line) {
        return DIGITS.matcher(line.trim()).replaceAll("#");
    }

    List<TextSpan> splitSentences(String text) {
        List<TextSpan> spans = new ArrayList<>();
        int length = text.length();
        int start = 0;

        for (int i = 0; i < length; i++) {
            char c = text.charAt(i);

            if (c == '\n') {
                addSentence(text, start, i, spans);
                start = i + 1;
                continue;
            }

            if (c != '.' && c != '!' && c != '?') {
                continue;
            }

            int end = i + 1;
            while (end < length && CLOSING_PUNCTUATION.indexOf(text.charAt(end)) >= 0) {
                end++;
            }

            // "3.14", "e.g" and similar: no whitespace after the terminator
            if (end < length && !Character.isWhitespace(text.charAt(end))) {
                continue;
            }

            if (c == '.' && !endsSentenceAfterPeriod(text, i, end)) {
                i = end - 1;
                continue;
            }

            addSentence(text, start, end, spans);
            start = end;
            i = end - 1;
        }

        addSentence(text, start, length, spans);
        return spans;
    }

    private boolean endsSentenceAfterPeriod(String text, int periodIndex, int end) {
        int next = end;
        while (next < text.length() && text.charAt(next) == ' ') {
            next++;
        }
        if (next >= text.length() || text.charAt(next) == '\n') {
            return true;
        }
        if (Character.isLowerCase(text.charAt(next))) {
            return false;
        }

        int wordStart = periodIndex;
        while (wordStart > 0 && (Character.isLetter(text.charAt(wordStart - 1)) || text.charAt(wordStart - 1) == '.')) {
            wordStart--;
        }
        String word = text.substring(wordStart, periodIndex);
        if (word.isEmpty()) {
            return true;
        }
        if (word.length() == 1 && Character.isUpperCase(word.charAt(0))) {
            // initial, as in "J. Smith"
            return false;
        }
        return !ABBREVIATIONS.contains(word.toLowerCase(Locale.ROOT));
    }

    private void addSentence(String text, int start, int end, List<TextSpan> spans) {
        while (start < end && Character.isWhitespace(text.charAt(start))) {
            start++;
        }
        while (end > start && Character.isWhitespace(text.charAt(end - 1))) {
            end--;
        }
        if (start < end) {
            spans.add(new TextSpan(start, end));
        }
    }
}
