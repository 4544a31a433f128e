package com.github.salilvnair.flowsync.choice;

import com.github.salilvnair.flowsync.model.Choice;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts clickable options from free-form agent text. The first list style that
 * yields two or more options wins; a comma list is only considered when no list
 * formatting was found at all. Results outside {@value #MIN_CHOICES}..{@value #MAX_CHOICES}
 * options produce no choices.
 */
@Component
public class ChoiceParser {

    public static final int MIN_CHOICES = 2;
    public static final int MAX_CHOICES = 9;
    public static final int MAX_LABEL_LENGTH = 40;

    private static final int MARKER_LIMIT = 10;
    private static final int NUMBERED_LINE_GAP = 5;
    private static final int LINE_GAP = 3;
    private static final int MIN_OPTION_LENGTH = 2;
    private static final int MAX_COMMA_OPTION_LENGTH = 60;

    private static final Pattern NUMBERED_MARKER = Pattern.compile("\\b\\d+[.)]");
    private static final Pattern LETTERED_MARKER = Pattern.compile("\\b[A-Za-z][.)]\\s");
    private static final Pattern QUESTION_BLOCK = Pattern.compile("\\b(?:Question|Q)\\s*\\d+[.:]", Pattern.CASE_INSENSITIVE);

    private static final Pattern NUMBERED_LINE = Pattern.compile("^\\s*\\*{0,2}(\\d+)[.):-]\\*{0,2}\\s+\\*{0,2}(.+)$");
    private static final Pattern INLINE_NUMBERED = Pattern.compile(
            "(\\d+)(?:[.):]|\\s+-)\\s+([^0-9]+?)(?=\\s+\\d+(?:[.):]|\\s+-)|[.!]\\s+(?:Wait|wait|Please|please|Then|then|Select|select)|[.?!]\\s*$|$)");
    private static final Pattern EMOJI_LINE = Pattern.compile("^\\s*([0-9])\\uFE0F?\\u20E3\\s+(.+)$");
    private static final Pattern INLINE_EMOJI = Pattern.compile(
            "([0-9])\\uFE0F?\\u20E3\\s+([^0-9\\uFE0F\\u20E3]+?)(?=\\s*[0-9]\\uFE0F?\\u20E3|[.!]\\s+(?:Wait|wait|Please|please|Then|then|Select|select)|[.?!]\\s*$|$)");
    private static final Pattern LETTERED_LINE = Pattern.compile("^\\s*\\*{0,2}([A-Za-z])[.):-]\\*{0,2}\\s+\\*{0,2}(.+)$");
    private static final Pattern INLINE_LETTERED = Pattern.compile("\\b([A-Z])[.)]\\s+(.+?)(?=\\s+[A-Z][.)]|$)");
    private static final Pattern BULLET_LINE = Pattern.compile("^\\s*[-*•]\\s+(.+)$");
    private static final Pattern INLINE_BULLET_SECTION = Pattern.compile(
            "[?:]\\s*(-\\s+.+?)(?:\\.\\s*(?:Wait|wait|Please|please)|[.?!]?\\s*$)");
    private static final Pattern INLINE_BULLET_SPLIT = Pattern.compile("\\s+-\\s+");
    private static final Pattern INLINE_BULLET_FILLER = Pattern.compile("^(?:wait|please|response|for|choice|select)", Pattern.CASE_INSENSITIVE);
    private static final Pattern OPTION_LABELLED = Pattern.compile(
            "option\\s+([A-Za-z]|\\d+)\\s*:\\s*([^O\\n]+?)(?=\\s*Option\\s+(?:[A-Za-z]|\\d+)|\\s*$|\\n)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern COMMA_TRIGGER = Pattern.compile(
            "\\b(?:choose|pick|select|prefer|like|want|use|between|recommend)(?:\\s*:\\s*|\\s+)(?:between\\s+)?([^?]+?)\\?",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern LEADING_CONNECTIVE = Pattern.compile(
            "^(?:to\\s+)?(?:me\\s+to\\s+)?(?:use|go\\s+with|try|pick|select|choose|have|work\\s+with)\\s+",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern COMMA_SPLIT = Pattern.compile(",\\s*(?:or\\s+)?|\\s+or\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[?!]+$");

    /**
     * @return option texts in display order, or empty when the text offers no usable choice list
     */
    public Optional<List<String>> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        if (count(NUMBERED_MARKER, text) >= MARKER_LIMIT
                || count(LETTERED_MARKER, text) >= MARKER_LIMIT
                || count(QUESTION_BLOCK, text) >= 2) {
            return Optional.empty();
        }

        String[] lines = text.split("\\r?\\n");
        String singleLine = text.replace('\r', ' ').replace('\n', ' ');

        List<Supplier<List<String>>> listStyles = List.of(
                () -> numberedLines(lines),
                () -> inlineMatches(INLINE_NUMBERED, singleLine),
                () -> groupedLines(EMOJI_LINE, 2, lines),
                () -> inlineMatches(INLINE_EMOJI, singleLine),
                () -> groupedLines(LETTERED_LINE, 2, lines),
                () -> inlineMatches(INLINE_LETTERED, singleLine),
                () -> groupedLines(BULLET_LINE, 1, lines),
                () -> inlineBullets(singleLine),
                () -> inlineMatches(OPTION_LABELLED, text));

        for (Supplier<List<String>> style : listStyles) {
            List<String> options = style.get();
            if (options.size() >= MIN_CHOICES) {
                return withinBounds(options);
            }
        }
        return withinBounds(commaList(singleLine));
    }

    /**
     * Parses {@code text} into wire choices; empty when no usable list is found.
     */
    public List<Choice> choices(String text) {
        return parse(text)
                .map(options -> options.stream().map(ChoiceParser::toChoice).toList())
                .orElse(List.of());
    }

    /**
     * Cleans caller-supplied choices: drops blanks and duplicate labels, defaults the
     * value to the label and shortens long labels.
     */
    public List<Choice> normalize(List<Choice> explicit) {
        if (explicit == null || explicit.isEmpty()) {
            return List.of();
        }
        Map<String, Choice> byLabel = new LinkedHashMap<>();
        for (Choice choice : explicit) {
            if (choice == null || choice.label() == null || choice.label().isBlank()) {
                continue;
            }
            String label = choice.label().trim();
            String value = choice.value() == null || choice.value().isBlank() ? label : choice.value();
            byLabel.putIfAbsent(label, new Choice(truncate(label), value));
        }
        return List.copyOf(byLabel.values());
    }

    static Choice toChoice(String option) {
        return new Choice(truncate(option), option);
    }

    static String truncate(String label) {
        return label.length() > MAX_LABEL_LENGTH
                ? label.substring(0, MAX_LABEL_LENGTH - 3) + "..."
                : label;
    }

    private List<String> numberedLines(String[] lines) {
        List<String> group = new ArrayList<>();
        int previousLine = -1;
        int previousNumber = -1;
        for (int i = 0; i < lines.length; i++) {
            Matcher m = NUMBERED_LINE.matcher(lines[i]);
            if (!m.matches() || !acceptable(m.group(2))) {
                continue;
            }
            int number = parseNumber(m.group(1));
            boolean restart = !group.isEmpty() && (number <= previousNumber || i - previousLine > NUMBERED_LINE_GAP);
            if (restart) {
                if (group.size() >= MIN_CHOICES) {
                    break;
                }
                group.clear();
            }
            group.add(m.group(2));
            previousLine = i;
            previousNumber = number;
        }
        return clean(group);
    }

    private List<String> groupedLines(Pattern pattern, int textGroup, String[] lines) {
        List<String> group = new ArrayList<>();
        int previousLine = -1;
        for (int i = 0; i < lines.length; i++) {
            Matcher m = pattern.matcher(lines[i]);
            if (!m.matches() || !acceptable(m.group(textGroup))) {
                continue;
            }
            if (!group.isEmpty() && i - previousLine > LINE_GAP) {
                if (group.size() >= MIN_CHOICES) {
                    break;
                }
                group.clear();
            }
            group.add(m.group(textGroup));
            previousLine = i;
        }
        return clean(group);
    }

    private List<String> inlineMatches(Pattern pattern, String text) {
        List<String> found = new ArrayList<>();
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            if (acceptable(m.group(2))) {
                found.add(m.group(2));
            }
        }
        return clean(found);
    }

    private List<String> inlineBullets(String singleLine) {
        Matcher section = INLINE_BULLET_SECTION.matcher(singleLine);
        if (!section.find()) {
            return List.of();
        }
        List<String> found = new ArrayList<>();
        for (String part : INLINE_BULLET_SPLIT.split(section.group(1))) {
            String trimmed = part.replaceFirst("^-\\s*", "").trim();
            if (trimmed.length() >= MIN_OPTION_LENGTH && !INLINE_BULLET_FILLER.matcher(trimmed).find()) {
                found.add(trimmed);
            }
        }
        return clean(found);
    }

    private List<String> commaList(String singleLine) {
        Matcher m = COMMA_TRIGGER.matcher(singleLine);
        if (!m.find()) {
            return List.of();
        }
        String optionsText = LEADING_CONNECTIVE.matcher(m.group(1).trim()).replaceFirst("");
        List<String> parts = new ArrayList<>();
        for (String part : COMMA_SPLIT.split(optionsText)) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty() && trimmed.length() <= MAX_COMMA_OPTION_LENGTH) {
                parts.add(trimmed);
            }
        }
        return clean(parts);
    }

    private static Optional<List<String>> withinBounds(List<String> options) {
        if (options.size() < MIN_CHOICES || options.size() > MAX_CHOICES) {
            return Optional.empty();
        }
        return Optional.of(List.copyOf(options));
    }

    private static List<String> clean(List<String> raw) {
        Set<String> unique = new LinkedHashSet<>();
        for (String option : raw) {
            String cleaned = TRAILING_PUNCTUATION.matcher(option.replace("**", "").trim()).replaceFirst("").trim();
            if (cleaned.length() >= MIN_OPTION_LENGTH) {
                unique.add(cleaned);
            }
        }
        return new ArrayList<>(unique);
    }

    private static boolean acceptable(String option) {
        return option != null && option.trim().length() >= MIN_OPTION_LENGTH;
    }

    private static int parseNumber(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return Integer.MAX_VALUE;
        }
    }

    private static int count(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        int count = 0;
        while (m.find()) {
            count++;
        }
        return count;
    }
}
