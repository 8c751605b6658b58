package com.dimensio.infrastructure.engine;

import com.dimensio.domain.extraction.model.Span;
import com.dimensio.domain.extraction.model.payload.TextMatch.GroupMatch;
import com.dimensio.domain.extraction.model.payload.TextMatch.LiteralMatch;
import com.dimensio.domain.extraction.model.payload.TextMatch;
import com.dimensio.domain.extraction.rule.PatternItem.LiteralSetItem;
import com.dimensio.domain.extraction.rule.PatternItem.RegexItem;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;

/**
 * Text of one parse plus the memo of text-item matches. Every (regex item,
 * offset) pair is evaluated at most once per parse, whichever pass asks.
 * Safe for concurrent use by the matcher tasks of a pass.
 */
public final class Document {

    private final String text;
    private final Map<TextKey, Optional<TextCapture>> memo = new ConcurrentHashMap<>();

    public Document(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Document text is required");
        }
        this.text = text;
    }

    public String text() {
        return text;
    }

    public int length() {
        return text.length();
    }

    public String slice(Span span) {
        return text.substring(span.start(), span.end());
    }

    public Optional<TextCapture> matchRegex(RegexItem item, int offset) {
        if (offset >= text.length()) {
            return Optional.empty();
        }
        return memo.computeIfAbsent(new TextKey(item, offset), key -> evaluateRegex(item, offset));
    }

    public Optional<TextCapture> matchLiteral(LiteralSetItem item, int offset) {
        if (offset >= text.length()) {
            return Optional.empty();
        }
        return memo.computeIfAbsent(new TextKey(item, offset), key -> evaluateLiteral(item, offset));
    }

    /**
     * End of the run of adjacency separators (space, tab, hyphen) starting at {@code position}.
     */
    public int skipSeparators(int position) {
        int i = position;
        while (i < text.length() && isAdjacencySeparator(text.charAt(i))) {
            i++;
        }
        return i;
    }

    /**
     * True if a text match over {@code [start, end)} does not cut through a word
     * or a number at either end.
     */
    public boolean isRangeValid(int start, int end) {
        return (start == 0 || isBoundary(text.charAt(start - 1), text.charAt(start)))
                && (end == text.length() || isBoundary(text.charAt(end - 1), text.charAt(end)));
    }

    private Optional<TextCapture> evaluateRegex(RegexItem item, int offset) {
        Matcher matcher = item.pattern().matcher(text);
        matcher.useTransparentBounds(true);
        matcher.useAnchoringBounds(false);
        matcher.region(offset, text.length());
        if (!matcher.lookingAt() || matcher.end() == matcher.start()) {
            return Optional.empty();
        }
        if (!isRangeValid(matcher.start(), matcher.end())) {
            return Optional.empty();
        }

        List<String> groups = new ArrayList<>();
        if (matcher.groupCount() == 0) {
            groups.add(matcher.group());
        } else {
            for (int g = 1; g <= matcher.groupCount(); g++) {
                String group = matcher.group(g);
                groups.add(group == null ? "" : group);
            }
        }
        return Optional.of(new TextCapture(new Span(matcher.start(), matcher.end()), new GroupMatch(groups)));
    }

    private Optional<TextCapture> evaluateLiteral(LiteralSetItem item, int offset) {
        for (Map.Entry<String, Double> form : item.forms().entrySet()) {
            String literal = form.getKey();
            int end = offset + literal.length();
            if (text.regionMatches(true, offset, literal, 0, literal.length()) && isRangeValid(offset, end)) {
                return Optional.of(new TextCapture(new Span(offset, end),
                        new LiteralMatch(text.substring(offset, end), form.getValue())));
            }
        }
        return Optional.empty();
    }

    private static boolean isAdjacencySeparator(char c) {
        return c == ' ' || c == '\t' || c == '-';
    }

    private static boolean isBoundary(char before, char after) {
        return !(Character.isLetter(before) && Character.isLetter(after))
                && !(Character.isDigit(before) && Character.isDigit(after));
    }

    /**
     * Text matched by a text item.
     */
    public record TextCapture(Span span, TextMatch match) {}

    private record TextKey(Object item, int offset) {}
}
