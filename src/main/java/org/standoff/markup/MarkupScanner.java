package org.standoff.markup;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Scans pseudo-XML source and reports tags, text, references and comments to a
 * {@link MarkupHandler}.
 * <p>
 * The scanner knows nothing about nesting: overlapping and unmatched tags are reported as
 * they appear, and it is the handler's job to pair them up. Markup that cannot be recognized
 * is passed on as text. Consecutive text is reported in one {@link MarkupHandler#text} call.
 */
public class MarkupScanner {

    private final String source;
    private final int[] lineStarts;
    private final StringBuilder pendingText = new StringBuilder();
    private int pendingTextStart = -1;
    private int start = 0;
    private int current = 0;

    /**
     * Creates a new scanner.
     * @param source The complete markup source.
     */
    public MarkupScanner(String source) {
        this.source = source;
        this.lineStarts = computeLineStarts(source);
    }

    /**
     * Scans the entire source, reporting every event to {@code handler}.
     * @param handler The receiver of the markup events.
     */
    public void scan(MarkupHandler handler) {
        while (!isAtEnd()) {
            start = current;
            scanMarkup(handler);
        }
        flushText(handler);
    }

    /**
     * Converts a character offset into a line/column location.
     * @param offset A character offset into the source.
     * @return The location.
     */
    public SourceLocation locate(int offset) {
        int ix = Arrays.binarySearch(lineStarts, offset);
        int line = ix >= 0 ? ix : -ix - 2;
        return new SourceLocation(line + 1, offset - lineStarts[line], offset);
    }

    private void scanMarkup(MarkupHandler handler) {
        char c = advance();
        switch (c) {
            case '<' -> tag(handler);
            case '&' -> reference(handler);
            default -> {
                while (!isAtEnd() && peek() != '<' && peek() != '&') advance();
                appendText(start, current);
            }
        }
    }

    private void tag(MarkupHandler handler) {
        if (source.startsWith("!--", current)) {
            int close = source.indexOf("-->", current + 3);
            if (close < 0) {
                unterminated();
                return;
            }
            flushText(handler);
            handler.comment(source.substring(current + 3, close), locate(start));
            current = close + 3;
        } else if (source.startsWith("![CDATA[", current)) {
            int close = source.indexOf("]]>", current + 8);
            if (close < 0) {
                unterminated();
                return;
            }
            flushText(handler);
            handler.cdata(source.substring(current + 8, close), locate(start));
            current = close + 3;
        } else if (peek() == '!' || peek() == '?') {
            int close = source.indexOf('>', current + 1);
            if (close < 0) {
                unterminated();
                return;
            }
            flushText(handler);
            String body = source.substring(current + 1, close);
            if (peek() == '!') {
                handler.declaration(body, locate(start));
            } else {
                handler.processingInstruction(body, locate(start));
            }
            current = close + 1;
        } else if (peek() == '/' && isAlpha(peekNext())) {
            endTag(handler);
        } else if (isAlpha(peek())) {
            startTag(handler);
        } else {
            appendText(start, current);
        }
    }

    private void endTag(MarkupHandler handler) {
        int close = source.indexOf('>', current);
        if (close < 0) {
            unterminated();
            return;
        }
        advance(); // consume '/'
        int nameStart = current;
        while (current < close && isNameChar(peek())) advance();
        String name = source.substring(nameStart, current).toLowerCase(Locale.ROOT);
        current = close + 1;
        flushText(handler);
        handler.endTag(name, locate(start));
    }

    private void startTag(MarkupHandler handler) {
        int nameStart = current;
        while (!isAtEnd() && isNameChar(peek())) advance();
        String name = source.substring(nameStart, current).toLowerCase(Locale.ROOT);
        List<Attribute> attributes = new ArrayList<>();
        boolean selfClosing = false;
        while (true) {
            skipWhitespace();
            if (isAtEnd()) {
                unterminated();
                return;
            }
            char c = peek();
            if (c == '>') {
                advance();
                break;
            }
            if (c == '/' && peekNext() == '>') {
                current += 2;
                selfClosing = true;
                break;
            }
            if (c == '/') {
                advance();
                continue;
            }
            if (!attribute(attributes)) {
                unterminated();
                return;
            }
        }
        flushText(handler);
        SourceLocation location = locate(start);
        handler.startTag(name, attributes, location);
        if (selfClosing) {
            handler.endTag(name, location);
        }
    }

    private boolean attribute(List<Attribute> attributes) {
        int nameStart = current;
        while (!isAtEnd() && !Character.isWhitespace(peek()) && peek() != '=' && peek() != '>' && peek() != '/') {
            advance();
        }
        String name = source.substring(nameStart, current).toLowerCase(Locale.ROOT);
        skipWhitespace();
        if (isAtEnd()) return false;
        if (peek() != '=') {
            attributes.add(new Attribute(name, ""));
            return true;
        }
        advance(); // consume '='
        skipWhitespace();
        if (isAtEnd()) return false;
        String raw;
        char quote = peek();
        if (quote == '"' || quote == '\'') {
            int close = source.indexOf(quote, current + 1);
            if (close < 0) return false;
            raw = source.substring(current + 1, close);
            current = close + 1;
        } else {
            int valueStart = current;
            while (!isAtEnd() && !Character.isWhitespace(peek()) && peek() != '>') advance();
            raw = source.substring(valueStart, current);
        }
        if (!name.isEmpty()) {
            attributes.add(new Attribute(name, EntityResolver.unescape(raw)));
        }
        return true;
    }

    private void reference(MarkupHandler handler) {
        if (peek() == '#') {
            int digitsStart = current + 1;
            int end = digitsStart;
            if (end < source.length() && (source.charAt(end) == 'x' || source.charAt(end) == 'X')) {
                end++;
                while (end < source.length() && isHexDigit(source.charAt(end))) end++;
                if (end == digitsStart + 1) {
                    appendText(start, current);
                    return;
                }
            } else {
                while (end < source.length() && isDigit(source.charAt(end))) end++;
                if (end == digitsStart) {
                    appendText(start, current);
                    return;
                }
            }
            String reference = source.substring(digitsStart, end);
            current = end < source.length() && source.charAt(end) == ';' ? end + 1 : end;
            flushText(handler);
            handler.characterReference(reference, locate(start));
        } else if (isAlpha(peek())) {
            int end = current;
            while (end < source.length() && (isAlphaNumeric(source.charAt(end)))) end++;
            String name = source.substring(current, end);
            current = end < source.length() && source.charAt(end) == ';' ? end + 1 : end;
            flushText(handler);
            handler.entityReference(name, locate(start));
        } else {
            appendText(start, current);
        }
    }

    // Whatever follows an unterminated '<' up to the end of input is text.
    private void unterminated() {
        current = source.length();
        appendText(start, current);
    }

    private void appendText(int from, int to) {
        if (pendingTextStart < 0) {
            pendingTextStart = from;
        }
        pendingText.append(source, from, to);
    }

    private void flushText(MarkupHandler handler) {
        if (pendingText.length() > 0) {
            handler.text(pendingText.toString(), locate(pendingTextStart));
            pendingText.setLength(0);
        }
        pendingTextStart = -1;
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) advance();
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private static boolean isNameChar(char c) {
        return !Character.isWhitespace(c) && c != '>' && c != '/' && c != '<';
    }

    private static int[] computeLineStarts(String source) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }
}
