package com.localization.toolkit.parser;

import java.util.function.IntPredicate;

/**
 * Character cursor over Fluent source text.
 *
 * <p>The stream keeps two positions: the committed {@code index} and a
 * look-ahead {@code peekOffset} relative to it. Lookahead never moves the
 * index until {@link #skipToPeek()} is called. A {@code \r\n} pair is
 * reported as a single {@link #EOL} everywhere.
 */
public class FluentParserStream {

    public static final int EOF = -1;
    public static final char EOL = '\n';

    private static final String SPECIAL_LINE_START_CHARS = "}.[*";

    private final String source;
    private int index;
    private int peekOffset;

    public FluentParserStream(String source) {
        this.source = source;
    }

    public String getSource() {
        return source;
    }

    public int getIndex() {
        return index;
    }

    public int getPeekOffset() {
        return peekOffset;
    }

    public String slice(int start, int end) {
        int length = source.length();
        return source.substring(Math.min(start, length), Math.min(end, length));
    }

    private int rawCharAt(int offset) {
        if (offset < 0 || offset >= source.length()) {
            return EOF;
        }
        return source.charAt(offset);
    }

    public int charAt(int offset) {
        // CRLF is a single line end
        if (rawCharAt(offset) == '\r' && rawCharAt(offset + 1) == '\n') {
            return EOL;
        }
        return rawCharAt(offset);
    }

    public int currentChar() {
        return charAt(index);
    }

    public int currentPeek() {
        return charAt(index + peekOffset);
    }

    public int next() {
        peekOffset = 0;
        if (rawCharAt(index) == '\r' && rawCharAt(index + 1) == '\n') {
            index++;
        }
        if (index < source.length()) {
            index++;
        }
        return charAt(index);
    }

    public int peek() {
        int offset = index + peekOffset;
        if (rawCharAt(offset) == '\r' && rawCharAt(offset + 1) == '\n') {
            peekOffset++;
        }
        if (index + peekOffset < source.length()) {
            peekOffset++;
        }
        return charAt(index + peekOffset);
    }

    public void resetPeek() {
        peekOffset = 0;
    }

    public void resetPeek(int offset) {
        peekOffset = offset;
    }

    public void skipToPeek() {
        index += peekOffset;
        peekOffset = 0;
    }

    // Blank handling

    public String peekBlankInline() {
        int start = index + peekOffset;
        while (currentPeek() == ' ') {
            peek();
        }
        return slice(start, index + peekOffset);
    }

    public String skipBlankInline() {
        String blank = peekBlankInline();
        skipToPeek();
        return blank;
    }

    /**
     * Peeks over blank lines. Returns one {@link #EOL} per blank line and
     * leaves the peek position at the start of the first non-blank line.
     */
    public String peekBlankBlock() {
        StringBuilder blank = new StringBuilder();
        while (true) {
            int lineStart = peekOffset;
            peekBlankInline();
            if (currentPeek() == EOL) {
                blank.append(EOL);
                peek();
                continue;
            }
            if (currentPeek() == EOF) {
                // trailing spaces at the end of input count as a blank block
                return blank.toString();
            }
            resetPeek(lineStart);
            return blank.toString();
        }
    }

    public String skipBlankBlock() {
        String blank = peekBlankBlock();
        skipToPeek();
        return blank;
    }

    public void peekBlank() {
        while (currentPeek() == ' ' || currentPeek() == EOL) {
            peek();
        }
    }

    public void skipBlank() {
        peekBlank();
        skipToPeek();
    }

    // Expectations

    public void expectChar(char ch) {
        if (currentChar() == ch) {
            next();
            return;
        }
        throw new ParseError(FluentErrorCode.E0003, String.valueOf(ch));
    }

    public void expectLineEnd() {
        if (currentChar() == EOF) {
            return;
        }
        if (currentChar() == EOL) {
            next();
            return;
        }
        // U+2424 SYMBOL FOR NEWLINE
        throw new ParseError(FluentErrorCode.E0003, "␤");
    }

    /**
     * Consumes the current character if it matches, returning it, or {@link #EOF} otherwise.
     */
    public int takeChar(IntPredicate predicate) {
        int ch = currentChar();
        if (ch == EOF) {
            return EOF;
        }
        if (predicate.test(ch)) {
            next();
            return ch;
        }
        return EOF;
    }

    // Character classes

    public static boolean isCharIdStart(int ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z');
    }

    public static boolean isCharIdPart(int ch) {
        return isCharIdStart(ch) || isDigit(ch) || ch == '_' || ch == '-';
    }

    public static boolean isDigit(int ch) {
        return ch >= '0' && ch <= '9';
    }

    public static boolean isHexDigit(int ch) {
        return isDigit(ch) || (ch >= 'a' && ch <= 'f') || (ch >= 'A' && ch <= 'F');
    }

    /**
     * Whether a line starting with {@code ch} may continue a multiline pattern.
     */
    public static boolean isCharPatternContinuation(int ch) {
        if (ch == EOF) {
            return false;
        }
        return SPECIAL_LINE_START_CHARS.indexOf(ch) < 0;
    }

    public boolean isIdentifierStart() {
        return isCharIdStart(currentPeek());
    }

    public boolean isNumberStart() {
        int ch = currentChar() == '-' ? peek() : currentChar();
        boolean digit = isDigit(ch);
        resetPeek();
        return digit;
    }

    public boolean isValueStart() {
        int ch = currentPeek();
        return ch != EOL && ch != EOF;
    }

    /**
     * Checks whether the line at the peek position continues the current pattern.
     * The peek position is restored only when it does.
     */
    public boolean isValueContinuation() {
        int column1 = peekOffset;
        peekBlankInline();

        if (currentPeek() == '{') {
            resetPeek(column1);
            return true;
        }
        if (peekOffset - column1 == 0) {
            return false;
        }
        if (isCharPatternContinuation(currentPeek())) {
            resetPeek(column1);
            return true;
        }
        return false;
    }

    /**
     * Whether the next line is a comment of the given level.
     * Level -1 accepts any of {@code #}, {@code ##} and {@code ###}.
     */
    public boolean isNextLineComment(int level) {
        if (currentChar() != EOL) {
            return false;
        }

        int i = 0;
        while (i <= level || (level == -1 && i < 3)) {
            if (peek() != '#') {
                if (i <= level && level != -1) {
                    resetPeek();
                    return false;
                }
                break;
            }
            i++;
        }

        peek();
        int ch = currentPeek();
        resetPeek();
        return ch == ' ' || ch == EOL;
    }

    public boolean isVariantStart() {
        int currentPeekOffset = peekOffset;
        if (currentPeek() == '*') {
            peek();
        }
        boolean variant = currentPeek() == '[' && peek() != '[';
        resetPeek(currentPeekOffset);
        return variant;
    }

    public boolean isAttributeStart() {
        return currentPeek() == '.';
    }

    /**
     * Error recovery: moves to the next line that starts with an identifier
     * character, {@code -} or {@code #}.
     */
    public void skipToNextEntryStart(int junkStart) {
        int lastNewline = index > 0 ? source.lastIndexOf(EOL, index - 1) : -1;
        if (junkStart < lastNewline) {
            // rewind to the start of the line so the check below sees it
            index = lastNewline;
        }
        peekOffset = 0;

        while (currentChar() != EOF) {
            if (currentChar() != EOL) {
                next();
                continue;
            }
            int first = next();
            if (isCharIdStart(first) || first == '-' || first == '#') {
                break;
            }
        }
    }

    // Takers

    public char takeIdStart() {
        int ch = currentChar();
        if (isCharIdStart(ch)) {
            next();
            return (char) ch;
        }
        throw new ParseError(FluentErrorCode.E0004, "a-zA-Z");
    }

    public int takeIdChar() {
        return takeChar(FluentParserStream::isCharIdPart);
    }

    public int takeDigit() {
        return takeChar(FluentParserStream::isDigit);
    }

    public int takeHexDigit() {
        return takeChar(FluentParserStream::isHexDigit);
    }
}
