package com.localization.toolkit.parser;

import lombok.Value;

/**
 * One-based line and column of an offset in a source text.
 * Columns are counted in code points, so characters outside the BMP count once.
 */
@Value
public class SourcePosition {
    int line;
    int column;

    public static SourcePosition of(String source, int offset) {
        int end = Math.max(0, Math.min(offset, source.length()));
        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < end; i++) {
            if (source.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        int column = source.codePointCount(lineStart, end) + 1;
        return new SourcePosition(line, column);
    }

    @Override
    public String toString() {
        return "line " + line + ", column " + column;
    }
}
