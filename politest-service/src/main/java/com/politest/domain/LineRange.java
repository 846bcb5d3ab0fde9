package com.politest.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 1-based inclusive line span inside a source file. {@link #NONE} is (0,0).
 */
@Getter
@ToString
@EqualsAndHashCode
public final class LineRange {

    public static final LineRange NONE = new LineRange(0, 0);

    private final int startLine;
    private final int endLine;

    private LineRange(int startLine, int endLine) {
        this.startLine = startLine;
        this.endLine = endLine;
    }

    public static LineRange of(int startLine, int endLine) {
        if (startLine <= 0 || endLine < startLine) {
            return NONE;
        }
        return new LineRange(startLine, endLine);
    }

    public boolean isFound() {
        return this != NONE && startLine > 0;
    }
}
