package com.politest.service;

import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.iam.model.Position;

/**
 * Cuts the text between two simulator-reported positions out of the document that was sent.
 * Positions are 1-based; the end column is treated as inclusive and clamped to the line.
 */
@Component
public class PositionResolver {

    /**
     * @return the trimmed fragment, or "" when a position is missing or outside the document
     */
    public String extract(String document, Position start, Position end) {
        if (document == null || start == null || end == null) {
            return "";
        }
        if (start.line() == null || start.column() == null || end.line() == null || end.column() == null) {
            return "";
        }
        return extract(document, start.line(), start.column(), end.line(), end.column());
    }

    public String extract(String document, int startLine, int startColumn, int endLine, int endColumn) {
        if (document == null || startLine < 1 || startColumn < 1 || endColumn < 1 || endLine < startLine) {
            return "";
        }
        String[] lines = document.split("\n", -1);
        if (endLine > lines.length) {
            return "";
        }

        String first = stripCarriageReturn(lines[startLine - 1]);
        if (startColumn - 1 > first.length()) {
            return "";
        }

        if (startLine == endLine) {
            int to = Math.min(endColumn, first.length());
            if (to <= startColumn - 1) {
                return "";
            }
            return normalise(first.substring(startColumn - 1, to));
        }

        StringBuilder fragment = new StringBuilder(first.substring(startColumn - 1));
        for (int i = startLine; i < endLine - 1; i++) {
            fragment.append('\n').append(stripCarriageReturn(lines[i]));
        }
        String last = stripCarriageReturn(lines[endLine - 1]);
        fragment.append('\n').append(last, 0, Math.min(endColumn, last.length()));
        return normalise(fragment.toString());
    }

    // Ranges sometimes start at the comma before a statement or stop on the one after it.
    private String normalise(String fragment) {
        String result = fragment.trim();
        if (result.startsWith(",")) {
            result = result.substring(1).trim();
        }
        if (result.endsWith(",")) {
            result = result.substring(0, result.length() - 1).trim();
        }
        return result;
    }

    private String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
