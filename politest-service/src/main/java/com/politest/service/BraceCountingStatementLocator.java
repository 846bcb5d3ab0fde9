package com.politest.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.politest.domain.LineRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Text search plus brace counting. Looks for the first line holding the statement's
 * {@code "Sid":} (or, without a Sid, {@code "Effect":}) value in quotes, walks back to the nearest line
 * that is only <code>{</code> and forward until the braces balance.
 * <p>
 * Expects conventionally pretty-printed policies with each statement's opening brace on its own
 * line. Objects written on a single line are not found, and braces inside string literals are
 * counted like any other.
 */
@Component
public class BraceCountingStatementLocator implements StatementLocator {

    private static final Logger logger = LoggerFactory.getLogger(BraceCountingStatementLocator.class);

    @Override
    public LineRange locate(String sourceText, JsonNode statement, int index) {
        if (sourceText == null || statement == null || !statement.isObject()) {
            return LineRange.NONE;
        }

        String searchKey;
        String searchValue;
        JsonNode sid = statement.get("Sid");
        JsonNode effect = statement.get("Effect");
        if (sid != null && sid.isTextual() && !sid.asText().isEmpty()) {
            searchKey = "Sid";
            searchValue = sid.asText();
        } else if (effect != null && effect.isTextual()) {
            searchKey = "Effect";
            searchValue = effect.asText();
        } else {
            return LineRange.NONE;
        }

        String[] lines = sourceText.split("\n", -1);
        String searchPattern = "\"" + searchKey + "\":";
        String quotedValue = "\"" + searchValue + "\"";

        for (int i = 0; i < lines.length; i++) {
            if (!lines[i].contains(searchPattern) || !lines[i].contains(quotedValue)) {
                continue;
            }
            int openLine = findOpeningBrace(lines, i);
            if (openLine < 0) {
                logger.debug("Statement {} ({}={}) has no opening brace line above line {}",
                        index, searchKey, searchValue, i + 1);
                return LineRange.NONE;
            }
            int closeLine = findClosingBrace(lines, openLine);
            if (closeLine < 0) {
                logger.debug("Braces never balance for statement {} starting at line {}", index, openLine + 1);
                return LineRange.NONE;
            }
            return LineRange.of(openLine + 1, closeLine + 1);
        }
        return LineRange.NONE;
    }

    private int findOpeningBrace(String[] lines, int from) {
        for (int j = from; j >= 0; j--) {
            if ("{".equals(lines[j].trim())) {
                return j;
            }
        }
        return -1;
    }

    private int findClosingBrace(String[] lines, int openLine) {
        int depth = 0;
        boolean opened = false;
        for (int j = openLine; j < lines.length; j++) {
            for (int k = 0; k < lines[j].length(); k++) {
                char ch = lines[j].charAt(k);
                if (ch == '{') {
                    depth++;
                    opened = true;
                } else if (ch == '}') {
                    depth--;
                    if (opened && depth == 0) {
                        return j;
                    }
                }
            }
        }
        return -1;
    }
}
