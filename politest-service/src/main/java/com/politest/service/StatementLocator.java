package com.politest.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.politest.domain.LineRange;

/**
 * Finds where a parsed statement sits in the text it was parsed from.
 */
public interface StatementLocator {

    /**
     * @param sourceText raw file contents
     * @param statement  the statement as parsed from {@code sourceText}, before any Sid rewrite
     * @param index      ordinal of the statement within its file
     * @return 1-based inclusive line range, or {@link LineRange#NONE} when it cannot be found
     */
    LineRange locate(String sourceText, JsonNode statement, int index);
}
