package com.politest.domain;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A policy document assembled from several files, with the tracking id of every statement
 * mapped back to where it came from.
 */
@Getter
public class MergedPolicy {

    private final ObjectNode document;
    private final Map<String, PolicySource> sourceMap;

    public MergedPolicy(ObjectNode document, Map<String, PolicySource> sourceMap) {
        this.document = document;
        this.sourceMap = Collections.unmodifiableMap(new LinkedHashMap<>(sourceMap));
    }

    public int statementCount() {
        return document.path("Statement").size();
    }
}
