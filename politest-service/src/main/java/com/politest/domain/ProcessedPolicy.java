package com.politest.domain;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single policy document with tracking ids injected. {@code json} is the exact text to send.
 */
@Getter
public class ProcessedPolicy {

    private final String json;
    private final Map<String, PolicySource> sourceMap;

    public ProcessedPolicy(String json, Map<String, PolicySource> sourceMap) {
        this.json = json;
        this.sourceMap = Collections.unmodifiableMap(new LinkedHashMap<>(sourceMap));
    }
}
