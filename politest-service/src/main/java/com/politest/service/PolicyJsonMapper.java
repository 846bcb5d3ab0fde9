package com.politest.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.politest.exception.PolicyLoadException;
import com.politest.util.PolicyPrettyPrinter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reading, normalising and writing policy documents. Documents are kept as Jackson trees;
 * {@link ObjectNode} keeps keys in the order they were read.
 */
@Component
public class PolicyJsonMapper {

    public static final String POLICY_VERSION = "2012-10-17";
    public static final String STATEMENT = "Statement";

    private final ObjectMapper objectMapper;
    private final ObjectWriter prettyWriter;

    public PolicyJsonMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.prettyWriter = objectMapper.writer(new PolicyPrettyPrinter());
    }

    public String readText(Path file) {
        try {
            return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PolicyLoadException(file, "Could not read policy file", e);
        }
    }

    public JsonNode readFile(Path file) {
        return parse(readText(file), file);
    }

    public JsonNode parse(String json, Path file) {
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || node.isMissingNode()) {
                throw new PolicyLoadException(file, "Empty JSON document");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new PolicyLoadException(file, "Invalid JSON in policy file (" + e.getOriginalMessage() + ")", e);
        }
    }

    /**
     * Flat statement list of a policy-like document. Accepts {@code {"Statement": [...]}},
     * {@code {"Statement": {...}}}, a bare statement object or a bare array of statements.
     */
    public List<JsonNode> statementsOf(JsonNode document) {
        if (document == null || document.isNull() || document.isMissingNode()) {
            return Collections.emptyList();
        }
        if (document.isObject()) {
            JsonNode statement = document.get(STATEMENT);
            if (statement == null) {
                return Collections.singletonList(document);
            }
            return asList(statement);
        }
        return asList(document);
    }

    /**
     * Wraps bare statements and statement arrays into a full policy document; documents that
     * already carry a {@code Statement} are returned as they are.
     */
    public ObjectNode asPolicyDocument(JsonNode document, Path file) {
        if (document.isObject() && document.has(STATEMENT)) {
            return (ObjectNode) document;
        }
        if (document.isObject() || document.isArray()) {
            return newPolicyDocument(statementsOf(document));
        }
        throw new PolicyLoadException(file, "Policy document must be a JSON object or array");
    }

    public ObjectNode newPolicyDocument(List<JsonNode> statements) {
        ObjectNode document = objectMapper.createObjectNode();
        document.put("Version", POLICY_VERSION);
        ArrayNode array = document.putArray(STATEMENT);
        statements.forEach(array::add);
        return document;
    }

    public String toPrettyJson(JsonNode node) {
        try {
            return prettyWriter.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise policy document", e);
        }
    }

    /**
     * Sid of a JSON fragment, or "" when the fragment is not an object with a string Sid.
     */
    public String sidOf(String fragment) {
        if (fragment == null || fragment.isEmpty()) {
            return "";
        }
        try {
            JsonNode node = objectMapper.readTree(fragment);
            if (node != null && node.path("Sid").isTextual()) {
                return node.get("Sid").asText();
            }
        } catch (JsonProcessingException e) {
            return "";
        }
        return "";
    }

    private List<JsonNode> asList(JsonNode node) {
        if (node.isArray()) {
            List<JsonNode> items = new ArrayList<>(node.size());
            node.forEach(items::add);
            return items;
        }
        return Collections.singletonList(node);
    }
}
