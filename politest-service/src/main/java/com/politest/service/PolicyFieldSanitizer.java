package com.politest.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.politest.exception.PolicyValidationException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keeps policies within the IAM policy grammar. Authors may annotate policies with extra
 * fields; those are stripped before sending, or rejected in strict mode.
 */
@Component
public class PolicyFieldSanitizer {

    static final Set<String> TOP_LEVEL_FIELDS = Set.of("Version", "Id", "Statement");

    static final Set<String> STATEMENT_FIELDS = Set.of(
            "Sid", "Effect", "Principal", "NotPrincipal",
            "Action", "NotAction", "Resource", "NotResource", "Condition");

    /**
     * Copy of {@code document} without non-IAM fields. Key order is preserved and
     * statements that are not objects pass through untouched.
     */
    public ObjectNode strip(ObjectNode document) {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = document.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!TOP_LEVEL_FIELDS.contains(field.getKey())) {
                continue;
            }
            if ("Statement".equals(field.getKey())) {
                result.set(field.getKey(), stripStatements(field.getValue()));
            } else {
                result.set(field.getKey(), field.getValue().deepCopy());
            }
        }
        return result;
    }

    public List<String> findViolations(JsonNode document) {
        List<String> violations = new ArrayList<>();
        document.fieldNames().forEachRemaining(name -> {
            if (!TOP_LEVEL_FIELDS.contains(name)) {
                violations.add("  Top-level: " + name);
            }
        });

        JsonNode statements = document.path("Statement");
        if (statements.isObject()) {
            addStatementViolations(statements, 0, violations);
        } else if (statements.isArray()) {
            for (int i = 0; i < statements.size(); i++) {
                addStatementViolations(statements.get(i), i, violations);
            }
        }
        return violations;
    }

    public void validate(JsonNode document, String documentLabel) {
        List<String> violations = findViolations(document);
        if (!violations.isEmpty()) {
            throw new PolicyValidationException(documentLabel, violations);
        }
    }

    private JsonNode stripStatements(JsonNode statements) {
        if (statements.isObject()) {
            return stripStatement((ObjectNode) statements);
        }
        if (!statements.isArray()) {
            return statements.deepCopy();
        }
        ArrayNode cleaned = JsonNodeFactory.instance.arrayNode();
        for (JsonNode statement : statements) {
            cleaned.add(statement.isObject() ? stripStatement((ObjectNode) statement) : statement.deepCopy());
        }
        return cleaned;
    }

    private ObjectNode stripStatement(ObjectNode statement) {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        statement.fields().forEachRemaining(field -> {
            if (STATEMENT_FIELDS.contains(field.getKey())) {
                result.set(field.getKey(), field.getValue().deepCopy());
            }
        });
        return result;
    }

    private void addStatementViolations(JsonNode statement, int index, List<String> violations) {
        if (!statement.isObject()) {
            return;
        }
        statement.fieldNames().forEachRemaining(name -> {
            if (!STATEMENT_FIELDS.contains(name)) {
                violations.add("  Statement[" + index + "]: " + name);
            }
        });
    }
}
