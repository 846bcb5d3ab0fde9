package com.politest.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.politest.domain.LineRange;
import com.politest.domain.PolicySource;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntFunction;

/**
 * Replaces each statement's Sid with a tracking id and records where the statement came from.
 * Input nodes are never modified; tagged statements are deep copies.
 */
@Component
public class StatementTagger {

    private static final Logger logger = LoggerFactory.getLogger(StatementTagger.class);

    private final StatementLocator statementLocator;

    public StatementTagger(StatementLocator statementLocator) {
        this.statementLocator = statementLocator;
    }

    public TaggedStatements tag(List<JsonNode> statements, String sourceText, Path sourceFile,
                                IntFunction<String> trackingIdForIndex) {
        List<JsonNode> tagged = new ArrayList<>(statements.size());
        Map<String, PolicySource> sources = new LinkedHashMap<>();

        for (int idx = 0; idx < statements.size(); idx++) {
            JsonNode statement = statements.get(idx);
            if (!statement.isObject()) {
                // not a statement object, nothing to tag
                tagged.add(statement.deepCopy());
                continue;
            }

            String trackingId = trackingIdForIndex.apply(idx);
            JsonNode sid = statement.get("Sid");
            String originalSid = sid != null && sid.isTextual() ? sid.asText() : "";
            LineRange lines = statementLocator.locate(sourceText, statement, idx);
            if (!lines.isFound()) {
                logger.debug("No line range found for statement {} in {}", idx, sourceFile);
            }

            ObjectNode copy = ((ObjectNode) statement).deepCopy();
            copy.put("Sid", trackingId);
            tagged.add(copy);

            sources.put(trackingId, PolicySource.builder()
                    .filePath(sourceFile.toString())
                    .originalSid(originalSid)
                    .index(idx)
                    .startLine(lines.getStartLine())
                    .endLine(lines.getEndLine())
                    .build());
        }
        return new TaggedStatements(tagged, sources);
    }

    @Getter
    public static class TaggedStatements {
        private final List<JsonNode> statements;
        private final Map<String, PolicySource> sources;

        TaggedStatements(List<JsonNode> statements, Map<String, PolicySource> sources) {
            this.statements = Collections.unmodifiableList(statements);
            this.sources = Collections.unmodifiableMap(sources);
        }
    }
}
