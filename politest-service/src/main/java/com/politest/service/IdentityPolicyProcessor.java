package com.politest.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.politest.domain.ProcessedPolicy;
import com.politest.domain.TrackingIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Collections;

/**
 * Tags the statements of a single identity policy with {@code identity#stmt:<index>} ids.
 * The returned JSON is what must be sent to the simulator, unchanged.
 */
@Service
public class IdentityPolicyProcessor {

    private static final Logger logger = LoggerFactory.getLogger(IdentityPolicyProcessor.class);

    private final PolicyJsonMapper jsonMapper;
    private final StatementTagger statementTagger;

    public IdentityPolicyProcessor(PolicyJsonMapper jsonMapper, StatementTagger statementTagger) {
        this.jsonMapper = jsonMapper;
        this.statementTagger = statementTagger;
    }

    /**
     * @param policyJson the identity policy as it will be sent (possibly already sanitised)
     * @param sourceFile the file the policy was authored in, read for line numbers
     */
    public ProcessedPolicy process(String policyJson, Path sourceFile) {
        String sourceText = jsonMapper.readText(sourceFile);
        JsonNode policy = jsonMapper.parse(policyJson, sourceFile);

        JsonNode statement = policy.isObject() ? policy.get(PolicyJsonMapper.STATEMENT) : null;
        if (statement == null) {
            logger.debug("Identity policy {} has no Statement element, nothing to track", sourceFile);
            return new ProcessedPolicy(policyJson, Collections.emptyMap());
        }

        StatementTagger.TaggedStatements tagged = statementTagger.tag(jsonMapper.statementsOf(policy),
                sourceText, sourceFile, TrackingIds::forIdentity);

        ObjectNode result = ((ObjectNode) policy).deepCopy();
        if (statement.isArray()) {
            ArrayNode array = result.putArray(PolicyJsonMapper.STATEMENT);
            tagged.getStatements().forEach(array::add);
        } else {
            result.set(PolicyJsonMapper.STATEMENT, tagged.getStatements().get(0));
        }

        logger.debug("Tagged {} identity statement(s) from {}", tagged.getSources().size(), sourceFile);
        return new ProcessedPolicy(jsonMapper.toPrettyJson(result), tagged.getSources());
    }
}
