package com.politest.service;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.politest.domain.MergedPolicy;
import com.politest.domain.PolicyInputs;
import com.politest.domain.PolicySource;
import com.politest.domain.PolicySourceMap;
import com.politest.domain.ProcessedPolicy;
import com.politest.exception.PolicyLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

/**
 * Loads every policy taking part in a run and produces the exact documents to send together
 * with the source maps needed to attribute matched statements afterwards.
 */
@Service
public class PolicySourceMapFactory {

    private static final Logger logger = LoggerFactory.getLogger(PolicySourceMapFactory.class);

    private final PolicyJsonMapper jsonMapper;
    private final PolicyFieldSanitizer sanitizer;
    private final PolicyPathResolver pathResolver;
    private final PolicyMergeService mergeService;
    private final IdentityPolicyProcessor identityPolicyProcessor;

    public PolicySourceMapFactory(PolicyJsonMapper jsonMapper,
                                  PolicyFieldSanitizer sanitizer,
                                  PolicyPathResolver pathResolver,
                                  PolicyMergeService mergeService,
                                  IdentityPolicyProcessor identityPolicyProcessor) {
        this.jsonMapper = jsonMapper;
        this.sanitizer = sanitizer;
        this.pathResolver = pathResolver;
        this.mergeService = mergeService;
        this.identityPolicyProcessor = identityPolicyProcessor;
    }

    public PolicySourceMap prepare(PolicyInputs inputs) {
        if (inputs.getIdentityPolicy() == null) {
            throw new PolicyLoadException("An identity policy is required (politest.identity-policy)");
        }

        Path identityPath = pathResolver.resolve(inputs.getBaseDir(), inputs.getIdentityPolicy().toString());
        logger.debug("Loading identity policy from {}", identityPath);
        ObjectNode identityDocument = jsonMapper.asPolicyDocument(jsonMapper.readFile(identityPath), identityPath);
        if (inputs.isStrictPolicy()) {
            sanitizer.validate(identityDocument, "identity policy");
        }
        String identityJson = jsonMapper.toPrettyJson(sanitizer.strip(identityDocument));
        ProcessedPolicy identity = identityPolicyProcessor.process(identityJson, identityPath);

        PolicySourceMap.PolicySourceMapBuilder sourceMap = PolicySourceMap.builder()
                .identity(identity.getSourceMap())
                .identityPolicyRaw(identity.getJson());

        if (!inputs.getScpPatterns().isEmpty()) {
            List<Path> files = pathResolver.expand(inputs.getBaseDir(), inputs.getScpPatterns());
            if (files.isEmpty()) {
                throw new PolicyLoadException("SCP/RCP patterns matched no files: " + inputs.getScpPatterns());
            }
            files.forEach(file -> logger.debug("Loading SCP/RCP file {}", file));

            MergedPolicy merged = mergeService.mergeScpFiles(files);
            if (inputs.isStrictPolicy()) {
                sanitizer.validate(merged.getDocument(), "SCP/RCP");
            }
            sourceMap.permissionsBoundary(merged.getSourceMap())
                    .permissionsBoundaryRaw(jsonMapper.toPrettyJson(sanitizer.strip(merged.getDocument())));

            if (!inputs.isNoWarn()) {
                logger.warn("SCP/RCP files are simulated as a permissions boundary. This approximates, but does not "
                        + "reproduce, AWS Organizations evaluation (no OU inheritance, no management account "
                        + "exemption). Set politest.no-warn=true to hide this message.");
            }
        }

        if (inputs.getResourcePolicy() != null) {
            Path resourcePath = pathResolver.resolve(inputs.getBaseDir(), inputs.getResourcePolicy().toString());
            sourceMap.resourcePolicyRaw(loadResourcePolicy(resourcePath, inputs.isStrictPolicy()))
                    .resourcePolicy(PolicySource.forFile(resourcePath.toString()));
        }

        return sourceMap.build();
    }

    /**
     * Resource policies are sent without tracking ids; the whole document is attributed to its file.
     */
    public String loadResourcePolicy(Path resourcePath, boolean strictPolicy) {
        logger.debug("Loading resource policy from {}", resourcePath);
        ObjectNode document = jsonMapper.asPolicyDocument(jsonMapper.readFile(resourcePath), resourcePath);
        if (strictPolicy) {
            sanitizer.validate(document, "resource policy");
        }
        return jsonMapper.toPrettyJson(sanitizer.strip(document));
    }
}
