package com.politest.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.politest.domain.MergedPolicy;
import com.politest.domain.PolicySource;
import com.politest.domain.TrackingIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Concatenates the statements of several policy files (SCPs, RCPs) into one document, in file
 * order and then in-file order, tagging every statement with a tracking id.
 */
@Service
public class PolicyMergeService {

    private static final Logger logger = LoggerFactory.getLogger(PolicyMergeService.class);

    private final PolicyJsonMapper jsonMapper;
    private final StatementTagger statementTagger;

    public PolicyMergeService(PolicyJsonMapper jsonMapper, StatementTagger statementTagger) {
        this.jsonMapper = jsonMapper;
        this.statementTagger = statementTagger;
    }

    public MergedPolicy mergeScpFiles(List<Path> files) {
        return merge(files, TrackingIds.SCP_NAMESPACE);
    }

    public MergedPolicy merge(List<Path> files, String namespace) {
        List<JsonNode> statements = new ArrayList<>();
        Map<String, PolicySource> sourceMap = new LinkedHashMap<>();
        Set<String> issuedLabels = new HashSet<>();

        for (Path file : files) {
            String sourceText = jsonMapper.readText(file);
            JsonNode document = jsonMapper.parse(sourceText, file);
            List<JsonNode> fileStatements = jsonMapper.statementsOf(document);

            String label = uniqueLabel(file, issuedLabels);
            StatementTagger.TaggedStatements tagged = statementTagger.tag(fileStatements, sourceText, file,
                    idx -> TrackingIds.forMergedFile(namespace, label, idx));

            statements.addAll(tagged.getStatements());
            sourceMap.putAll(tagged.getSources());
            logger.debug("Merged {} statement(s) from {}", fileStatements.size(), file);
        }

        ObjectNode merged = jsonMapper.newPolicyDocument(statements);
        logger.info("Merged {} policy file(s) into {} statement(s)", files.size(), statements.size());
        return new MergedPolicy(merged, sourceMap);
    }

    // Files sharing a basename get "name(2)", "name(3)"; a suffixed label never reuses one already issued.
    private String uniqueLabel(Path file, Set<String> issuedLabels) {
        String basename = file.getFileName().toString();
        String label = basename;
        for (int n = 2; !issuedLabels.add(label); n++) {
            label = basename + "(" + n + ")";
        }
        return label;
    }
}
