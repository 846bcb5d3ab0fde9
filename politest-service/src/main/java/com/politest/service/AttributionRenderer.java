package com.politest.service;

import com.politest.domain.PolicyListType;
import com.politest.domain.PolicySource;
import com.politest.domain.PolicySourceMap;
import com.politest.domain.StatementAttribution;
import com.politest.util.DisplayPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.iam.model.Statement;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Maps statements the simulator reports as matched back to the policy file, original Sid and
 * lines they were written in, and prints them. Anything that cannot be resolved is left out of
 * the output; attribution never fails a run.
 */
@Component
public class AttributionRenderer {

    private static final Logger logger = LoggerFactory.getLogger(AttributionRenderer.class);

    private final PositionResolver positionResolver;
    private final PolicyJsonMapper jsonMapper;

    public AttributionRenderer(PositionResolver positionResolver, PolicyJsonMapper jsonMapper) {
        this.positionResolver = positionResolver;
        this.jsonMapper = jsonMapper;
    }

    public StatementAttribution attribute(Statement matched, PolicySourceMap sourceMap) {
        String sourcePolicyId = matched.sourcePolicyId();
        PolicyListType listType = PolicyListType.fromSourcePolicyId(sourcePolicyId);
        StatementAttribution.StatementAttributionBuilder attribution = StatementAttribution.builder()
                .sourcePolicyId(sourcePolicyId)
                .listType(listType);

        switch (listType) {
            case IDENTITY:
                return resolveTracked(matched, sourceMap.getIdentityPolicyRaw(), sourceMap::findIdentitySource,
                        attribution);
            case PERMISSIONS_BOUNDARY:
                return resolveTracked(matched, sourceMap.getPermissionsBoundaryRaw(),
                        sourceMap::findPermissionsBoundarySource, attribution);
            case RESOURCE_POLICY:
                return attribution
                        .fragment(positionResolver.extract(sourceMap.getResourcePolicyRaw(),
                                matched.startPosition(), matched.endPosition()))
                        .source(sourceMap.findResourcePolicySource().orElse(null))
                        .build();
            default:
                logger.debug("Unrecognised SourcePolicyId {}", sourcePolicyId);
                return attribution.build();
        }
    }

    public List<StatementAttribution> renderAll(List<Statement> matched, PolicySourceMap sourceMap, PrintStream out) {
        List<StatementAttribution> attributions = new ArrayList<>(matched.size());
        for (Statement statement : matched) {
            StatementAttribution attribution = attribute(statement, sourceMap);
            render(attribution, out);
            attributions.add(attribution);
        }
        return attributions;
    }

    public void render(StatementAttribution attribution, PrintStream out) {
        if (attribution.getListType() == PolicyListType.UNKNOWN) {
            out.printf("    • %s (unknown source)%n", attribution.getSourcePolicyId());
            return;
        }

        PolicySource source = attribution.getSource();
        if (source == null) {
            out.printf("    • %s%n", attribution.getSourcePolicyId());
            return;
        }

        if (source.hasOriginalSid()) {
            out.printf("    • %s (Sid: %s)%n", attribution.getSourcePolicyId(), source.getOriginalSid());
        } else {
            out.printf("    • %s%n", attribution.getSourcePolicyId());
        }

        String displayPath = DisplayPaths.forDisplay(source.getFilePath());
        if (!source.hasLineRange()) {
            out.printf("      Source: %s%n", displayPath);
            return;
        }
        out.printf("      Source: %s:%d-%d%n", displayPath, source.getStartLine(), source.getEndLine());
        printExcerpt(source, out);
    }

    private StatementAttribution resolveTracked(Statement matched, String rawDocument,
                                                Function<String, Optional<PolicySource>> lookup,
                                                StatementAttribution.StatementAttributionBuilder attribution) {
        if (matched.startPosition() == null || matched.endPosition() == null) {
            logger.debug("No position reported for {}", matched.sourcePolicyId());
            return attribution.build();
        }

        String fragment = positionResolver.extract(rawDocument, matched.startPosition(), matched.endPosition());
        String trackingId = jsonMapper.sidOf(fragment);
        attribution.fragment(fragment);
        if (trackingId.isEmpty()) {
            logger.debug("No Sid found in fragment for {}: {}", matched.sourcePolicyId(), fragment);
            return attribution.build();
        }

        Optional<PolicySource> source = lookup.apply(trackingId);
        if (source.isEmpty()) {
            logger.debug("Tracking id {} from {} is not in the source map", trackingId, matched.sourcePolicyId());
        }
        return attribution.trackingId(trackingId).source(source.orElse(null)).build();
    }

    // Read at display time so the excerpt shows the file as it is now.
    private void printExcerpt(PolicySource source, PrintStream out) {
        List<String> lines;
        try {
            lines = Files.readAllLines(Paths.get(source.getFilePath()), StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.debug("Could not re-read {} for excerpt: {}", source.getFilePath(), e.getMessage());
            return;
        }
        int last = Math.min(source.getEndLine(), lines.size());
        for (int line = source.getStartLine(); line <= last; line++) {
            out.printf("      %d: %s%n", line, lines.get(line - 1));
        }
    }
}
