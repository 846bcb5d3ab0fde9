package com.politest.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.politest.domain.PolicySource;
import com.politest.domain.PolicySourceMap;
import com.politest.domain.RunOptions;
import com.politest.domain.StatementAttribution;
import com.politest.domain.TestRunSummary;
import com.politest.dto.EvaluationRecordDto;
import com.politest.dto.MatchedStatementDto;
import com.politest.dto.PolicyTestCase;
import com.politest.exception.SimulationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.iam.model.ContextEntry;
import software.amazon.awssdk.services.iam.model.EvaluationResult;
import software.amazon.awssdk.services.iam.model.Position;
import software.amazon.awssdk.services.iam.model.SimulateCustomPolicyRequest;
import software.amazon.awssdk.services.iam.model.SimulateCustomPolicyResponse;
import software.amazon.awssdk.services.iam.model.Statement;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs each test case through the simulator, reports pass/fail and, for failures, where the
 * matched statements were written.
 */
@Service
public class PolicySimulationRunner {

    private static final Logger logger = LoggerFactory.getLogger(PolicySimulationRunner.class);

    private final PolicySimulator policySimulator;
    private final AttributionRenderer attributionRenderer;
    private final PolicySourceMapFactory sourceMapFactory;
    private final PolicyPathResolver pathResolver;
    private final ContextEntryMapper contextEntryMapper;
    private final ObjectMapper objectMapper;
    private final PrintStream out;

    public PolicySimulationRunner(PolicySimulator policySimulator,
                                  AttributionRenderer attributionRenderer,
                                  PolicySourceMapFactory sourceMapFactory,
                                  PolicyPathResolver pathResolver,
                                  ContextEntryMapper contextEntryMapper,
                                  ObjectMapper objectMapper,
                                  PrintStream reportStream) {
        this.policySimulator = policySimulator;
        this.attributionRenderer = attributionRenderer;
        this.sourceMapFactory = sourceMapFactory;
        this.pathResolver = pathResolver;
        this.contextEntryMapper = contextEntryMapper;
        this.objectMapper = objectMapper;
        this.out = reportStream;
    }

    /**
     * @param tests already expanded to one action per test
     */
    public TestRunSummary run(List<PolicyTestCase> tests, PolicySourceMap sourceMap, RunOptions options) {
        int passed = 0;
        int failed = 0;
        List<EvaluationRecordDto> records = new ArrayList<>();

        out.printf("Running %d test(s)...%n%n", tests.size());
        for (int i = 0; i < tests.size(); i++) {
            PolicyTestCase test = tests.get(i);
            out.printf("[%d/%d] %s%n", i + 1, tests.size(), test.displayName());

            PolicySourceMap testSourceMap = sourceMapFor(test, sourceMap, options);
            SimulateCustomPolicyResponse response = policySimulator.simulate(buildRequest(test, testSourceMap));
            boolean pass = evaluate(test, response, testSourceMap, options, records);
            if (pass) {
                passed++;
            } else {
                failed++;
            }
        }

        TestRunSummary summary = new TestRunSummary(passed, failed);
        out.println("========================================");
        out.printf("Test Results: %d passed, %d failed%n", summary.getPassed(), summary.getFailed());
        out.println("========================================");

        if (options.getSavePath() != null) {
            saveRecords(options.getSavePath(), records);
        }
        return summary;
    }

    SimulateCustomPolicyRequest buildRequest(PolicyTestCase test, PolicySourceMap sourceMap) {
        // raw documents go out untouched; positions in the response index into exactly this text
        SimulateCustomPolicyRequest.Builder request = SimulateCustomPolicyRequest.builder()
                .policyInputList(sourceMap.getIdentityPolicyRaw())
                .actionNames(test.getAction());

        List<String> resources = test.resolvedResources();
        if (!resources.isEmpty()) {
            request.resourceArns(resources);
        }
        List<ContextEntry> context = contextEntryMapper.toContextEntries(test.getContext());
        if (!context.isEmpty()) {
            request.contextEntries(context);
        }

        if (sourceMap.hasPermissionsBoundary()) {
            request.permissionsBoundaryPolicyInputList(sourceMap.getPermissionsBoundaryRaw());
        }
        if (sourceMap.hasResourcePolicy()) {
            request.resourcePolicy(sourceMap.getResourcePolicyRaw());
        }
        if (notEmpty(test.getCallerArn())) {
            request.callerArn(test.getCallerArn());
        }
        if (notEmpty(test.getResourceOwner())) {
            request.resourceOwner(test.getResourceOwner());
        }
        if (notEmpty(test.getResourceHandlingOption())) {
            request.resourceHandlingOption(test.getResourceHandlingOption());
        }
        return request.build();
    }

    private PolicySourceMap sourceMapFor(PolicyTestCase test, PolicySourceMap sourceMap, RunOptions options) {
        if (!notEmpty(test.getResourcePolicy())) {
            return sourceMap;
        }
        Path resourcePath = pathResolver.resolve(options.getBaseDir(), test.getResourcePolicy());
        String raw = sourceMapFactory.loadResourcePolicy(resourcePath, options.isStrictPolicy());
        return sourceMap.withResourcePolicy(raw, PolicySource.forFile(resourcePath.toString()));
    }

    private boolean evaluate(PolicyTestCase test, SimulateCustomPolicyResponse response,
                             PolicySourceMap sourceMap, RunOptions options, List<EvaluationRecordDto> records) {
        if (!response.hasEvaluationResults() || response.evaluationResults().isEmpty()) {
            out.printf("  ✗ FAIL: no evaluation results returned%n%n");
            return false;
        }

        EvaluationResult result = response.evaluationResults().get(0);
        String decision = result.evalDecisionAsString();
        List<Statement> matched = result.hasMatchedStatements() ? result.matchedStatements() : List.of();
        String detail = matchedIds(matched);
        String expect = test.getExpect();

        boolean pass;
        if (!notEmpty(expect)) {
            out.printf("  → Result: %s (matched: %s)%n", decision, detail);
            pass = true;
        } else if (decision.equalsIgnoreCase(expect)) {
            out.printf("  ✓ PASS: %s (matched: %s)%n", decision, detail);
            pass = true;
        } else {
            out.printf("  ✗ FAIL: expected %s, got %s (matched: %s)%n", expect, decision, detail);
            pass = false;
        }

        List<StatementAttribution> attributions = List.of();
        if (!matched.isEmpty() && (!pass || options.isShowMatchedSuccess())) {
            out.println("    Matched statements:");
            attributions = attributionRenderer.renderAll(matched, sourceMap, out);
        } else if (!matched.isEmpty() && options.getSavePath() != null) {
            attributions = matched.stream()
                    .map(statement -> attributionRenderer.attribute(statement, sourceMap))
                    .collect(Collectors.toList());
        }
        out.println();

        records.add(EvaluationRecordDto.builder()
                .testName(test.displayName())
                .action(result.evalActionName())
                .resource(result.evalResourceName())
                .decision(decision)
                .expected(expect)
                .passed(pass)
                .matchedStatements(toMatchedDtos(matched, attributions))
                .build());
        return pass;
    }

    private String matchedIds(List<Statement> matched) {
        String ids = matched.stream()
                .map(Statement::sourcePolicyId)
                .filter(id -> id != null && !id.isEmpty())
                .collect(Collectors.joining(","));
        return ids.isEmpty() ? "-" : ids;
    }

    private List<MatchedStatementDto> toMatchedDtos(List<Statement> matched, List<StatementAttribution> attributions) {
        List<MatchedStatementDto> dtos = new ArrayList<>(matched.size());
        for (int i = 0; i < matched.size(); i++) {
            Statement statement = matched.get(i);
            MatchedStatementDto.MatchedStatementDtoBuilder dto = MatchedStatementDto.builder()
                    .sourcePolicyId(statement.sourcePolicyId())
                    .sourcePolicyType(statement.sourcePolicyTypeAsString());
            Position start = statement.startPosition();
            Position end = statement.endPosition();
            if (start != null) {
                dto.startLine(start.line()).startColumn(start.column());
            }
            if (end != null) {
                dto.endLine(end.line()).endColumn(end.column());
            }
            if (i < attributions.size()) {
                attributions.get(i).findSource().ifPresent(source -> dto
                        .originalSid(source.getOriginalSid())
                        .sourceFile(source.getFilePath())
                        .sourceStartLine(source.getStartLine())
                        .sourceEndLine(source.getEndLine()));
            }
            dtos.add(dto.build());
        }
        return dtos;
    }

    private void saveRecords(Path savePath, List<EvaluationRecordDto> records) {
        try {
            prepareOwnerOnlyFile(savePath);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(savePath.toFile(), records);
        } catch (IOException e) {
            throw new SimulationException("Could not save simulation results to " + savePath, e);
        }
        out.printf("%nSaved results → %s%n", savePath);
    }

    // Restricted before any content is written; file systems without POSIX permissions keep their defaults.
    private void prepareOwnerOnlyFile(Path savePath) throws IOException {
        if (!savePath.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            logger.debug("POSIX permissions not supported for {}", savePath);
            return;
        }
        Set<PosixFilePermission> ownerOnly = PosixFilePermissions.fromString("rw-------");
        if (Files.exists(savePath)) {
            Files.setPosixFilePermissions(savePath, ownerOnly);
        } else {
            Files.createFile(savePath, PosixFilePermissions.asFileAttribute(ownerOnly));
        }
    }

    private static boolean notEmpty(String value) {
        return value != null && !value.isEmpty();
    }
}
