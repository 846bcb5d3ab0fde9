package com.politest.command;

import com.politest.domain.PolicyInputs;
import com.politest.domain.PolicySourceMap;
import com.politest.domain.RunOptions;
import com.politest.domain.TestRunSummary;
import com.politest.dto.PolicyTestCase;
import com.politest.exception.PolicyLoadException;
import com.politest.exception.SimulationException;
import com.politest.service.PolicyPathResolver;
import com.politest.service.PolicySimulationRunner;
import com.politest.service.PolicySourceMapFactory;
import com.politest.service.PolicyTestCaseLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Entry point of a run and the only place that decides the process exit code:
 * 0 on success, 1 for configuration or simulation errors, 2 when expectations fail.
 */
@Component
public class PolicySimulationCommand implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger logger = LoggerFactory.getLogger(PolicySimulationCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_TEST_FAILURES = 2;

    private final PolicySourceMapFactory sourceMapFactory;
    private final PolicyTestCaseLoader testCaseLoader;
    private final PolicySimulationRunner simulationRunner;
    private final PolicyPathResolver pathResolver;

    private final String baseDir;
    private final String identityPolicy;
    private final List<String> scpPaths;
    private final String resourcePolicy;
    private final String testsFile;
    private final boolean strictPolicy;
    private final boolean noAssert;
    private final boolean noWarn;
    private final boolean showMatchedSuccess;
    private final String savePath;
    private final List<String> testFilter;

    private int exitCode = EXIT_OK;

    public PolicySimulationCommand(PolicySourceMapFactory sourceMapFactory,
                                   PolicyTestCaseLoader testCaseLoader,
                                   PolicySimulationRunner simulationRunner,
                                   PolicyPathResolver pathResolver,
                                   @Value("${politest.base-dir:.}") String baseDir,
                                   @Value("${politest.identity-policy:}") String identityPolicy,
                                   @Value("${politest.scp-paths:}") List<String> scpPaths,
                                   @Value("${politest.resource-policy:}") String resourcePolicy,
                                   @Value("${politest.tests-file:}") String testsFile,
                                   @Value("${politest.strict-policy:false}") boolean strictPolicy,
                                   @Value("${politest.no-assert:false}") boolean noAssert,
                                   @Value("${politest.no-warn:false}") boolean noWarn,
                                   @Value("${politest.show-matched-success:false}") boolean showMatchedSuccess,
                                   @Value("${politest.save-path:}") String savePath,
                                   @Value("${politest.test-filter:}") List<String> testFilter) {
        this.sourceMapFactory = sourceMapFactory;
        this.testCaseLoader = testCaseLoader;
        this.simulationRunner = simulationRunner;
        this.pathResolver = pathResolver;
        this.baseDir = baseDir;
        this.identityPolicy = identityPolicy;
        this.scpPaths = clean(scpPaths);
        this.resourcePolicy = resourcePolicy;
        this.testsFile = testsFile;
        this.strictPolicy = strictPolicy;
        this.noAssert = noAssert;
        this.noWarn = noWarn;
        this.showMatchedSuccess = showMatchedSuccess;
        this.savePath = savePath;
        this.testFilter = clean(testFilter);
    }

    @Override
    public void run(String... args) {
        if (identityPolicy.isEmpty() || testsFile.isEmpty()) {
            logger.info("Nothing to run: set politest.identity-policy and politest.tests-file");
            return;
        }
        exitCode = execute();
    }

    int execute() {
        Path base = Path.of(baseDir).toAbsolutePath().normalize();
        try {
            PolicySourceMap sourceMap = sourceMapFactory.prepare(PolicyInputs.builder()
                    .baseDir(base)
                    .identityPolicy(Path.of(identityPolicy))
                    .scpPatterns(scpPaths)
                    .resourcePolicy(resourcePolicy.isEmpty() ? null : Path.of(resourcePolicy))
                    .strictPolicy(strictPolicy)
                    .noWarn(noWarn)
                    .build());

            List<PolicyTestCase> tests = testCaseLoader.filter(
                    testCaseLoader.expand(testCaseLoader.load(pathResolver.resolve(base, testsFile))), testFilter);

            TestRunSummary summary = simulationRunner.run(tests, sourceMap, RunOptions.builder()
                    .baseDir(base)
                    .strictPolicy(strictPolicy)
                    .showMatchedSuccess(showMatchedSuccess)
                    .savePath(savePath.isEmpty() ? null : pathResolver.resolve(base, savePath))
                    .build());
            logger.info("Ran {} test(s): {} passed, {} failed", summary.total(), summary.getPassed(), summary.getFailed());

            if (summary.hasFailures() && !noAssert) {
                return EXIT_TEST_FAILURES;
            }
            return EXIT_OK;
        } catch (PolicyLoadException e) {
            logger.error("{}", e.getMessage());
            return EXIT_ERROR;
        } catch (SimulationException e) {
            logger.error("{}", e.getMessage(), e);
            return EXIT_ERROR;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private static List<String> clean(List<String> values) {
        return values == null ? List.of() : values.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(v -> !v.isEmpty())
                .collect(Collectors.toList());
    }
}
