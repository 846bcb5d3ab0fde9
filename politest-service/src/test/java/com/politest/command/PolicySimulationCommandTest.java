package com.politest.command;

import com.politest.domain.PolicySourceMap;
import com.politest.domain.TestRunSummary;
import com.politest.dto.PolicyTestCase;
import com.politest.exception.PolicyLoadException;
import com.politest.exception.SimulationException;
import com.politest.service.PolicyPathResolver;
import com.politest.service.PolicySimulationRunner;
import com.politest.service.PolicySourceMapFactory;
import com.politest.service.PolicyTestCaseLoader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PolicySimulationCommandTest {

    @Mock
    private PolicySourceMapFactory sourceMapFactory;
    @Mock
    private PolicyTestCaseLoader testCaseLoader;
    @Mock
    private PolicySimulationRunner simulationRunner;

    private final List<PolicyTestCase> tests = List.of(PolicyTestCase.builder().name("t").action("s3:GetObject").build());

    @Test
    void testRun_allPassedExitsZero() {
        stubLoading();
        when(simulationRunner.run(anyList(), any(), any())).thenReturn(new TestRunSummary(2, 0));

        PolicySimulationCommand command = command("identity.json", false);
        command.run();

        assertThat(command.getExitCode()).isEqualTo(PolicySimulationCommand.EXIT_OK);
    }

    @Test
    void testRun_failedExpectationsExitTwo() {
        stubLoading();
        when(simulationRunner.run(anyList(), any(), any())).thenReturn(new TestRunSummary(1, 1));

        assertThat(command("identity.json", false).execute()).isEqualTo(PolicySimulationCommand.EXIT_TEST_FAILURES);
    }

    @Test
    void testRun_noAssertIgnoresFailures() {
        stubLoading();
        when(simulationRunner.run(anyList(), any(), any())).thenReturn(new TestRunSummary(0, 3));

        assertThat(command("identity.json", true).execute()).isEqualTo(PolicySimulationCommand.EXIT_OK);
    }

    @Test
    void testRun_policyErrorsExitOne() {
        when(sourceMapFactory.prepare(any())).thenThrow(new PolicyLoadException("Invalid JSON in policy file"));

        assertThat(command("identity.json", false).execute()).isEqualTo(PolicySimulationCommand.EXIT_ERROR);
        verifyNoInteractions(simulationRunner);
    }

    @Test
    void testRun_simulationErrorsExitOne() {
        stubLoading();
        when(simulationRunner.run(anyList(), any(), any()))
                .thenThrow(new SimulationException("IAM policy simulation failed", new RuntimeException("throttled")));

        assertThat(command("identity.json", false).execute()).isEqualTo(PolicySimulationCommand.EXIT_ERROR);
    }

    @Test
    void testRun_withoutInputsDoesNothing() {
        PolicySimulationCommand command = command("", false);
        command.run();

        assertThat(command.getExitCode()).isEqualTo(PolicySimulationCommand.EXIT_OK);
        verifyNoInteractions(sourceMapFactory, testCaseLoader, simulationRunner);
    }

    private void stubLoading() {
        when(sourceMapFactory.prepare(any())).thenReturn(PolicySourceMap.builder().identityPolicyRaw("{}").build());
        when(testCaseLoader.load(any())).thenReturn(tests);
        when(testCaseLoader.expand(anyList())).thenReturn(tests);
        when(testCaseLoader.filter(anyList(), anyList())).thenReturn(tests);
    }

    private PolicySimulationCommand command(String identityPolicy, boolean noAssert) {
        return new PolicySimulationCommand(sourceMapFactory, testCaseLoader, simulationRunner, new PolicyPathResolver(),
                ".", identityPolicy, List.of("scp/*.json", " "), "", "tests.json",
                false, noAssert, true, false, "", List.of());
    }
}
