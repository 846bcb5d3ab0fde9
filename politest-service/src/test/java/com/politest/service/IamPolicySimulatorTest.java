package com.politest.service;

import com.politest.exception.SimulationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.iam.IamClient;
import software.amazon.awssdk.services.iam.model.EvaluationResult;
import software.amazon.awssdk.services.iam.model.SimulateCustomPolicyRequest;
import software.amazon.awssdk.services.iam.model.SimulateCustomPolicyResponse;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IamPolicySimulatorTest {

    @Mock
    private IamClient iamClient;

    private IamPolicySimulator simulator;

    private final SimulateCustomPolicyRequest request = SimulateCustomPolicyRequest.builder()
            .policyInputList("{}")
            .actionNames("s3:GetObject")
            .build();

    @BeforeEach
    void setUp() {
        simulator = new IamPolicySimulator(iamClient);
    }

    @Test
    void testSimulate_singlePage() {
        SimulateCustomPolicyResponse response = SimulateCustomPolicyResponse.builder()
                .evaluationResults(result("s3:GetObject", "allowed"))
                .isTruncated(false)
                .build();
        when(iamClient.simulateCustomPolicy(any(SimulateCustomPolicyRequest.class))).thenReturn(response);

        assertThat(simulator.simulate(request)).isSameAs(response);
        verify(iamClient, times(1)).simulateCustomPolicy(any(SimulateCustomPolicyRequest.class));
    }

    @Test
    void testSimulate_followsMarkers() {
        SimulateCustomPolicyResponse first = SimulateCustomPolicyResponse.builder()
                .evaluationResults(result("s3:GetObject", "allowed"))
                .isTruncated(true)
                .marker("page-2")
                .build();
        SimulateCustomPolicyResponse second = SimulateCustomPolicyResponse.builder()
                .evaluationResults(result("s3:PutObject", "implicitDeny"))
                .isTruncated(false)
                .build();
        when(iamClient.simulateCustomPolicy(any(SimulateCustomPolicyRequest.class))).thenReturn(first, second);

        SimulateCustomPolicyResponse response = simulator.simulate(request);

        assertThat(response.evaluationResults()).extracting(EvaluationResult::evalActionName)
                .containsExactly("s3:GetObject", "s3:PutObject");
        assertThat(response.isTruncated()).isFalse();

        ArgumentCaptor<SimulateCustomPolicyRequest> captor = ArgumentCaptor.forClass(SimulateCustomPolicyRequest.class);
        verify(iamClient, times(2)).simulateCustomPolicy(captor.capture());
        List<SimulateCustomPolicyRequest> requests = captor.getAllValues();
        assertThat(requests.get(0).marker()).isNull();
        assertThat(requests.get(1).marker()).isEqualTo("page-2");
        assertThat(requests.get(1).policyInputList()).containsExactly("{}");
    }

    @Test
    void testSimulate_wrapsSdkErrors() {
        when(iamClient.simulateCustomPolicy(any(SimulateCustomPolicyRequest.class)))
                .thenThrow(SdkClientException.create("Unable to load credentials"));

        assertThatThrownBy(() -> simulator.simulate(request))
                .isInstanceOf(SimulationException.class)
                .hasMessageContaining("Unable to load credentials")
                .hasCauseInstanceOf(SdkClientException.class);
    }

    private static EvaluationResult result(String action, String decision) {
        return EvaluationResult.builder().evalActionName(action).evalDecision(decision).build();
    }
}
