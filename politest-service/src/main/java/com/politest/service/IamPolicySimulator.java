package com.politest.service;

import com.politest.exception.SimulationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.iam.IamClient;
import software.amazon.awssdk.services.iam.model.EvaluationResult;
import software.amazon.awssdk.services.iam.model.SimulateCustomPolicyRequest;
import software.amazon.awssdk.services.iam.model.SimulateCustomPolicyResponse;

import java.util.ArrayList;
import java.util.List;

@Service
public class IamPolicySimulator implements PolicySimulator {

    private static final Logger logger = LoggerFactory.getLogger(IamPolicySimulator.class);

    private final IamClient iamClient;

    public IamPolicySimulator(IamClient iamClient) {
        this.iamClient = iamClient;
    }

    /**
     * Calls SimulateCustomPolicy, following markers until every evaluation result is collected.
     */
    @Override
    public SimulateCustomPolicyResponse simulate(SimulateCustomPolicyRequest request) {
        try {
            SimulateCustomPolicyResponse response = iamClient.simulateCustomPolicy(request);
            if (!Boolean.TRUE.equals(response.isTruncated())) {
                return response;
            }

            List<EvaluationResult> results = new ArrayList<>(response.evaluationResults());
            SimulateCustomPolicyResponse page = response;
            while (Boolean.TRUE.equals(page.isTruncated())) {
                logger.debug("Simulation response truncated, fetching next page");
                page = iamClient.simulateCustomPolicy(request.toBuilder().marker(page.marker()).build());
                results.addAll(page.evaluationResults());
            }
            return response.toBuilder()
                    .evaluationResults(results)
                    .isTruncated(false)
                    .marker(null)
                    .build();
        } catch (SdkException e) {
            logger.error("SimulateCustomPolicy failed for actions {}: {}", request.actionNames(), e.getMessage());
            throw new SimulationException("IAM policy simulation failed: " + e.getMessage(), e);
        }
    }
}
