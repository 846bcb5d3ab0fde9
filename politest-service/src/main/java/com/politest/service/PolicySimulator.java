package com.politest.service;

import software.amazon.awssdk.services.iam.model.SimulateCustomPolicyRequest;
import software.amazon.awssdk.services.iam.model.SimulateCustomPolicyResponse;

/**
 * The remote policy simulation call.
 */
public interface PolicySimulator {

    SimulateCustomPolicyResponse simulate(SimulateCustomPolicyRequest request);
}
