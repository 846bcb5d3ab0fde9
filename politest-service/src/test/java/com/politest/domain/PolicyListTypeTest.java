package com.politest.domain;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;

import static org.assertj.core.api.Assertions.assertThat;

class PolicyListTypeTest {

    @ParameterizedTest
    @CsvSource({
            "PolicyInputList.1, IDENTITY",
            "PolicyInputList.12, IDENTITY",
            "PermissionsBoundaryPolicyInputList.1, PERMISSIONS_BOUNDARY",
            "ResourcePolicy, RESOURCE_POLICY",
            "ResourcePolicy.1, RESOURCE_POLICY",
            "SomeFutureListType.1, UNKNOWN",
            "PolicyInputListExtra.1, UNKNOWN",
            "policyinputlist.1, UNKNOWN"
    })
    void testFromSourcePolicyId(String sourcePolicyId, PolicyListType expected) {
        assertThat(PolicyListType.fromSourcePolicyId(sourcePolicyId)).isEqualTo(expected);
    }

    @ParameterizedTest
    @NullAndEmptySource
    void testFromSourcePolicyId_missing(String sourcePolicyId) {
        assertThat(PolicyListType.fromSourcePolicyId(sourcePolicyId)).isEqualTo(PolicyListType.UNKNOWN);
    }
}
