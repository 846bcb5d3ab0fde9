package com.politest.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * Everything needed to attribute a matched statement back to its origin: per-statement
 * sources keyed by tracking id, and the exact documents that were sent to the simulator.
 * Built once before the first simulation call and read-only afterwards.
 */
@Getter
@Builder(toBuilder = true)
@ToString(exclude = {"identityPolicyRaw", "permissionsBoundaryRaw", "resourcePolicyRaw"})
public class PolicySourceMap {

    @Builder.Default
    private final Map<String, PolicySource> identity = Collections.emptyMap();
    @Builder.Default
    private final Map<String, PolicySource> permissionsBoundary = Collections.emptyMap();
    private final PolicySource resourcePolicy;

    @Builder.Default
    private final String identityPolicyRaw = "";
    @Builder.Default
    private final String permissionsBoundaryRaw = "";
    @Builder.Default
    private final String resourcePolicyRaw = "";

    public Optional<PolicySource> findIdentitySource(String trackingId) {
        return Optional.ofNullable(identity.get(trackingId));
    }

    public Optional<PolicySource> findPermissionsBoundarySource(String trackingId) {
        return Optional.ofNullable(permissionsBoundary.get(trackingId));
    }

    public Optional<PolicySource> findResourcePolicySource() {
        return Optional.ofNullable(resourcePolicy);
    }

    public boolean hasPermissionsBoundary() {
        return permissionsBoundaryRaw != null && !permissionsBoundaryRaw.isEmpty();
    }

    public boolean hasResourcePolicy() {
        return resourcePolicyRaw != null && !resourcePolicyRaw.isEmpty();
    }

    /**
     * Copy of this map with a different resource policy, used when a single test case
     * supplies its own resource policy document.
     */
    public PolicySourceMap withResourcePolicy(String raw, PolicySource source) {
        return toBuilder()
                .resourcePolicyRaw(raw)
                .resourcePolicy(source)
                .build();
    }
}
