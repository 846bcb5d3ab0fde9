package com.politest.domain;

/**
 * The request list a matched statement came from, derived from the simulator's
 * {@code SourcePolicyId} ("&lt;ListName&gt;.&lt;1-based index&gt;").
 */
public enum PolicyListType {

    IDENTITY("PolicyInputList"),
    PERMISSIONS_BOUNDARY("PermissionsBoundaryPolicyInputList"),
    RESOURCE_POLICY("ResourcePolicy"),
    UNKNOWN(null);

    private final String listName;

    PolicyListType(String listName) {
        this.listName = listName;
    }

    public static PolicyListType fromSourcePolicyId(String sourcePolicyId) {
        if (sourcePolicyId == null || sourcePolicyId.isEmpty()) {
            return UNKNOWN;
        }
        int dot = sourcePolicyId.lastIndexOf('.');
        String name = dot >= 0 ? sourcePolicyId.substring(0, dot) : sourcePolicyId;
        for (PolicyListType type : values()) {
            if (type.listName != null && type.listName.equals(name)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
