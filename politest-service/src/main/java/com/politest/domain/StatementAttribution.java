package com.politest.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Optional;

/**
 * What could be recovered about one matched statement. Every field beyond
 * {@code sourcePolicyId} and {@code listType} is best-effort and may be absent.
 */
@Getter
@Builder
@ToString
public class StatementAttribution {

    private final String sourcePolicyId;
    private final PolicyListType listType;
    private final String trackingId;
    private final String fragment;
    private final PolicySource source;

    public Optional<PolicySource> findSource() {
        return Optional.ofNullable(source);
    }

    public String getOriginalSid() {
        return source == null ? "" : source.getOriginalSid();
    }

    public boolean isResolved() {
        return source != null;
    }
}
