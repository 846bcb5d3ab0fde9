package com.politest.domain;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Provenance of one policy statement: the file it was read from, the Sid it carried there,
 * its ordinal within that file and the 1-based line range of its braces (0 when unknown).
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
public class PolicySource {

    private final String filePath;
    @Builder.Default
    private final String originalSid = "";
    private final int index;
    private final int startLine;
    private final int endLine;

    public static PolicySource forFile(String filePath) {
        return PolicySource.builder().filePath(filePath).build();
    }

    public boolean hasLineRange() {
        return startLine > 0 && endLine >= startLine;
    }

    public boolean hasOriginalSid() {
        return originalSid != null && !originalSid.isEmpty();
    }
}
