package com.politest.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.nio.file.Path;
import java.util.List;

/**
 * Locations of the policy documents taking part in a simulation run.
 */
@Getter
@Builder
@ToString
public class PolicyInputs {

    private final Path baseDir;
    private final Path identityPolicy;
    @Singular
    private final List<String> scpPatterns;
    private final Path resourcePolicy;
    private final boolean strictPolicy;
    private final boolean noWarn;
}
