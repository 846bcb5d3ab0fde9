package com.politest.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode
public class TestRunSummary {

    private final int passed;
    private final int failed;

    public TestRunSummary(int passed, int failed) {
        this.passed = passed;
        this.failed = failed;
    }

    public int total() {
        return passed + failed;
    }

    public boolean hasFailures() {
        return failed > 0;
    }
}
