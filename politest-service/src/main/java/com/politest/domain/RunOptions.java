package com.politest.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;

@Getter
@Builder
@ToString
public class RunOptions {

    private final Path baseDir;
    private final boolean showMatchedSuccess;
    private final boolean strictPolicy;
    private final Path savePath;
}
