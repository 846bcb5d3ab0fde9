package com.politest.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchedStatementDto {
    private String sourcePolicyId;
    private String sourcePolicyType;
    private Integer startLine;
    private Integer startColumn;
    private Integer endLine;
    private Integer endColumn;
    private String originalSid;
    private String sourceFile;
    private Integer sourceStartLine;
    private Integer sourceEndLine;
}
