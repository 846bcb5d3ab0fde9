package com.politest.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One evaluation result as written to {@code politest.save-path}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvaluationRecordDto {
    private String testName;
    private String action;
    private String resource;
    private String decision;
    private String expected;
    private boolean passed;
    private List<MatchedStatementDto> matchedStatements;
}
