package com.politest.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.politest.dto.PolicyTestCase;
import com.politest.exception.PolicyLoadException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reads the JSON list of test cases and expands multi-action tests into one test per action.
 */
@Component
public class PolicyTestCaseLoader {

    private final ObjectMapper objectMapper;

    public PolicyTestCaseLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<PolicyTestCase> load(Path testsFile) {
        try {
            List<PolicyTestCase> tests = objectMapper.readValue(testsFile.toFile(), new TypeReference<List<PolicyTestCase>>() {});
            if (tests == null || tests.isEmpty()) {
                throw new PolicyLoadException(testsFile, "Test file must contain at least one test case");
            }
            return tests;
        } catch (IOException e) {
            throw new PolicyLoadException(testsFile, "Could not read test cases", e);
        }
    }

    public List<PolicyTestCase> expand(List<PolicyTestCase> tests) {
        List<PolicyTestCase> expanded = new ArrayList<>();
        for (PolicyTestCase test : tests) {
            boolean hasAction = test.getAction() != null && !test.getAction().isEmpty();
            boolean hasActions = test.getActions() != null && !test.getActions().isEmpty();
            if (hasAction && hasActions) {
                throw new PolicyLoadException("test '" + test.getName() + "': cannot specify both 'action' and 'actions'");
            }
            if (hasActions) {
                for (String action : test.getActions()) {
                    expanded.add(test.toBuilder().action(action).actions(null).build());
                }
            } else if (hasAction) {
                expanded.add(test);
            } else {
                throw new PolicyLoadException("test '" + test.getName() + "': must specify either 'action' or 'actions'");
            }
        }
        return expanded;
    }

    public List<PolicyTestCase> filter(List<PolicyTestCase> tests, Collection<String> names) {
        if (names == null || names.isEmpty()) {
            return tests;
        }
        List<PolicyTestCase> selected = tests.stream()
                .filter(test -> names.contains(test.getName()))
                .collect(Collectors.toList());
        if (selected.isEmpty()) {
            throw new PolicyLoadException("No tests match the requested names: " + names);
        }
        return selected;
    }
}
