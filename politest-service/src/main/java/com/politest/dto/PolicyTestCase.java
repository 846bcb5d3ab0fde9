package com.politest.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PolicyTestCase {

    private String name;
    private String action;
    private List<String> actions;
    private String resource;
    private List<String> resources;
    private List<ContextEntryDto> context;
    private String callerArn;
    private String resourceOwner;
    private String resourceHandlingOption;
    private String resourcePolicy; // optional per-test resource policy file
    private String expect;         // allowed, explicitDeny, implicitDeny

    public List<String> resolvedResources() {
        if (resource != null && !resource.isEmpty()) {
            return List.of(resource);
        }
        return resources == null ? new ArrayList<>() : resources;
    }

    public String displayName() {
        if (name != null && !name.isEmpty()) {
            return name;
        }
        List<String> targets = resolvedResources();
        return action + " on " + (targets.isEmpty() ? "*" : targets.get(0));
    }
}
