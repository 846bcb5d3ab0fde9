package com.politest.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ContextEntryDto {

    @JsonProperty("ContextKeyName")
    private String contextKeyName;

    @JsonProperty("ContextKeyValues")
    private List<String> contextKeyValues;

    @JsonProperty("ContextKeyType")
    private String contextKeyType; // string, stringList, numeric, ...
}
