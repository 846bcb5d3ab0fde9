package com.politest.service;

import com.politest.dto.ContextEntryDto;
import com.politest.exception.PolicyLoadException;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.iam.model.ContextEntry;
import software.amazon.awssdk.services.iam.model.ContextKeyTypeEnum;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Component
public class ContextEntryMapper {

    public List<ContextEntry> toContextEntries(List<ContextEntryDto> entries) {
        if (entries == null || entries.isEmpty()) {
            return Collections.emptyList();
        }
        List<ContextEntry> result = new ArrayList<>(entries.size());
        for (ContextEntryDto entry : entries) {
            result.add(ContextEntry.builder()
                    .contextKeyName(entry.getContextKeyName())
                    .contextKeyValues(entry.getContextKeyValues() == null
                            ? Collections.emptyList() : entry.getContextKeyValues())
                    .contextKeyType(parseType(entry))
                    .build());
        }
        return result;
    }

    /**
     * Case-insensitive match against the SDK's context key types.
     */
    ContextKeyTypeEnum parseType(ContextEntryDto entry) {
        String type = entry.getContextKeyType() == null ? "" : entry.getContextKeyType().trim();
        for (ContextKeyTypeEnum known : ContextKeyTypeEnum.knownValues()) {
            if (known.toString().equalsIgnoreCase(type)) {
                return known;
            }
        }
        throw new PolicyLoadException("Unsupported context type '" + entry.getContextKeyType()
                + "' for context key " + entry.getContextKeyName() + ": must be one of "
                + ContextKeyTypeEnum.knownValues());
    }
}
