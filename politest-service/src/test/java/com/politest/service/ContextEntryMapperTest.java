package com.politest.service;

import com.politest.dto.ContextEntryDto;
import com.politest.exception.PolicyLoadException;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.iam.model.ContextEntry;
import software.amazon.awssdk.services.iam.model.ContextKeyTypeEnum;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContextEntryMapperTest {

    private final ContextEntryMapper mapper = new ContextEntryMapper();

    @Test
    void testToContextEntries_mapsTypesCaseInsensitively() {
        List<ContextEntry> entries = mapper.toContextEntries(List.of(
                new ContextEntryDto("aws:SourceIp", List.of("10.0.0.1"), "ip"),
                new ContextEntryDto("aws:PrincipalTag/team", List.of("a", "b"), "STRINGLIST"),
                new ContextEntryDto("aws:MultiFactorAuthPresent", List.of("true"), " boolean ")));

        assertThat(entries).extracting(ContextEntry::contextKeyType)
                .containsExactly(ContextKeyTypeEnum.IP, ContextKeyTypeEnum.STRING_LIST, ContextKeyTypeEnum.BOOLEAN);
        assertThat(entries.get(1).contextKeyValues()).containsExactly("a", "b");
        assertThat(entries.get(0).contextKeyName()).isEqualTo("aws:SourceIp");
    }

    @Test
    void testToContextEntries_emptyInput() {
        assertThat(mapper.toContextEntries(null)).isEmpty();
        assertThat(mapper.toContextEntries(List.of())).isEmpty();
    }

    @Test
    void testToContextEntries_missingValues() {
        List<ContextEntry> entries = mapper.toContextEntries(List.of(new ContextEntryDto("k", null, "string")));

        assertThat(entries.get(0).contextKeyValues()).isEmpty();
    }

    @Test
    void testToContextEntries_unknownType() {
        List<ContextEntryDto> entries = List.of(new ContextEntryDto("aws:CurrentTime", List.of("now"), "timestamp"));

        assertThatThrownBy(() -> mapper.toContextEntries(entries))
                .isInstanceOf(PolicyLoadException.class)
                .hasMessageContaining("timestamp")
                .hasMessageContaining("aws:CurrentTime");
    }
}
