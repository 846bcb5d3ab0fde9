package com.politest.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.politest.domain.PolicySource;
import com.politest.domain.ProcessedPolicy;
import com.politest.exception.PolicyLoadException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IdentityPolicyProcessorTest {

    private static final String POLICY = "{\n"
            + "  \"Version\": \"2012-10-17\",\n"
            + "  \"Statement\": [\n"
            + "    {\n"
            + "      \"Sid\": \"AllowRead\",\n"
            + "      \"Effect\": \"Allow\",\n"
            + "      \"Action\": \"s3:GetObject\",\n"
            + "      \"Resource\": \"*\"\n"
            + "    },\n"
            + "    {\n"
            + "      \"Effect\": \"Deny\",\n"
            + "      \"Action\": \"s3:DeleteObject\",\n"
            + "      \"Resource\": \"*\"\n"
            + "    }\n"
            + "  ]\n"
            + "}";

    @TempDir
    Path tempDir;

    private IdentityPolicyProcessor processor;
    private ObjectMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper();
        PolicyJsonMapper jsonMapper = new PolicyJsonMapper(mapper);
        processor = new IdentityPolicyProcessor(jsonMapper, new StatementTagger(new BraceCountingStatementLocator()));
    }

    @Test
    void testProcess_injectsIdentityTrackingIds() throws IOException {
        Path file = Files.writeString(tempDir.resolve("identity.json"), POLICY);

        ProcessedPolicy processed = processor.process(POLICY, file);

        JsonNode statements = mapper.readTree(processed.getJson()).get("Statement");
        assertThat(statements.get(0).get("Sid").asText()).isEqualTo("identity#stmt:0");
        assertThat(statements.get(1).get("Sid").asText()).isEqualTo("identity#stmt:1");
        assertThat(statements.get(0).get("Action").asText()).isEqualTo("s3:GetObject");

        PolicySource first = processed.getSourceMap().get("identity#stmt:0");
        assertThat(first.getOriginalSid()).isEqualTo("AllowRead");
        assertThat(first.getStartLine()).isEqualTo(4);
        assertThat(first.getEndLine()).isEqualTo(9);

        PolicySource second = processed.getSourceMap().get("identity#stmt:1");
        assertThat(second.getOriginalSid()).isEmpty();
        assertThat(second.getIndex()).isEqualTo(1);
        assertThat(second.getStartLine()).isEqualTo(10);
        assertThat(second.getEndLine()).isEqualTo(14);
    }

    @Test
    void testProcess_keepsKeyOrderAndSidPosition() throws IOException {
        Path file = Files.writeString(tempDir.resolve("identity.json"), POLICY);

        ProcessedPolicy processed = processor.process(POLICY, file);

        assertThat(processed.getJson()).contains("\"Sid\": \"identity#stmt:0\",\n      \"Effect\": \"Allow\"");
        assertThat(processed.getJson().indexOf("\"Version\"")).isLessThan(processed.getJson().indexOf("\"Statement\""));
    }

    @Test
    void testProcess_singleStatementObjectStaysAnObject() throws IOException {
        String policy = "{\"Version\": \"2012-10-17\", \"Statement\": {\"Sid\": \"Only\", \"Effect\": \"Allow\"}}";
        Path file = Files.writeString(tempDir.resolve("single.json"), policy);

        ProcessedPolicy processed = processor.process(policy, file);

        JsonNode statement = mapper.readTree(processed.getJson()).get("Statement");
        assertThat(statement.isObject()).isTrue();
        assertThat(statement.get("Sid").asText()).isEqualTo("identity#stmt:0");
        assertThat(processed.getSourceMap().get("identity#stmt:0").getOriginalSid()).isEqualTo("Only");
    }

    @Test
    void testProcess_noStatementReturnsInputUnchanged() throws IOException {
        String policy = "{\"Version\": \"2012-10-17\"}";
        Path file = Files.writeString(tempDir.resolve("empty.json"), policy);

        ProcessedPolicy processed = processor.process(policy, file);

        assertThat(processed.getJson()).isSameAs(policy);
        assertThat(processed.getSourceMap()).isEmpty();
    }

    @Test
    void testProcess_invalidJson() throws IOException {
        Path file = Files.writeString(tempDir.resolve("identity.json"), POLICY);

        assertThatThrownBy(() -> processor.process("{not json", file))
                .isInstanceOf(PolicyLoadException.class)
                .hasMessageContaining("identity.json");
    }

    @Test
    void testProcess_unreadableSourceFile() {
        assertThatThrownBy(() -> processor.process(POLICY, tempDir.resolve("gone.json")))
                .isInstanceOf(PolicyLoadException.class)
                .hasMessageContaining("gone.json");
    }
}
