package com.toolflow.oracle;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class OracleRectifierTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private Optional<JsonNode> propose(ReasoningOracle oracle) {
        return new OracleRectifier(oracle, objectMapper).propose(
            "apply_patch",
            objectMapper.createObjectNode().put("file", "a.txt"),
            objectMapper.createObjectNode(),
            "apply_patch requires a patch field");
    }

    @Test
    void argsAnswer_shouldBecomeProposal() {
        Optional<JsonNode> proposal = propose((mode, prompt, context) ->
            "{\"args\": {\"file\": \"a.txt\", \"patch\": \"@@ -1 +1 @@\"}}");

        assertThat(proposal).isPresent();
        assertThat(proposal.get().get("patch").asText()).isEqualTo("@@ -1 +1 @@");
    }

    @Test
    void rejectedAnswer_shouldYieldNone() {
        assertThat(propose((mode, prompt, context) -> "{\"rejected\": true}")).isEmpty();
    }

    @Test
    void unparsableAnswer_shouldYieldNone() {
        assertThat(propose((mode, prompt, context) -> "cannot help")).isEmpty();
    }

    @Test
    void nonObjectArgs_shouldYieldNone() {
        assertThat(propose((mode, prompt, context) -> "{\"args\": \"patch it\"}")).isEmpty();
    }

    @Test
    void oracleFailure_shouldYieldNone() {
        assertThat(propose((mode, prompt, context) -> {
            throw new IllegalStateException("model crashed");
        })).isEmpty();
    }

    @Test
    void missingOracle_shouldYieldNone() {
        assertThat(propose(null)).isEmpty();
    }

    @Test
    void oracle_shouldBeAskedOnceWithReason() {
        AtomicInteger calls = new AtomicInteger();
        propose((mode, prompt, context) -> {
            calls.incrementAndGet();
            assertThat(mode).isEqualTo(OracleMode.RECTIFY);
            assertThat(prompt).contains("apply_patch requires a patch field");
            return "garbage";
        });

        assertThat(calls.get()).isEqualTo(1);
    }
}
