package com.toolflow.oracle;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.toolflow.oracle.rule.ValidationRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Validator that runs static rules first, then optionally asks a reasoning oracle.
 *
 * <p>The first rule violation rejects the call without consulting the oracle.
 * When every rule passes and an oracle is configured, its verdict decides. An
 * answer that cannot be read as {@code {"accepted": bool, "reason": "..."}}, or
 * an oracle failure, is resolved by the configured {@link OracleFailurePolicy}
 * ({@link OracleFailurePolicy#FAIL_OPEN} unless told otherwise).</p>
 */
public class PolicyValidator implements Validator {

    private static final Logger log = LoggerFactory.getLogger(PolicyValidator.class);

    private final List<ValidationRule> rules;
    private final ReasoningOracle oracle;
    private final OracleFailurePolicy failurePolicy;
    private final ObjectMapper objectMapper;

    public PolicyValidator(List<ValidationRule> rules) {
        this(rules, null, OracleFailurePolicy.FAIL_OPEN, new ObjectMapper());
    }

    public PolicyValidator(
            List<ValidationRule> rules,
            ReasoningOracle oracle,
            OracleFailurePolicy failurePolicy,
            ObjectMapper objectMapper) {
        this.rules = List.copyOf(rules);
        this.oracle = oracle;
        this.failurePolicy = failurePolicy != null ? failurePolicy : OracleFailurePolicy.FAIL_OPEN;
        this.objectMapper = objectMapper;
    }

    @Override
    public ValidationResult check(String toolName, JsonNode args, JsonNode context) {
        for (ValidationRule rule : rules) {
            Optional<String> violation = rule.violation(toolName, args, context);
            if (violation.isPresent()) {
                log.debug("Tool call {} rejected by {}: {}", toolName, rule.getClass().getSimpleName(), violation.get());
                return ValidationResult.reject(violation.get());
            }
        }

        if (oracle == null) {
            return ValidationResult.accept();
        }
        return askOracle(toolName, args, context);
    }

    public OracleFailurePolicy getFailurePolicy() {
        return failurePolicy;
    }

    private ValidationResult askOracle(String toolName, JsonNode args, JsonNode context) {
        String answer;
        try {
            answer = oracle.ask(OracleMode.VALIDATE, OraclePrompts.validate(toolName, args, context), context);
        } catch (OracleUnavailableException | RuntimeException e) {
            log.warn("Validator oracle failed for {}: {}", toolName, e.getMessage());
            return failurePolicy.verdict("validator oracle failed");
        }

        Optional<JsonNode> parsed = OracleResponses.parseObject(objectMapper, answer);
        if (parsed.isEmpty()) {
            log.warn("Validator oracle returned unparsable answer for {}", toolName);
            return failurePolicy.verdict("validator oracle returned unparsable answer");
        }

        JsonNode accepted = parsed.get().get("accepted");
        if (accepted == null || !accepted.isBoolean()) {
            log.warn("Validator oracle answer for {} has no boolean 'accepted'", toolName);
            return failurePolicy.verdict("validator oracle answer has no verdict");
        }

        JsonNode reasonNode = parsed.get().get("reason");
        String reason = reasonNode != null && !reasonNode.isNull() ? reasonNode.asText() : null;
        if (accepted.booleanValue()) {
            return ValidationResult.accept(reason);
        }
        log.info("Validator oracle rejected {}: {}", toolName, reason);
        return ValidationResult.reject(reason);
    }
}
