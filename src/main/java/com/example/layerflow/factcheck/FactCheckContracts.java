package com.example.layerflow.factcheck;

import com.example.layerflow.model.FieldType;
import com.example.layerflow.model.LayerExpectation;
import com.example.layerflow.model.LayerRole;
import com.example.layerflow.validation.ValidationRules;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Contracts of the fact-checking pipeline. Local layers and remote adapters for the same
 * role share them, so both are held to identical hand-off checks.
 */
public final class FactCheckContracts {

    public static final int MAX_CLAIMS_PER_ANALYSIS = 20;
    public static final double MIN_REVISION_QUALITY = 0.6;

    private FactCheckContracts() {}

    /** Auditor: question + answer in, claims and directives out. */
    public static LayerExpectation auditor(double maxDurationSeconds) {
        return LayerExpectation.builder()
                .layerRole(LayerRole.LEADING)
                .inputSchema(schema(
                        "question", FieldType.STRING,
                        "answer", FieldType.STRING,
                        "context", FieldType.STRING))
                .requiredFields(Set.of("question", "answer"))
                .outputSchema(schema(
                        "question", FieldType.STRING,
                        "answer", FieldType.STRING,
                        "claims", FieldType.ARRAY,
                        "claim_count", FieldType.NUMBER))
                .validationRules(List.of(
                        ValidationRules.notBlank("question"),
                        ValidationRules.notBlank("answer")))
                .performanceConstraints(Map.of(LayerExpectation.MAX_DURATION_SECONDS, maxDurationSeconds))
                .build();
    }

    /** Critic: claims in, per-claim verifications and an overall assessment out. */
    public static LayerExpectation critic(double maxDurationSeconds) {
        return LayerExpectation.builder()
                .layerRole(LayerRole.INTERMEDIATE)
                .inputSchema(schema(
                        "answer", FieldType.STRING,
                        "claims", FieldType.ARRAY,
                        "claim_count", FieldType.NUMBER))
                .outputSchema(schema(
                        "answer", FieldType.STRING,
                        "verifications", FieldType.ARRAY,
                        "overall_assessment", FieldType.STRING,
                        "confidence_score", FieldType.NUMBER,
                        "quality", FieldType.NUMBER,
                        "verified", FieldType.BOOLEAN))
                .validationRules(List.of(
                        ValidationRules.fatal(ValidationRules.greaterThan("claim_count", 0)),
                        ValidationRules.maxItems("claims", MAX_CLAIMS_PER_ANALYSIS)))
                .performanceConstraints(Map.of(LayerExpectation.MAX_DURATION_SECONDS, maxDurationSeconds))
                .build();
    }

    /** Reviser: verifications in, revised answer out. */
    public static LayerExpectation reviser(double maxDurationSeconds) {
        return LayerExpectation.builder()
                .layerRole(LayerRole.TERMINAL)
                .inputSchema(schema(
                        "answer", FieldType.STRING,
                        "verifications", FieldType.ARRAY,
                        "overall_assessment", FieldType.STRING,
                        "confidence_score", FieldType.NUMBER))
                .outputSchema(schema(
                        "final_output", FieldType.STRING,
                        "original_answer", FieldType.STRING,
                        "changes_made", FieldType.ARRAY,
                        "revision_reasoning", FieldType.STRING,
                        "quality_score", FieldType.NUMBER))
                .qualityRequirements(Map.of("quality", MIN_REVISION_QUALITY))
                .performanceConstraints(Map.of(LayerExpectation.MAX_DURATION_SECONDS, maxDurationSeconds))
                .build();
    }

    private static Map<String, FieldType> schema(Object... pairs) {
        Map<String, FieldType> schema = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            schema.put((String) pairs[i], (FieldType) pairs[i + 1]);
        }
        return schema;
    }
}
