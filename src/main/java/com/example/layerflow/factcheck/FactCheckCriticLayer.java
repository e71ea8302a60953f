package com.example.layerflow.factcheck;

import com.example.layerflow.layer.IntermediateLayer;
import com.example.layerflow.model.LayerExpectation;
import com.example.layerflow.util.PayloadUtils;
import com.example.layerflow.validation.ValidationRule;
import com.example.layerflow.validation.ValidationRules;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Intermediate stage of the fact-check pipeline. Verifies every claim in order and rates the
 * answer as a whole.
 */
@Slf4j
public class FactCheckCriticLayer extends IntermediateLayer {

    public static final String NAME = "fact-check-critic";
    static final String ALL_CLAIMS_VERIFIED = "every_claim_verified";

    private final ClaimVerifier verifier;

    public FactCheckCriticLayer(double maxDurationSeconds, ClaimVerifier verifier) {
        this(FactCheckContracts.critic(maxDurationSeconds), verifier);
    }

    FactCheckCriticLayer(LayerExpectation expectation, ClaimVerifier verifier) {
        super(NAME, expectation);
        this.verifier = Objects.requireNonNull(verifier, "verifier");
        addQualityGate(allClaimsVerified());
    }

    @Override
    protected Set<String> capabilities() {
        Set<String> caps = new LinkedHashSet<>(verifier.capabilities());
        caps.add("evidence_search");
        return caps;
    }

    @Override
    protected Mono<Map<String, Object>> doProcess(Map<String, Object> input) {
        String question = input.get("question") == null ? "" : String.valueOf(input.get("question"));
        List<Claim> claims = claimsOf(input);
        return Flux.fromIterable(claims)
                .concatMap(claim -> verifier.verify(claim, question))
                .collectList()
                .map(verifications -> {
                    double confidence = confidenceScore(verifications);
                    Map<String, Object> out = new LinkedHashMap<>();
                    out.put("question", question);
                    out.put("answer", input.get("answer"));
                    out.put("claim_count", claims.size());
                    out.put("verifications", verifications.stream().map(PayloadUtils::toPayload).toList());
                    out.put("overall_assessment", overallAssessment(verifications));
                    out.put("confidence_score", confidence);
                    out.put("quality", confidence);
                    out.put("verified", verifications.stream().noneMatch(v -> v.getVerdict() == Verdict.INACCURATE));
                    out.put("sources_consulted", verifications.stream()
                            .flatMap(v -> v.getSources().stream())
                            .distinct()
                            .toList());
                    log.info("[{}] verified {} claims, confidence {}", NAME, verifications.size(), confidence);
                    return out;
                });
    }

    static String overallAssessment(List<ClaimVerification> verifications) {
        if (verifications.isEmpty()) {
            return "No claims to verify";
        }
        long accurate = verifications.stream().filter(v -> v.getVerdict() == Verdict.ACCURATE).count();
        double rate = (double) accurate / verifications.size();
        if (rate >= 0.9) return "Highly accurate response";
        if (rate >= 0.7) return "Mostly accurate response";
        if (rate >= 0.5) return "Partially accurate response";
        return "Largely inaccurate response";
    }

    static double confidenceScore(List<ClaimVerification> verifications) {
        return verifications.stream().mapToDouble(ClaimVerification::getConfidence).average().orElse(0.0);
    }

    private static List<Claim> claimsOf(Map<String, Object> input) {
        Object raw = input.get("claims");
        if (!(raw instanceof Collection<?> items)) {
            return List.of();
        }
        return items.stream()
                .filter(Map.class::isInstance)
                .map(item -> {
                    @SuppressWarnings("unchecked")
                    Map<String, Object> map = (Map<String, Object>) item;
                    return PayloadUtils.fromPayload(map, Claim.class);
                })
                .toList();
    }

    private static ValidationRule allClaimsVerified() {
        return ValidationRules.of(ALL_CLAIMS_VERIFIED, out -> {
            Object verifications = out.get("verifications");
            Object count = out.get("claim_count");
            return verifications instanceof Collection<?> list
                    && count instanceof Number n
                    && list.size() == n.intValue();
        });
    }
}
