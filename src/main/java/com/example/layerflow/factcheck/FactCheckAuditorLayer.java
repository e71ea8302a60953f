package com.example.layerflow.factcheck;

import com.example.layerflow.layer.AbstractLayer;
import com.example.layerflow.layer.LeadingLayer;
import com.example.layerflow.model.LayerExpectation;
import com.example.layerflow.model.LayerRole;
import com.example.layerflow.util.PayloadUtils;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Leading stage of the fact-check pipeline. Splits the answer into claims and passes the
 * factual ones on, together with the verification directives for the critic.
 */
@Slf4j
public class FactCheckAuditorLayer extends LeadingLayer {

    public static final String NAME = "fact-check-auditor";

    private final ClaimExtractor extractor;
    private final double confidenceThreshold;

    public FactCheckAuditorLayer(double maxDurationSeconds, double confidenceThreshold) {
        this(FactCheckContracts.auditor(maxDurationSeconds), confidenceThreshold);
    }

    FactCheckAuditorLayer(LayerExpectation expectation, double confidenceThreshold) {
        super(NAME, expectation);
        this.extractor = new ClaimExtractor(FactCheckContracts.MAX_CLAIMS_PER_ANALYSIS);
        this.confidenceThreshold = confidenceThreshold;
        setDownstreamRequirements(LayerRole.INTERMEDIATE,
                Map.of(AbstractLayer.REQUIRED_CAPABILITIES, List.of("claim_verification")));
        setDownstreamRequirements(LayerRole.TERMINAL,
                Map.of(AbstractLayer.REQUIRED_CAPABILITIES, List.of("text_revision")));
    }

    @Override
    protected Set<String> capabilities() {
        return Set.of("claim_extraction");
    }

    @Override
    protected Mono<Map<String, Object>> doProcess(Map<String, Object> input) {
        return Mono.fromCallable(() -> {
            String question = String.valueOf(input.get("question"));
            String answer = String.valueOf(input.get("answer"));
            List<Claim> all = extractor.extract(answer, question);
            List<Map<String, Object>> factual = all.stream()
                    .filter(c -> "factual".equals(c.getClaimType()))
                    .map(PayloadUtils::toPayload)
                    .toList();
            log.info("[{}] extracted {} claims ({} factual)", NAME, all.size(), factual.size());

            Map<String, Object> out = new LinkedHashMap<>();
            out.put("question", question);
            out.put("answer", answer);
            Object context = input.get("context");
            if (context != null) {
                out.put("context", context);
            }
            out.put("claims", factual);
            out.put("claim_count", factual.size());
            out.put("opinion_count", all.size() - factual.size());
            out.put("directives", Map.of(
                    "verification_depth", "thorough",
                    "confidence_threshold", confidenceThreshold,
                    "revision_strategy", "minimal_necessary_changes"));
            return out;
        });
    }
}
