package com.example.layerflow.factcheck;

import com.example.layerflow.util.CodeFenceUtils;
import com.example.layerflow.util.PayloadUtils;
import com.fasterxml.jackson.databind.JsonNode;
import dev.langchain4j.model.chat.ChatModel;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Asks a chat model for a verdict on one claim. Model or parsing failures degrade to an
 * {@code unsupported} verdict with low confidence instead of failing the stage.
 */
@Slf4j
@RequiredArgsConstructor
public class LlmClaimVerifier implements ClaimVerifier {

    static final double FALLBACK_CONFIDENCE = 0.3;
    private static final int MAX_SOURCES = 10;

    private final ChatModel chatModel;

    @Override
    public Mono<ClaimVerification> verify(Claim claim, String question) {
        String prompt = buildPrompt(claim, question);
        return Mono.fromCallable(() -> chatModel.chat(prompt))
                .subscribeOn(Schedulers.boundedElastic())
                .map(answer -> parse(claim, answer))
                .doOnError(ex -> log.warn("Claim verification failed for '{}'", claim.getText(), ex))
                .onErrorResume(ex -> Mono.just(unverified(claim, "verifier error: " + ex.getMessage())));
    }

    @Override
    public Set<String> capabilities() {
        return Set.of("claim_verification", "llm_reasoning");
    }

    private String buildPrompt(Claim claim, String question) {
        return """
                You are a careful fact-checker.
                Decide whether the claim below is accurate. Use only well established knowledge.
                Question the claim answers: %s
                Claim: %s
                Reply with a single JSON object and nothing else:
                {"verdict": "accurate|inaccurate|disputed|unsupported|not_applicable",
                 "confidence": 0.0-1.0,
                 "justification": "one sentence",
                 "correction": "corrected sentence, or null when accurate",
                 "sources": ["up to %d source URLs or titles"]}
                """.formatted(safe(question), safe(claim.getText()), MAX_SOURCES);
    }

    ClaimVerification parse(Claim claim, String answer) {
        String json = CodeFenceUtils.firstJsonObject(answer);
        if (json.isEmpty()) {
            return unverified(claim, "model reply held no JSON object");
        }
        try {
            JsonNode node = PayloadUtils.mapper().readTree(json);
            List<String> sources = new ArrayList<>();
            node.path("sources").forEach(s -> {
                if (sources.size() < MAX_SOURCES && s.isTextual() && !s.asText().isBlank()) {
                    sources.add(s.asText().strip());
                }
            });
            String correction = node.path("correction").isTextual() ? node.path("correction").asText() : null;
            return ClaimVerification.builder()
                    .claim(claim)
                    .verdict(Verdict.fromCode(node.path("verdict").asText(null)))
                    .confidence(clamp(node.path("confidence").asDouble(FALLBACK_CONFIDENCE)))
                    .justification(node.path("justification").asText(""))
                    .correction(correction == null || correction.isBlank() ? null : correction.strip())
                    .sources(sources)
                    .build();
        } catch (Exception ex) {
            log.debug("Unparseable verifier reply: {}", answer);
            return unverified(claim, "unparseable model reply");
        }
    }

    static ClaimVerification unverified(Claim claim, String reason) {
        return ClaimVerification.builder()
                .claim(claim)
                .verdict(Verdict.UNSUPPORTED)
                .confidence(FALLBACK_CONFIDENCE)
                .justification(reason)
                .build();
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) return FALLBACK_CONFIDENCE;
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static String safe(String text) {
        return text == null ? "" : text.strip();
    }
}
