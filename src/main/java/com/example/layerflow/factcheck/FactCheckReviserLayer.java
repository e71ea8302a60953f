package com.example.layerflow.factcheck;

import com.example.layerflow.layer.TerminalLayer;
import com.example.layerflow.model.LayerExpectation;
import com.example.layerflow.util.PayloadUtils;
import com.example.layerflow.validation.ValidationRules;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Terminal stage of the fact-check pipeline. Rewrites the answer sentence by sentence:
 * inaccurate claims are replaced by their correction, disputed ones get a caveat and
 * unsupported ones are softened.
 */
@Slf4j
public class FactCheckReviserLayer extends TerminalLayer {

    public static final String NAME = "fact-check-reviser";

    static final String DISPUTED_NOTE = " (this point is disputed)";
    static final String SOFTENER = ", although this could not be confirmed";

    public FactCheckReviserLayer(double maxDurationSeconds) {
        this(FactCheckContracts.reviser(maxDurationSeconds));
    }

    FactCheckReviserLayer(LayerExpectation expectation) {
        super(NAME, expectation);
        addOutputValidator(ValidationRules.notBlank("final_output"));
    }

    @Override
    protected Set<String> capabilities() {
        return Set.of("text_revision", "style_preservation");
    }

    @Override
    protected Mono<Map<String, Object>> doProcess(Map<String, Object> input) {
        return Mono.fromCallable(() -> {
            String original = input.get("answer") == null ? "" : String.valueOf(input.get("answer"));
            String assessment = String.valueOf(input.getOrDefault("overall_assessment", ""));
            double confidence = input.get("confidence_score") instanceof Number n ? n.doubleValue() : 0.0;

            String revised = original;
            List<String> changes = new ArrayList<>();
            for (ClaimVerification v : verificationsOf(input)) {
                String sentence = v.getClaim() == null ? null : v.getClaim().getText();
                if (v.getVerdict() == null || sentence == null || sentence.isBlank()) {
                    continue;
                }
                Matcher match = sentencePattern(sentence).matcher(revised);
                if (!match.find()) {
                    log.warn("[{}] claim not found in answer, left unrevised: {}", NAME, sentence);
                    continue;
                }
                String found = match.group();
                String replacement = switch (v.getVerdict()) {
                    case INACCURATE -> v.getCorrection() != null ? v.getCorrection() : found;
                    case DISPUTED -> withNote(found);
                    case UNSUPPORTED -> soften(found);
                    default -> null;
                };
                if (replacement == null) {
                    continue;
                }
                revised = revised.substring(0, match.start()) + replacement + revised.substring(match.end());
                changes.add(changeLabel(v.getVerdict()) + sentence);
            }

            Map<String, Object> out = new LinkedHashMap<>();
            out.put("final_output", revised);
            out.put("original_answer", original);
            out.put("changes_made", changes);
            out.put("revision_reasoning", reasoning(changes, assessment));
            out.put("quality_score", Math.min(1.0, confidence * 1.1));
            log.info("[{}] applied {} revisions", NAME, changes.size());
            return out;
        });
    }

    /** Matches the sentence in the answer, tolerating different whitespace between words. */
    static Pattern sentencePattern(String sentence) {
        return Pattern.compile(Arrays.stream(sentence.strip().split("\\s+"))
                .map(Pattern::quote)
                .collect(Collectors.joining("\\s+")));
    }

    private static String changeLabel(Verdict verdict) {
        return switch (verdict) {
            case INACCURATE -> "Correct inaccurate claim: ";
            case DISPUTED -> "Add nuance to disputed claim: ";
            default -> "Soften unsupported claim: ";
        };
    }

    static String withNote(String sentence) {
        return insertBeforePunctuation(sentence, DISPUTED_NOTE);
    }

    static String soften(String sentence) {
        if (sentence.contains(SOFTENER)) {
            return sentence;
        }
        return insertBeforePunctuation(sentence, SOFTENER);
    }

    private static String insertBeforePunctuation(String sentence, String insert) {
        int end = sentence.length();
        while (end > 0 && ".!?".indexOf(sentence.charAt(end - 1)) >= 0) {
            end--;
        }
        return sentence.substring(0, end) + insert + sentence.substring(end);
    }

    private static String reasoning(List<String> changes, String assessment) {
        if (changes.isEmpty()) {
            return "No revisions needed. " + assessment;
        }
        return "Made " + changes.size() + " revisions based on fact-checking analysis: " + assessment
                + ". Changes: " + String.join(", ", changes);
    }

    private static List<ClaimVerification> verificationsOf(Map<String, Object> input) {
        Object raw = input.get("verifications");
        if (!(raw instanceof Collection<?> items)) {
            return List.of();
        }
        List<ClaimVerification> result = new ArrayList<>();
        for (Object item : items) {
            if (item instanceof Map<?, ?> map) {
                @SuppressWarnings("unchecked")
                Map<String, Object> typed = (Map<String, Object>) map;
                result.add(PayloadUtils.fromPayload(typed, ClaimVerification.class));
            }
        }
        return result;
    }
}
