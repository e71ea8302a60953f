package com.example.layerflow.factcheck;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rule-based sentence splitter that turns an answer into checkable claims. Opinion sentences
 * are kept but marked, only factual ones count toward the claims to verify.
 */
public class ClaimExtractor {

    private static final Pattern SENTENCE_SPLIT = Pattern.compile("(?<=[.!?])\\s+");
    private static final Pattern HAS_DIGIT = Pattern.compile("\\d");
    private static final Pattern NON_WORD = Pattern.compile("[^a-z0-9']+");
    private static final Pattern PROPER_NOUN = Pattern.compile("\\s[A-Z][a-z]+");
    private static final Set<String> OPINION_MARKERS = Set.of(
            "i think", "i believe", "in my opinion", "should", "probably", "might", "maybe", "best", "worst"
    );
    private static final Set<String> FACT_VERBS = Set.of(
            " is ", " are ", " was ", " were ", " has ", " have ", " had ", " contains ", " equals "
    );
    private static final int MIN_WORDS = 3;

    private final int maxClaims;

    public ClaimExtractor(int maxClaims) {
        this.maxClaims = maxClaims;
    }

    public List<Claim> extract(String answer, String question) {
        List<Claim> claims = new ArrayList<>();
        if (answer == null || answer.isBlank()) {
            return claims;
        }
        for (String raw : SENTENCE_SPLIT.split(answer.strip())) {
            String sentence = raw.strip();
            if (sentence.split("\\s+").length < MIN_WORDS) {
                continue;
            }
            String type = classify(sentence);
            claims.add(Claim.builder()
                    .text(sentence)
                    .context(question == null ? "" : question)
                    .claimType(type)
                    .sourceSentence(sentence)
                    .importance(importance(sentence, type))
                    .build());
            if (claims.size() >= maxClaims) {
                break;
            }
        }
        return claims;
    }

    static String classify(String sentence) {
        String words = " " + NON_WORD.matcher(sentence.toLowerCase(Locale.ROOT)).replaceAll(" ") + " ";
        for (String marker : OPINION_MARKERS) {
            if (words.contains(" " + marker + " ")) {
                return "opinion";
            }
        }
        return "factual";
    }

    private static double importance(String sentence, String type) {
        if (!"factual".equals(type)) {
            return 0.2;
        }
        double score = 0.5;
        if (HAS_DIGIT.matcher(sentence).find()) score += 0.3;
        if (PROPER_NOUN.matcher(sentence).find()) score += 0.1;
        String lower = " " + sentence.toLowerCase(Locale.ROOT) + " ";
        if (FACT_VERBS.stream().anyMatch(lower::contains)) score += 0.1;
        return Math.min(1.0, score);
    }
}
