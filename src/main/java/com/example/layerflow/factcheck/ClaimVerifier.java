package com.example.layerflow.factcheck;

import java.util.Set;
import reactor.core.publisher.Mono;

/** Verifies a single claim against external knowledge. */
public interface ClaimVerifier {

    Mono<ClaimVerification> verify(Claim claim, String question);

    /** Capabilities advertised by layers that use this verifier. */
    default Set<String> capabilities() {
        return Set.of("claim_verification");
    }
}
