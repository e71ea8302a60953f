package com.example.layerflow.factcheck;

import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClaimVerification {
    private Claim claim;
    private Verdict verdict;
    private double confidence;
    private String justification;
    /** Replacement sentence suggested for inaccurate claims, may be null. */
    private String correction;
    @Builder.Default
    private List<String> sources = new ArrayList<>();
}
