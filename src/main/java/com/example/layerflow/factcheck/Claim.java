package com.example.layerflow.factcheck;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Claim {
    private String text;
    private String context;
    /** factual, opinion */
    private String claimType;
    private String sourceSentence;
    private double importance;
}
