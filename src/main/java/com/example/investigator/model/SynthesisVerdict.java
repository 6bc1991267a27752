package com.example.investigator.model;

/** Structured output the synthesis models are asked to produce. */
public record SynthesisVerdict(
        String verdict, Double confidence, String synthesis, String suggestedAction) {}
