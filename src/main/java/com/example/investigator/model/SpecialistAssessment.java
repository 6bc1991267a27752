package com.example.investigator.model;

/**
 * Structured output a specialist model is asked to produce.
 *
 * @param status PASS (no issue in this domain), WARN or FAIL
 * @param confidence 0.0-1.0 confidence that the alert is a real, actionable problem
 */
public record SpecialistAssessment(
        String status, Double confidence, String summary, String recommendation) {}
