package com.example.investigator.service;

/** Not even the rule-based tier could produce a verdict: a configuration or programming defect. */
public class SynthesisFailedException extends RuntimeException {

    public SynthesisFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
