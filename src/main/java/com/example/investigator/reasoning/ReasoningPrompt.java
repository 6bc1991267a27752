package com.example.investigator.reasoning;

public record ReasoningPrompt(String system, String user) {}
