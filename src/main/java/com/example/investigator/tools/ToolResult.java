package com.example.investigator.tools;

public record ToolResult(String tool, String output) {

    public ToolResult {
        output = output == null ? "" : output;
    }

    /** Output cut to at most {@code maxChars}, for evidence excerpts and prompts. */
    public String excerpt(int maxChars) {
        return output.length() <= maxChars ? output : output.substring(0, maxChars);
    }
}
