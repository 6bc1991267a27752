package com.example.investigator.tools;

public class ToolCallException extends Exception {

    private final String tool;

    public ToolCallException(String tool, String message) {
        super(tool + ": " + message);
        this.tool = tool;
    }

    public ToolCallException(String tool, String message, Throwable cause) {
        super(tool + ": " + message, cause);
        this.tool = tool;
    }

    public String tool() {
        return tool;
    }
}
