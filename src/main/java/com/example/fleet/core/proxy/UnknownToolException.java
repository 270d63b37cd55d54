package com.example.fleet.core.proxy;

public class UnknownToolException extends ToolCallException {

    public UnknownToolException(String toolName) {
        super("unknown tool: " + toolName);
    }
}
