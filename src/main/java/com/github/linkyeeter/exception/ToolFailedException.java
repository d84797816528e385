package com.github.linkyeeter.exception;

import java.io.IOException;

/**
 * An external tool ran but exited with a non-zero code.
 */
public class ToolFailedException extends IOException {

    private final String tool;
    private final int exitCode;

    public ToolFailedException(String tool, int exitCode) {
        super(tool + " exited with code " + exitCode);
        this.tool = tool;
        this.exitCode = exitCode;
    }

    public String getTool() {
        return tool;
    }

    public int getExitCode() {
        return exitCode;
    }
}
