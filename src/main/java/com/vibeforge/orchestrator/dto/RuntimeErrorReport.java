package com.vibeforge.orchestrator.dto;

/** Body of the host's runtime-error channel. */
public class RuntimeErrorReport {

    private String errorText;

    public RuntimeErrorReport() {
    }

    public RuntimeErrorReport(String errorText) {
        this.errorText = errorText;
    }

    public String getErrorText()               { return errorText; }
    public void   setErrorText(String errorText) { this.errorText = errorText; }
}
