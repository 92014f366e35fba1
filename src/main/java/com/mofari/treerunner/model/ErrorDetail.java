package com.mofari.treerunner.model;

import java.util.ArrayList;
import java.util.List;

public class ErrorDetail {
    private String nodePath;
    private String phase;
    private String exceptionType;
    private String message;
    private List<String> traceLines = new ArrayList<>();

    public ErrorDetail() {
    }

    public ErrorDetail(String nodePath, String phase, String exceptionType, String message, List<String> traceLines) {
        this.nodePath = nodePath;
        this.phase = phase;
        this.exceptionType = exceptionType;
        this.message = message;
        this.traceLines = traceLines;
    }

    // Getters and Setters
    public String getNodePath() {
        return nodePath;
    }

    public void setNodePath(String nodePath) {
        this.nodePath = nodePath;
    }

    public String getPhase() {
        return phase;
    }

    public void setPhase(String phase) {
        this.phase = phase;
    }

    public String getExceptionType() {
        return exceptionType;
    }

    public void setExceptionType(String exceptionType) {
        this.exceptionType = exceptionType;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public List<String> getTraceLines() {
        return traceLines;
    }

    public void setTraceLines(List<String> traceLines) {
        this.traceLines = traceLines;
    }
}
