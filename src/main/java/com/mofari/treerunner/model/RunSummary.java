package com.mofari.treerunner.model;

import com.mofari.treerunner.model.coverage.CoverageReport;

import java.util.ArrayList;
import java.util.List;

public class RunSummary {
    private String runId;
    private String pattern; // null when the whole tree ran
    private String startedAt;
    private double durationSeconds;
    private int verbosity;
    private int totalTests;
    private int passed;
    private int errors;
    private int notRun;
    private List<ErrorDetail> errorDetails = new ArrayList<>();
    private CoverageReport coverage; // Only set when coverage was requested
    private String output;
    private String reportFile;

    public boolean isSuccessful() {
        return errorDetails.isEmpty();
    }

    // Getters and Setters
    public String getRunId() {
        return runId;
    }

    public void setRunId(String runId) {
        this.runId = runId;
    }

    public String getPattern() {
        return pattern;
    }

    public void setPattern(String pattern) {
        this.pattern = pattern;
    }

    public String getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(String startedAt) {
        this.startedAt = startedAt;
    }

    public double getDurationSeconds() {
        return durationSeconds;
    }

    public void setDurationSeconds(double durationSeconds) {
        this.durationSeconds = durationSeconds;
    }

    public int getVerbosity() {
        return verbosity;
    }

    public void setVerbosity(int verbosity) {
        this.verbosity = verbosity;
    }

    public int getTotalTests() {
        return totalTests;
    }

    public void setTotalTests(int totalTests) {
        this.totalTests = totalTests;
    }

    public int getPassed() {
        return passed;
    }

    public void setPassed(int passed) {
        this.passed = passed;
    }

    public int getErrors() {
        return errors;
    }

    public void setErrors(int errors) {
        this.errors = errors;
    }

    public int getNotRun() {
        return notRun;
    }

    public void setNotRun(int notRun) {
        this.notRun = notRun;
    }

    public List<ErrorDetail> getErrorDetails() {
        return errorDetails;
    }

    public void setErrorDetails(List<ErrorDetail> errorDetails) {
        this.errorDetails = errorDetails;
    }

    public CoverageReport getCoverage() {
        return coverage;
    }

    public void setCoverage(CoverageReport coverage) {
        this.coverage = coverage;
    }

    public String getOutput() {
        return output;
    }

    public void setOutput(String output) {
        this.output = output;
    }

    public String getReportFile() {
        return reportFile;
    }

    public void setReportFile(String reportFile) {
        this.reportFile = reportFile;
    }
}
