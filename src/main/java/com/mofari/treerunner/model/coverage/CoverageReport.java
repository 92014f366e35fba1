package com.mofari.treerunner.model.coverage;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class CoverageReport {
    private String coveragePath;
    private String reportTimestamp;
    private String htmlReportPath; // Only set when the JaCoCo HTML report was requested
    private GlobalCoverageStats globalStats;
    private List<FileCoverageStats> files = new ArrayList<>();
    private Map<String, List<String>> annotations = new LinkedHashMap<>();

    // Getters and Setters
    public String getCoveragePath() {
        return coveragePath;
    }

    public void setCoveragePath(String coveragePath) {
        this.coveragePath = coveragePath;
    }

    public String getReportTimestamp() {
        return reportTimestamp;
    }

    public void setReportTimestamp(String reportTimestamp) {
        this.reportTimestamp = reportTimestamp;
    }

    public String getHtmlReportPath() {
        return htmlReportPath;
    }

    public void setHtmlReportPath(String htmlReportPath) {
        this.htmlReportPath = htmlReportPath;
    }

    public GlobalCoverageStats getGlobalStats() {
        return globalStats;
    }

    public void setGlobalStats(GlobalCoverageStats globalStats) {
        this.globalStats = globalStats;
    }

    public List<FileCoverageStats> getFiles() {
        return files;
    }

    public void setFiles(List<FileCoverageStats> files) {
        this.files = files;
    }

    public Map<String, List<String>> getAnnotations() {
        return annotations;
    }

    public void setAnnotations(Map<String, List<String>> annotations) {
        this.annotations = annotations;
    }
}
