package com.mofari.treerunner.model.coverage;

import com.mofari.treerunner.coverage.LineRange;

import java.util.ArrayList;
import java.util.List;

public class FileCoverageStats {
    private String filePath;
    private int totalStatements;
    private int statementsRun;
    private double percentage;
    private List<LineRange> notRunRanges;

    public FileCoverageStats() {
        this.notRunRanges = new ArrayList<>();
    }

    public FileCoverageStats(String filePath, int totalStatements, int statementsRun, double percentage, List<LineRange> notRunRanges) {
        this.filePath = filePath;
        this.totalStatements = totalStatements;
        this.statementsRun = statementsRun;
        this.percentage = percentage;
        this.notRunRanges = notRunRanges;
    }

    public int getStatementsNotRun() {
        return totalStatements - statementsRun;
    }

    // Getters and Setters
    public String getFilePath() {
        return filePath;
    }

    public void setFilePath(String filePath) {
        this.filePath = filePath;
    }

    public int getTotalStatements() {
        return totalStatements;
    }

    public void setTotalStatements(int totalStatements) {
        this.totalStatements = totalStatements;
    }

    public int getStatementsRun() {
        return statementsRun;
    }

    public void setStatementsRun(int statementsRun) {
        this.statementsRun = statementsRun;
    }

    public double getPercentage() {
        return percentage;
    }

    public void setPercentage(double percentage) {
        this.percentage = percentage;
    }

    public List<LineRange> getNotRunRanges() {
        return notRunRanges;
    }

    public void setNotRunRanges(List<LineRange> notRunRanges) {
        this.notRunRanges = notRunRanges;
    }
}
