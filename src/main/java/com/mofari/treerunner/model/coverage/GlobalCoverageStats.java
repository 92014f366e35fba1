package com.mofari.treerunner.model.coverage;

public class GlobalCoverageStats {
    private long statementsRun;
    private long totalStatements;
    private double percentage;

    public GlobalCoverageStats() {
        this.statementsRun = 0;
        this.totalStatements = 0;
        this.percentage = 0.0;
    }

    public GlobalCoverageStats(long statementsRun, long totalStatements) {
        this.statementsRun = statementsRun;
        this.totalStatements = totalStatements;
        calculatePercentage();
    }

    public void calculatePercentage() {
        if (this.totalStatements == 0) {
            // nothing tracked at all, unlike an empty file which counts as fully covered
            this.percentage = 0.0;
        } else {
            this.percentage = (double) this.statementsRun / this.totalStatements * 100.0;
        }
    }

    // Getters and Setters
    public long getStatementsRun() {
        return statementsRun;
    }

    public void setStatementsRun(long statementsRun) {
        this.statementsRun = statementsRun;
    }

    public long getTotalStatements() {
        return totalStatements;
    }

    public void setTotalStatements(long totalStatements) {
        this.totalStatements = totalStatements;
    }

    public double getPercentage() {
        return percentage;
    }

    public void setPercentage(double percentage) {
        this.percentage = percentage;
    }
}
