package com.mofari.treerunner.tree;

public final class OkOutcome extends Outcome {

    private final double durationSeconds;

    public OkOutcome(TestNode node, Phase phase, double durationSeconds) {
        super(node, phase);
        this.durationSeconds = durationSeconds;
    }

    public double getDurationSeconds() {
        return durationSeconds;
    }

    @Override
    public boolean isError() {
        return false;
    }

    @Override
    public String toString() {
        return String.format("OK(%s, %.3fs)", getPhase().getHookName(), durationSeconds);
    }
}
