package com.mofari.treerunner.tree;

/**
 * 单个节点在某个生命周期阶段的执行结果，创建后不可变
 */
public abstract class Outcome {

    private final TestNode node;
    private final Phase phase;

    protected Outcome(TestNode node, Phase phase) {
        this.node = node;
        this.phase = phase;
    }

    /**
     * 产生该结果的节点。setUp/tearDown 的结果由 suite 产生，
     * 但记录在子节点上。
     */
    public TestNode getNode() {
        return node;
    }

    public Phase getPhase() {
        return phase;
    }

    public abstract boolean isError();
}
