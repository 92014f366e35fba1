package com.mofari.treerunner.report;

import com.mofari.treerunner.model.coverage.CoverageReport;
import com.mofari.treerunner.tree.TestNode;

/**
 * 运行回调：每个叶子测试依次收到 onNodeStart、onNodeError/onNodePass 之一，整棵树运行结束后收到一次 onFinal
 */
public interface Reporter {

    void onNodeStart(TestNode node);

    void onNodeError(TestNode node);

    void onNodePass(TestNode node);

    void onFinal(TestNode root);

    /**
     * 本次运行收集了覆盖率时，在 {@link #onFinal} 之后调用
     */
    default void onCoverage(CoverageReport report) {
    }
}
