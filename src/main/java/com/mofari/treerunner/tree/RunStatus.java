package com.mofari.treerunner.tree;

/**
 * {@link TestNode#run} 的结果。节点自身的某个阶段在主体运行前失败时返回 {@link #SKIPPED}，
 * 外层 suite 继续运行下一个兄弟节点。
 */
public enum RunStatus {
    COMPLETED,
    SKIPPED
}
