package com.mofari.treerunner.tree;

/**
 * 测试体或生命周期钩子，允许抛出任意异常
 */
@FunctionalInterface
public interface TestFunction {

    void run() throws Exception;
}
