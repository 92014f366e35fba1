package com.mofari.treerunner.loader;

import com.mofari.treerunner.tree.TestNode;

/**
 * 注册测试树的一个顶层分支。实现类是 Spring bean，
 * 其 {@code @Order} 决定该分支在根节点下的位置。
 */
public interface SuiteProvider {

    /**
     * 构建新的分支；每次运行调用一次，运行结果不会在多次运行之间残留
     */
    TestNode createSuite();
}
