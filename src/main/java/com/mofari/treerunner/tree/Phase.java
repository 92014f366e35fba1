package com.mofari.treerunner.tree;

/**
 * 结果可以对应的生命周期阶段
 */
public enum Phase {
    SET_UP_ALL("setUpAll"),
    SET_UP("setUp"),
    CALL("call"),
    TEAR_DOWN("tearDown"),
    TEAR_DOWN_ALL("tearDownAll");

    private final String hookName;

    Phase(String hookName) {
        this.hookName = hookName;
    }

    public String getHookName() {
        return hookName;
    }
}
