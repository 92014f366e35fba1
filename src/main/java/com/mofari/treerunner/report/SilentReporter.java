package com.mofari.treerunner.report;

import com.mofari.treerunner.tree.TestNode;

public class SilentReporter implements Reporter {

    @Override
    public void onNodeStart(TestNode node) {
    }

    @Override
    public void onNodeError(TestNode node) {
    }

    @Override
    public void onNodePass(TestNode node) {
    }

    @Override
    public void onFinal(TestNode root) {
    }
}
