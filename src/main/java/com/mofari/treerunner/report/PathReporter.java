package com.mofari.treerunner.report;

import com.mofari.treerunner.tree.TestNode;

import java.io.PrintWriter;

/**
 * 输出每个测试的完整路径，后跟 OK 或 FAIL
 */
public class PathReporter implements Reporter {

    protected final PrintWriter out;

    public PathReporter(PrintWriter out) {
        this.out = out;
    }

    @Override
    public void onNodeStart(TestNode node) {
        out.print(node.fullPath() + " ...\t");
        out.flush();
    }

    @Override
    public void onNodeError(TestNode node) {
        out.print("FAIL\n");
        out.flush();
    }

    @Override
    public void onNodePass(TestNode node) {
        out.print("OK\n");
        out.flush();
    }

    @Override
    public void onFinal(TestNode root) {
        out.print('\n');
        out.flush();
    }
}
