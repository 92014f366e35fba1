package com.mofari.treerunner.report;

import com.mofari.treerunner.tree.TestNode;

import java.io.PrintWriter;

/**
 * 每个测试输出一个字符：通过为 {@code .}，出错为 {@code E}
 */
public class DotReporter implements Reporter {

    protected final PrintWriter out;

    public DotReporter(PrintWriter out) {
        this.out = out;
    }

    @Override
    public void onNodeStart(TestNode node) {
    }

    @Override
    public void onNodeError(TestNode node) {
        out.print('E');
        out.flush();
    }

    @Override
    public void onNodePass(TestNode node) {
        out.print('.');
        out.flush();
    }

    @Override
    public void onFinal(TestNode root) {
        out.print('\n');
        out.flush();
    }
}
