package com.mofari.treerunner.tree;

import com.mofari.treerunner.report.Reporter;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * 单个可执行测试：包装一个 {@link TestFunction}，
 * 或者由子类重写 {@link #call()}。
 */
public class TestCase extends TestNode {

    private final TestFunction body;
    private Outcome callState;

    public TestCase(String name, TestFunction body) {
        super(Objects.requireNonNull(name, "name"));
        this.body = Objects.requireNonNull(body, "body");
    }

    protected TestCase(String name) {
        super(Objects.requireNonNull(name, "name"));
        this.body = null;
    }

    /**
     * 测试主体；抛出的任何异常都记录为该节点的 call 结果
     */
    protected void call() throws Exception {
        if (body == null) {
            throw new UnsupportedOperationException("Test '" + getName() + "' has no body");
        }
        body.run();
    }

    @Override
    public TestNode addChild(TestNode child) {
        throw new UnsupportedOperationException("A test case cannot have children: " + fullPath());
    }

    public Outcome getCallState() {
        return callState;
    }

    @Override
    protected List<Outcome> ownOutcomes() {
        return Arrays.asList(getSetUpState(), callState, getTearDownState());
    }

    @Override
    protected void clearOwnOutcomes() {
        callState = null;
    }

    @Override
    public RunStatus run(Reporter reporter) {
        reporter.onNodeStart(this);
        callState = invokePhase(Phase.CALL, this::call);
        if (callState.isError()) {
            reporter.onNodeError(this);
        } else {
            reporter.onNodePass(this);
        }
        return RunStatus.COMPLETED;
    }
}
