package com.mofari.treerunner.tree;

import com.mofari.treerunner.report.Reporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 测试套件：包含子套件和叶子测试，并负责执行 setUpAll / setUp / tearDown / tearDownAll 钩子
 *
 * <p>运行时的阶段顺序：先执行一次 {@code setUpAll}，然后对每个选中的子节点依次执行
 * {@code setUp}、子节点本身和 {@code tearDown}，最后执行 {@code tearDownAll}。
 * 未配置的钩子不记录结果。
 *
 * <p>失败处理：
 * <ul>
 *     <li>setUpAll 失败：不运行任何子节点，也不执行 tearDownAll。</li>
 *     <li>setUp 失败：只跳过该子节点，后续兄弟节点照常运行。</li>
 *     <li>tearDown 失败：记录在该子节点上，放弃剩余兄弟节点；
 *     tearDownAll 仍然执行。</li>
 * </ul>
 */
public class TestSuite extends TestNode {

    private static final Logger logger = LoggerFactory.getLogger(TestSuite.class);

    private TestFunction setUpAll;
    private TestFunction setUp;
    private TestFunction tearDown;
    private TestFunction tearDownAll;

    private Outcome setUpAllState;
    private Outcome tearDownAllState;

    private enum StepResult {
        CONTINUE,
        ABORT
    }

    /**
     * 创建以类名命名的 suite
     */
    public TestSuite() {
        super(null);
        assignName(defaultName(getClass()));
    }

    /**
     * @param name 套件名称；传入 null 表示匿名套件
     */
    public TestSuite(String name, TestNode... children) {
        super(name);
        addChildren(children);
    }

    static String defaultName(Class<?> type) {
        Class<?> current = type;
        while (current.isAnonymousClass()) {
            current = current.getSuperclass();
        }
        return current.getSimpleName();
    }

    public static TestSuite anonymous(TestNode... children) {
        return new TestSuite(null, children);
    }

    // --- 声明 ---

    public TestSuite addTest(String name, TestFunction body) {
        addChild(new TestCase(name, body));
        return this;
    }

    public TestSuite withSetUpAll(TestFunction hook) {
        this.setUpAll = hook;
        return this;
    }

    public TestSuite withSetUp(TestFunction hook) {
        this.setUp = hook;
        return this;
    }

    public TestSuite withTearDown(TestFunction hook) {
        this.tearDown = hook;
        return this;
    }

    public TestSuite withTearDownAll(TestFunction hook) {
        this.tearDownAll = hook;
        return this;
    }

    public Outcome getSetUpAllState() {
        return setUpAllState;
    }

    public Outcome getTearDownAllState() {
        return tearDownAllState;
    }

    @Override
    protected List<Outcome> ownOutcomes() {
        return Arrays.asList(getSetUpState(), setUpAllState, tearDownAllState, getTearDownState());
    }

    @Override
    protected void clearOwnOutcomes() {
        setUpAllState = null;
        tearDownAllState = null;
    }

    // --- 执行 ---

    @Override
    public RunStatus run(Reporter reporter) {
        if (setUpAll != null) {
            setUpAllState = invokePhase(Phase.SET_UP_ALL, setUpAll);
            if (setUpAllState.isError()) {
                logger.warn("suite '{}' 的 setUpAll 失败，不运行任何子节点", fullPath());
                return RunStatus.SKIPPED;
            }
        }

        for (TestNode child : new ArrayList<>(getChildren())) {
            if (!child.isSelected()) {
                continue;
            }
            if (runChild(child, reporter) == StepResult.ABORT) {
                logger.warn("'{}' 的 tearDown 失败，'{}' 的剩余子节点不再运行",
                        child.fullPath(), fullPath());
                break;
            }
        }

        if (tearDownAll != null) {
            tearDownAllState = invokePhase(Phase.TEAR_DOWN_ALL, tearDownAll);
            if (tearDownAllState.isError()) {
                logger.warn("suite '{}' 的 tearDownAll 失败", fullPath());
            }
        }
        return RunStatus.COMPLETED;
    }

    private StepResult runChild(TestNode child, Reporter reporter) {
        if (setUp != null) {
            Outcome outcome = invokePhase(Phase.SET_UP, setUp);
            child.recordSetUp(outcome);
            if (outcome.isError()) {
                logger.debug("'{}' 的 setUp 失败，跳过该节点", child.fullPath());
                return StepResult.CONTINUE;
            }
        }

        RunStatus status = child.run(reporter);
        if (status == RunStatus.SKIPPED) {
            logger.debug("'{}' 已跳过", child.fullPath());
        }

        if (tearDown != null) {
            Outcome outcome = invokePhase(Phase.TEAR_DOWN, tearDown);
            child.recordTearDown(outcome);
            if (outcome.isError()) {
                return StepResult.ABORT;
            }
        }
        return StepResult.CONTINUE;
    }
}
