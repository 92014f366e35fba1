package com.mofari.treerunner.tree;

import com.mofari.treerunner.report.Reporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * 测试树节点基类，套件和叶子测试都继承自它
 *
 * <p>节点拥有其子节点；指向父节点的引用只是反向引用，用于构建路径、命名空间向上查找和移除。
 * 每个节点还保存父节点为它执行 setUp 和 tearDown 阶段时记录的结果。
 */
public abstract class TestNode {

    private static final Logger logger = LoggerFactory.getLogger(TestNode.class);

    private String name;
    private TestNode parent;
    private final List<TestNode> children = new ArrayList<>();
    private final Map<String, Object> namespace = new HashMap<>();
    private boolean selected = true;

    private Outcome setUpState;
    private Outcome tearDownState;

    /**
     * @param name 节点名称，为 null 时节点匿名，不参与路径拼接
     */
    protected TestNode(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    void assignName(String name) {
        this.name = name;
    }

    public TestNode getParent() {
        return parent;
    }

    public List<TestNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public boolean isSelected() {
        return selected;
    }

    void setSelected(boolean selected) {
        this.selected = selected;
    }

    /**
     * 把子节点追加到末尾；如果它已有父节点，先从原父节点移除
     */
    public TestNode addChild(TestNode child) {
        Objects.requireNonNull(child, "child");
        if (child == this || isDescendantOf(child)) {
            throw new IllegalArgumentException("Cannot attach a node below itself: " + child.fullPath());
        }
        if (child.parent != null) {
            child.remove();
        }
        child.parent = this;
        children.add(child);
        return this;
    }

    public TestNode addChildren(TestNode... nodes) {
        for (TestNode node : nodes) {
            addChild(node);
        }
        return this;
    }

    /**
     * 把该节点（连同子树）从父节点移除；根节点上调用无效果
     */
    public void remove() {
        if (parent != null) {
            parent.children.remove(this);
            parent = null;
        }
    }

    private boolean isDescendantOf(TestNode candidate) {
        for (TestNode p = parent; p != null; p = p.parent) {
            if (p == candidate) {
                return true;
            }
        }
        return false;
    }

    public TestNode getRoot() {
        TestNode node = this;
        while (node.parent != null) {
            node = node.parent;
        }
        return node;
    }

    public List<TestNode> pathFromRoot() {
        List<TestNode> path = new ArrayList<>();
        for (TestNode node = this; node != null; node = node.parent) {
            path.add(node);
        }
        Collections.reverse(path);
        return path;
    }

    public List<TestNode> preOrder() {
        List<TestNode> nodes = new ArrayList<>();
        collectPreOrder(nodes);
        return nodes;
    }

    private void collectPreOrder(List<TestNode> nodes) {
        nodes.add(this);
        for (TestNode child : children) {
            child.collectPreOrder(nodes);
        }
    }

    public List<TestNode> postOrder() {
        List<TestNode> nodes = new ArrayList<>();
        collectPostOrder(nodes);
        return nodes;
    }

    private void collectPostOrder(List<TestNode> nodes) {
        for (TestNode child : children) {
            child.collectPostOrder(nodes);
        }
        nodes.add(this);
    }

    public int count() {
        return preOrder().size();
    }

    // --- 路径 ---

    public List<String> fullPathParts() {
        List<String> parts = new ArrayList<>();
        for (TestNode node : pathFromRoot()) {
            if (node.name != null && !node.name.isEmpty()) {
                parts.add(node.name);
            }
        }
        return parts;
    }

    public String fullPath() {
        return String.join(".", fullPathParts());
    }

    /**
     * 在后代节点中按点分路径做部分匹配。匹配的子节点直接返回，不再深入；
     * 不匹配的子节点继续递归查找。
     */
    public List<TestNode> search(String pattern) {
        String wrapped = "." + pattern + ".";
        List<TestNode> found = new ArrayList<>();
        for (TestNode child : children) {
            if (("." + child.fullPath() + ".").contains(wrapped)) {
                found.add(child);
            } else {
                found.addAll(child.search(pattern));
            }
        }
        return found;
    }

    public void mark(String pattern) {
        TestSelector.mark(this, pattern);
    }

    public void prune() {
        TestSelector.prune(this);
    }

    /**
     * 以缩进形式列出所有命名节点，每层缩进4个空格
     */
    public String structure() {
        StringBuilder sb = new StringBuilder();
        for (TestNode node : preOrder()) {
            if (node.name == null || node.name.isEmpty()) {
                continue;
            }
            int depth = node.fullPathParts().size() - 1;
            char[] indent = new char[depth * 4];
            Arrays.fill(indent, ' ');
            sb.append(indent).append(node.name).append(System.lineSeparator());
        }
        return sb.toString();
    }

    // --- 命名空间 ---

    public void put(String key, Object value) {
        namespace.put(key, value);
    }

    /**
     * 先在本节点查找键，再依次在各祖先节点查找
     *
     * @throws NotFoundException 到根节点的路径上没有任何节点定义该键
     */
    @SuppressWarnings("unchecked")
    public <T> T get(String key) {
        for (TestNode node = this; node != null; node = node.parent) {
            if (node.namespace.containsKey(key)) {
                return (T) node.namespace.get(key);
            }
        }
        throw new NotFoundException(key);
    }

    public boolean containsKey(String key) {
        for (TestNode node = this; node != null; node = node.parent) {
            if (node.namespace.containsKey(key)) {
                return true;
            }
        }
        return false;
    }

    // --- 测试与结果查询 ---

    public List<TestCase> tests() {
        List<TestCase> tests = new ArrayList<>();
        for (TestNode node : preOrder()) {
            if (node instanceof TestCase) {
                tests.add((TestCase) node);
            }
        }
        return tests;
    }

    /**
     * 子树中是否至少有一个被选中的叶子节点
     */
    public boolean hasTests() {
        for (TestCase test : tests()) {
            if (test.isSelected()) {
                return true;
            }
        }
        return false;
    }

    public List<TestCase> allPassed() {
        return selectedTests(TestNode::isPassed);
    }

    public List<TestCase> allError() {
        return selectedTests(TestNode::isError);
    }

    public List<TestCase> allNotRun() {
        return selectedTests(TestNode::isNotRun);
    }

    private List<TestCase> selectedTests(Predicate<TestNode> predicate) {
        List<TestCase> result = new ArrayList<>();
        for (TestCase test : tests()) {
            if (test.isSelected() && predicate.test(test)) {
                result.add(test);
            }
        }
        return result;
    }

    public Outcome getSetUpState() {
        return setUpState;
    }

    public Outcome getTearDownState() {
        return tearDownState;
    }

    void recordSetUp(Outcome outcome) {
        this.setUpState = outcome;
    }

    void recordTearDown(Outcome outcome) {
        this.tearDownState = outcome;
    }

    /**
     * 本节点拥有的结果字段，按阶段顺序排列；未执行的阶段为 {@code null}
     */
    protected List<Outcome> ownOutcomes() {
        return Arrays.asList(setUpState, tearDownState);
    }

    public boolean isError() {
        for (Outcome outcome : ownOutcomes()) {
            if (outcome != null && outcome.isError()) {
                return true;
            }
        }
        return false;
    }

    public boolean isNotRun() {
        for (Outcome outcome : ownOutcomes()) {
            if (outcome != null) {
                return false;
            }
        }
        return true;
    }

    public boolean isPassed() {
        return !isError() && !isNotRun();
    }

    /**
     * @throws IllegalStateException 节点没有记录任何错误
     */
    public ErrorOutcome getError() {
        List<ErrorOutcome> errors = getErrors();
        if (errors.isEmpty()) {
            throw new IllegalStateException("no error for this node: " + fullPath());
        }
        return errors.get(0);
    }

    /**
     * 本节点拥有的所有错误结果，顺序同 {@link #ownOutcomes()}
     */
    public List<ErrorOutcome> getErrors() {
        List<ErrorOutcome> errors = new ArrayList<>();
        for (Outcome outcome : ownOutcomes()) {
            if (outcome != null && outcome.isError()) {
                errors.add((ErrorOutcome) outcome);
            }
        }
        return errors;
    }

    /**
     * 清除整棵子树记录的结果，以便再次运行
     */
    public void resetOutcomes() {
        for (TestNode node : preOrder()) {
            node.setUpState = null;
            node.tearDownState = null;
            node.clearOwnOutcomes();
        }
    }

    protected abstract void clearOwnOutcomes();

    // --- 执行 ---

    /**
     * 运行本节点；失败不会向外抛出，而是记录为 {@link ErrorOutcome}
     */
    public abstract RunStatus run(Reporter reporter);

    /**
     * 运行本节点下的测试树，然后交给 {@link Reporter#onFinal}
     */
    public RunStatus execute(Reporter reporter) {
        logger.debug("开始运行测试树，根节点: '{}'", fullPath());
        RunStatus status = run(reporter);
        reporter.onFinal(this);
        return status;
    }

    /**
     * 执行一个生命周期阶段，并把结果转换为本节点拥有的 outcome
     */
    protected Outcome invokePhase(Phase phase, TestFunction function) {
        long start = System.nanoTime();
        try {
            function.run();
        } catch (OutOfMemoryError e) {
            throw e;
        } catch (Throwable t) {
            if (t instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            logger.debug("{} 执行失败，节点 '{}': {}", phase.getHookName(), fullPath(), t.toString());
            return new ErrorOutcome(this, phase, t);
        }
        double seconds = (System.nanoTime() - start) / 1_000_000_000.0;
        return new OkOutcome(this, phase, seconds);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + fullPath() + ")";
    }
}
