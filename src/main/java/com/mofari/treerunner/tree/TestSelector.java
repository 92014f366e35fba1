package com.mofari.treerunner.tree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 按路径子串选择测试，并裁剪掉没有被选中测试的分支
 */
public final class TestSelector {

    private static final Logger logger = LoggerFactory.getLogger(TestSelector.class);

    private TestSelector() {
    }

    /**
     * 先取消整棵树的选中状态，再选中所有匹配 {@code pattern} 的节点，连同其祖先（保证可达）
     * 和后代（匹配的 suite 完整运行）。
     *
     * @return 匹配的节点
     */
    public static List<TestNode> mark(TestNode root, String pattern) {
        for (TestNode node : root.preOrder()) {
            node.setSelected(false);
        }
        List<TestNode> matches = root.search(pattern);
        for (TestNode match : matches) {
            for (TestNode ancestor : match.pathFromRoot()) {
                ancestor.setSelected(true);
            }
            for (TestNode descendant : match.preOrder()) {
                descendant.setSelected(true);
            }
        }
        logger.debug("过滤条件 '{}' 匹配 {} 个节点，根节点: '{}'", pattern, matches.size(), root.fullPath());
        return matches;
    }

    /**
     * 自底向上移除子树中没有被选中测试的所有非根节点
     */
    public static void prune(TestNode root) {
        int removed = 0;
        for (TestNode node : root.postOrder()) {
            if (node != root && node.getParent() != null && !node.hasTests()) {
                node.remove();
                removed++;
            }
        }
        logger.debug("已剪除 {} 个节点，根节点: '{}'", removed, root.fullPath());
    }
}
