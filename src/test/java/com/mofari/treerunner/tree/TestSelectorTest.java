package com.mofari.treerunner.tree;

import com.mofari.treerunner.report.SilentReporter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TestSelectorTest {

    private final List<String> ran = new ArrayList<>();
    private TestSuite root;

    // root
    //   one
    //     two: test_a, test_b
    //     three: test_c
    //   four: test_d
    @BeforeEach
    public void buildTree() {
        TestSuite two = new TestSuite("two").addTest("test_a", run("a")).addTest("test_b", run("b"));
        TestSuite three = new TestSuite("three").addTest("test_c", run("c"));
        TestSuite four = new TestSuite("four").addTest("test_d", run("d"));
        root = TestSuite.anonymous(new TestSuite("one", two, three), four);
    }

    private TestFunction run(String name) {
        return () -> ran.add(name);
    }

    private static List<String> paths(List<? extends TestNode> nodes) {
        List<String> paths = new ArrayList<>();
        for (TestNode node : nodes) {
            paths.add(node.fullPath());
        }
        return paths;
    }

    @Test
    public void markSelectsAncestorsAndDescendantsOfMatches() {
        List<TestNode> matches = TestSelector.mark(root, "two");

        assertEquals(Arrays.asList("one.two"), paths(matches));
        List<String> selected = new ArrayList<>();
        for (TestNode node : root.preOrder()) {
            if (node.isSelected()) {
                selected.add(node.fullPath());
            }
        }
        assertEquals(Arrays.asList("", "one", "one.two", "one.two.test_a", "one.two.test_b"), selected);
    }

    @Test
    public void markThenPruneKeepsOnlyTheMatchedBranch() {
        root.mark("two.test_a");
        root.prune();

        assertEquals(Arrays.asList("one.two.test_a"), paths(root.tests()));
        assertEquals(4, root.count());

        root.run(new SilentReporter());
        assertEquals(Arrays.asList("a"), ran);
    }

    @Test
    public void leafAndSuiteMatchesArePrunedAlike() {
        root.mark("test_c");
        root.prune();
        assertEquals(Arrays.asList("one.three.test_c"), paths(root.tests()));

        buildTree();
        root.mark("four");
        root.prune();
        assertEquals(Arrays.asList("four.test_d"), paths(root.tests()));
    }

    @Test
    public void patternMatchingSeveralNodes() {
        TestSuite extra = new TestSuite("two").addTest("test_e", run("e"));
        root.addChild(extra);

        List<TestNode> matches = TestSelector.mark(root, "two");
        root.prune();

        assertEquals(2, matches.size());
        assertEquals(Arrays.asList("one.two.test_a", "one.two.test_b", "two.test_e"), paths(root.tests()));
    }

    @Test
    public void unknownPatternPrunesEverythingButTheRoot() {
        root.mark("does.not.exist");
        root.prune();

        assertTrue(root.getChildren().isEmpty());
        assertEquals(1, root.count());
        assertFalse(root.hasTests());
    }

    @Test
    public void markWithoutPruneSkipsUnselectedTests() {
        root.mark("one.three");

        root.run(new SilentReporter());

        assertEquals(Arrays.asList("c"), ran);
        assertEquals(1, root.allPassed().size());
        assertTrue(root.allNotRun().isEmpty());
    }

    @Test
    public void remarkingClearsPreviousSelection() {
        root.mark("two");
        root.mark("four");
        root.prune();

        assertEquals(Arrays.asList("four.test_d"), paths(root.tests()));
    }
}
