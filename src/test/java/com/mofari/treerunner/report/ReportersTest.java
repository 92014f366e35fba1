package com.mofari.treerunner.report;

import com.mofari.treerunner.coverage.LineRange;
import com.mofari.treerunner.model.coverage.CoverageReport;
import com.mofari.treerunner.model.coverage.FileCoverageStats;
import com.mofari.treerunner.model.coverage.GlobalCoverageStats;
import com.mofari.treerunner.tree.TestSuite;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ReportersTest {

    private StringWriter buffer;
    private PrintWriter out;

    @BeforeEach
    public void setUp() {
        buffer = new StringWriter();
        out = new PrintWriter(buffer);
    }

    private static TestSuite passAndFail() {
        return new TestSuite("s")
                .addTest("a", () -> {
                })
                .addTest("b", () -> {
                    throw new AssertionError("expected 1 but was 2");
                });
    }

    @Test
    public void verbosityLevels() {
        assertInstanceOf(SilentReporter.class, Reporters.forVerbosity(-1, out));
        assertInstanceOf(SilentReporter.class, Reporters.forVerbosity(0, out));
        assertInstanceOf(DotReporter.class, Reporters.forVerbosity(1, out));
        assertEquals(PathReporter.class, Reporters.forVerbosity(2, out).getClass());
        assertInstanceOf(VerboseReporter.class, Reporters.forVerbosity(3, out));
        assertInstanceOf(VerboseReporter.class, Reporters.forVerbosity(7, out));
    }

    @Test
    public void silentPrintsNothing() {
        passAndFail().execute(Reporters.forVerbosity(0, out));

        assertEquals("", buffer.toString());
    }

    @Test
    public void dotPerTest() {
        passAndFail().execute(new DotReporter(out));

        assertEquals(".E\n", buffer.toString());
    }

    @Test
    public void pathAndResultPerTest() {
        passAndFail().execute(new PathReporter(out));

        assertEquals("s.a ...\tOK\ns.b ...\tFAIL\n\n", buffer.toString());
    }

    @Test
    public void verboseSummaryListsCountsAndErrors() {
        passAndFail().execute(new VerboseReporter(out));

        String text = buffer.toString();
        assertTrue(text.startsWith("s.a ...\tOK\ns.b ...\tFAIL\n"));
        assertTrue(text.contains("s.b [call]"));
        assertTrue(text.contains("expected 1 but was 2"));
        assertTrue(text.contains("Ran 2 tests: 1 passed, 1 errors, 0 not run"));
        assertTrue(text.contains("FAILED (1 nodes with errors)"));
    }

    @Test
    public void verboseSummaryOfCleanRun() {
        new TestSuite("s").addTest("a", () -> {
        }).execute(new VerboseReporter(out));

        assertTrue(buffer.toString().contains("Ran 1 tests: 1 passed, 0 errors, 0 not run"));
        assertTrue(buffer.toString().trim().endsWith("OK"));
    }

    @Test
    public void verboseCoverageTable() {
        CoverageReport report = new CoverageReport();
        report.setFiles(Arrays.asList(
                new FileCoverageStats("/src/Foo.java", 10, 7, 70.0,
                        Arrays.asList(LineRange.of(3, 5))),
                new FileCoverageStats("/src/Bar.java", 4, 4, 100.0, Collections.emptyList())));
        report.setGlobalStats(new GlobalCoverageStats(11, 14));

        new VerboseReporter(out).onCoverage(report);

        String text = buffer.toString();
        assertTrue(text.contains("/src/Foo.java"));
        assertTrue(text.contains("70.0%"));
        assertTrue(text.contains("3-5"));
        assertTrue(text.contains("TOTAL"));
        assertTrue(text.contains("78.6%"));
    }

    @Test
    public void nonVerboseReportersIgnoreCoverage() {
        new DotReporter(out).onCoverage(new CoverageReport());

        assertEquals("", buffer.toString());
    }
}
