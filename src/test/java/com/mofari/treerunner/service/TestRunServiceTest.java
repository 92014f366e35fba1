package com.mofari.treerunner.service;

import com.mofari.treerunner.config.RunnerConfig;
import com.mofari.treerunner.loader.TestTreeLoader;
import com.mofari.treerunner.model.ErrorDetail;
import com.mofari.treerunner.model.RunSummary;
import com.mofari.treerunner.model.coverage.CoverageReport;
import com.mofari.treerunner.model.coverage.GlobalCoverageStats;
import com.mofari.treerunner.tree.TestSuite;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class TestRunServiceTest {

    @Mock
    private TestTreeLoader testTreeLoader;

    @Mock
    private CoverageService coverageService;

    @Mock
    private ReportWriterService reportWriterService;

    @Spy
    private RunnerConfig runnerConfig = new RunnerConfig();

    @InjectMocks
    private TestRunService testRunService;

    @BeforeEach
    public void setUp() {
        when(testTreeLoader.load()).thenAnswer(invocation -> tree());
    }

    private static TestSuite tree() {
        TestSuite orders = new TestSuite("orders")
                .addTest("create", () -> {
                })
                .addTest("cancel", () -> {
                    throw new IllegalStateException("order already shipped");
                });
        TestSuite users = new TestSuite("users").addTest("login", () -> {
        });
        return TestSuite.anonymous(orders, users);
    }

    @Test
    public void runSummarizesOutcomesAndWritesReport() throws IOException {
        when(reportWriterService.writeSummary(any(RunSummary.class))).thenReturn("/tmp/run.json");

        RunSummary summary = testRunService.run(null, 2, false);

        assertEquals(3, summary.getTotalTests());
        assertEquals(2, summary.getPassed());
        assertEquals(1, summary.getErrors());
        assertEquals(0, summary.getNotRun());
        assertFalse(summary.isSuccessful());
        assertNull(summary.getPattern());
        assertNull(summary.getCoverage());
        assertEquals("/tmp/run.json", summary.getReportFile());
        assertTrue(summary.getOutput().contains("orders.cancel ...\tFAIL"));
        assertSame(summary, testRunService.getLatestSummary());
        verifyNoInteractions(coverageService);
    }

    @Test
    public void errorDetailsCarryPathPhaseAndTrace() throws IOException {
        when(reportWriterService.writeSummary(any(RunSummary.class))).thenReturn("/tmp/run.json");

        RunSummary summary = testRunService.run(null, 0, false);

        assertEquals(1, summary.getErrorDetails().size());
        ErrorDetail detail = summary.getErrorDetails().get(0);
        assertEquals("orders.cancel", detail.getNodePath());
        assertEquals("call", detail.getPhase());
        assertEquals(IllegalStateException.class.getName(), detail.getExceptionType());
        assertEquals("order already shipped", detail.getMessage());
        assertEquals("java.lang.IllegalStateException: order already shipped", detail.getTraceLines().get(0));
        assertEquals("", summary.getOutput());
    }

    @Test
    public void patternNarrowsTheRun() throws IOException {
        when(reportWriterService.writeSummary(any(RunSummary.class))).thenReturn("/tmp/run.json");

        RunSummary summary = testRunService.run("users", null, false);

        assertEquals("users", summary.getPattern());
        assertEquals(1, summary.getTotalTests());
        assertTrue(summary.isSuccessful());
        // configured default verbosity prints dots
        assertEquals(".\n", summary.getOutput());
    }

    @Test
    public void coverageIsCollectedAfterTheRun() throws IOException {
        CoverageReport report = new CoverageReport();
        report.setGlobalStats(new GlobalCoverageStats(3, 4));
        report.setFiles(Collections.emptyList());
        when(coverageService.collect(anyString())).thenReturn(report);
        when(reportWriterService.writeSummary(any(RunSummary.class))).thenReturn("/tmp/run.json");

        RunSummary summary = testRunService.run("orders.create", 3, true);

        verify(coverageService).prepare();
        assertSame(report, summary.getCoverage());
        assertTrue(summary.getOutput().contains("TOTAL"));
        assertTrue(summary.getOutput().contains("75.0%"));
    }

    @Test
    public void structureFollowsThePattern() throws IOException {
        String nl = System.lineSeparator();

        assertEquals("users" + nl + "    login" + nl, testRunService.structure("login"));
        verify(reportWriterService, never()).writeSummary(any(RunSummary.class));
    }
}
