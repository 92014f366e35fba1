package com.mofari.treerunner.service;

import com.mofari.treerunner.config.RunnerConfig;
import com.mofari.treerunner.loader.TestTreeLoader;
import com.mofari.treerunner.model.ErrorDetail;
import com.mofari.treerunner.model.RunSummary;
import com.mofari.treerunner.model.coverage.CoverageReport;
import com.mofari.treerunner.report.Reporter;
import com.mofari.treerunner.report.Reporters;
import com.mofari.treerunner.tree.ErrorOutcome;
import com.mofari.treerunner.tree.TestNode;
import com.mofari.treerunner.tree.TestSuite;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.text.SimpleDateFormat;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * 一次完整的测试运行：加载 → 选择/裁剪 → 执行 → 覆盖率 → 摘要落盘
 */
@Service
public class TestRunService {

    private static final Logger logger = LoggerFactory.getLogger(TestRunService.class);

    @Autowired
    private TestTreeLoader testTreeLoader;

    @Autowired
    private CoverageService coverageService;

    @Autowired
    private ReportWriterService reportWriterService;

    @Autowired
    private RunnerConfig runnerConfig;

    private volatile RunSummary latestSummary;

    /**
     * @param pattern   点分路径过滤，为空时运行整棵树
     * @param verbosity 输出级别，{@code null} 时使用配置值
     * @param coverage  是否收集本次运行的覆盖率
     */
    public synchronized RunSummary run(String pattern, Integer verbosity, boolean coverage) throws IOException {
        int level = verbosity != null ? verbosity : runnerConfig.getVerbosity();
        String runId = new SimpleDateFormat("yyyyMMdd_HHmmss_SSS").format(new Date());
        logger.info("开始测试运行 {}，pattern: {}, verbosity: {}, coverage: {}", runId, pattern, level, coverage);

        TestSuite root = select(testTreeLoader.load(), pattern);
        if (coverage) {
            coverageService.prepare();
        }

        StringWriter buffer = new StringWriter();
        PrintWriter out = new PrintWriter(buffer);
        Reporter reporter = Reporters.forVerbosity(level, out);

        String startedAt = LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        long start = System.nanoTime();
        root.execute(reporter);
        double duration = (System.nanoTime() - start) / 1_000_000_000.0;

        CoverageReport coverageReport = null;
        if (coverage) {
            coverageReport = coverageService.collect(runId);
            reporter.onCoverage(coverageReport);
        }
        out.flush();

        RunSummary summary = summarize(root, runId, pattern, level);
        summary.setStartedAt(startedAt);
        summary.setDurationSeconds(duration);
        summary.setCoverage(coverageReport);
        summary.setOutput(buffer.toString());
        summary.setReportFile(reportWriterService.writeSummary(summary));

        logger.info("测试运行 {} 完成: {} passed, {} errors, {} not run", runId,
                summary.getPassed(), summary.getErrors(), summary.getNotRun());
        latestSummary = summary;
        return summary;
    }

    public RunSummary getLatestSummary() {
        return latestSummary;
    }

    /**
     * 以缩进形式列出该过滤条件下将要执行的测试树
     */
    public String structure(String pattern) {
        return select(testTreeLoader.load(), pattern).structure();
    }

    private TestSuite select(TestSuite root, String pattern) {
        if (StringUtils.hasText(pattern)) {
            root.mark(pattern);
            root.prune();
        }
        return root;
    }

    RunSummary summarize(TestNode root, String runId, String pattern, int verbosity) {
        RunSummary summary = new RunSummary();
        summary.setRunId(runId);
        summary.setPattern(StringUtils.hasText(pattern) ? pattern : null);
        summary.setVerbosity(verbosity);
        summary.setPassed(root.allPassed().size());
        summary.setErrors(root.allError().size());
        summary.setNotRun(root.allNotRun().size());
        summary.setTotalTests(summary.getPassed() + summary.getErrors() + summary.getNotRun());

        List<ErrorDetail> details = new ArrayList<>();
        for (TestNode node : root.preOrder()) {
            if (!node.isSelected()) {
                continue;
            }
            for (ErrorOutcome error : node.getErrors()) {
                details.add(new ErrorDetail(node.fullPath(), error.getPhase().getHookName(),
                        error.getCause().getClass().getName(), error.getMessage(), error.getTraceLines()));
            }
        }
        summary.setErrorDetails(details);
        return summary;
    }
}
