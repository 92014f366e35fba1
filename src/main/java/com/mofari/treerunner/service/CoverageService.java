package com.mofari.treerunner.service;

import com.mofari.treerunner.config.RunnerConfig;
import com.mofari.treerunner.coverage.CoverageAggregator;
import com.mofari.treerunner.coverage.ExclusionScanner;
import com.mofari.treerunner.coverage.StaticLineIndex;
import com.mofari.treerunner.coverage.jacoco.JaCoCoLineHitRecorder;
import com.mofari.treerunner.coverage.jacoco.JaCoCoLineIndex;
import com.mofari.treerunner.model.coverage.CoverageReport;
import org.jacoco.core.data.ExecutionDataStore;
import org.jacoco.core.data.SessionInfoStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * 覆盖率会话：运行前重置 agent，运行后收集执行数据并聚合为覆盖率报告
 */
@Service
public class CoverageService {

    private static final Logger logger = LoggerFactory.getLogger(CoverageService.class);

    @Autowired
    private RunnerConfig runnerConfig;

    @Autowired
    private ExecutionDataService executionDataService;

    @Autowired
    private ReportWriterService reportWriterService;

    /**
     * 重置 agent 开始新的会话，之前的流量不计入本次运行
     */
    public void prepare() throws IOException {
        if (runnerConfig.isUseAgent()) {
            executionDataService.resetAgent();
        }
    }

    public CoverageReport collect(String runId) throws IOException {
        SessionInfoStore sessionInfoStore = new SessionInfoStore();
        ExecutionDataStore executionDataStore = runnerConfig.isUseAgent()
                ? executionDataService.dumpFromAgent(false, sessionInfoStore)
                : executionDataService.loadDumpFiles(sessionInfoStore);

        List<String> classDirs = runnerConfig.resolveClassDirectories();
        List<String> sourceDirs = runnerConfig.resolveSourceDirectories();
        logger.info("开始聚合覆盖率，class目录数: {}，源码目录数: {}",
                classDirs.size(), sourceDirs.size());

        CoverageAggregator aggregator = createAggregator(new JaCoCoLineIndex(classDirs, sourceDirs));
        aggregator.integrate(new JaCoCoLineHitRecorder(executionDataStore, classDirs, sourceDirs));
        CoverageReport report = buildReport(aggregator);

        if (runnerConfig.isHtmlReport()) {
            report.setHtmlReportPath(reportWriterService.writeHtmlReport(runId, executionDataStore, sessionInfoStore,
                    classDirs, sourceDirs));
        }
        return report;
    }

    public CoverageAggregator createAggregator(StaticLineIndex lineIndex) {
        return new CoverageAggregator(lineIndex, new ExclusionScanner(), runnerConfig.resolveCoveragePath(),
                runnerConfig.effectiveExcludePaths(), runnerConfig.sourceCharset());
    }

    public CoverageReport buildReport(CoverageAggregator aggregator) throws IOException {
        CoverageReport report = new CoverageReport();
        report.setCoveragePath(aggregator.getCoveragePath());
        report.setReportTimestamp(LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));
        report.setFiles(aggregator.perFileStats());
        report.setGlobalStats(aggregator.globalStats());
        report.setAnnotations(aggregator.annotations());
        logger.info("覆盖率: 已运行语句 {}/{}（{} 个文件）", report.getGlobalStats().getStatementsRun(),
                report.getGlobalStats().getTotalStatements(), report.getFiles().size());
        return report;
    }
}
