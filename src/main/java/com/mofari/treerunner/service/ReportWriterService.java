package com.mofari.treerunner.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.mofari.treerunner.config.RunnerConfig;
import com.mofari.treerunner.model.RunSummary;
import org.jacoco.core.analysis.Analyzer;
import org.jacoco.core.analysis.CoverageBuilder;
import org.jacoco.core.analysis.IBundleCoverage;
import org.jacoco.core.data.ExecutionDataStore;
import org.jacoco.core.data.SessionInfoStore;
import org.jacoco.report.DirectorySourceFileLocator;
import org.jacoco.report.FileMultiReportOutput;
import org.jacoco.report.IReportVisitor;
import org.jacoco.report.ISourceFileLocator;
import org.jacoco.report.MultiSourceFileLocator;
import org.jacoco.report.html.HTMLFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * 运行结果落盘：JSON 摘要，以及可选的 JaCoCo HTML 报告
 */
@Service
public class ReportWriterService {

    private static final Logger logger = LoggerFactory.getLogger(ReportWriterService.class);

    @Autowired
    private RunnerConfig runnerConfig;

    @Autowired
    private ObjectMapper objectMapper;

    /**
     * @return 写入的 {@code run_<id>.json} 的绝对路径
     */
    public String writeSummary(RunSummary summary) throws IOException {
        Path outputDir = Paths.get(runnerConfig.getReportOutputDirectory());
        Files.createDirectories(outputDir);
        Path reportFile = outputDir.resolve("run_" + summary.getRunId() + ".json");
        objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValue(reportFile.toFile(), summary);
        logger.info("运行摘要已写入: {}", reportFile.toAbsolutePath());
        return reportFile.toAbsolutePath().toString();
    }

    /**
     * 根据收集到的执行数据生成 JaCoCo HTML 报告
     *
     * @return {@code index.html} 所在目录
     */
    public String writeHtmlReport(String runId, ExecutionDataStore executionDataStore, SessionInfoStore sessionInfoStore,
                                  List<String> classDirectories, List<String> sourceDirectories) throws IOException {
        IBundleCoverage bundleCoverage = analyzeCoverage(executionDataStore, classDirectories, "Run " + runId);
        File htmlReportDir = Paths.get(runnerConfig.getReportOutputDirectory(), "html_" + runId).toFile();
        Files.createDirectories(htmlReportDir.toPath());

        HTMLFormatter htmlFormatter = new HTMLFormatter();
        FileMultiReportOutput multiReportOutput = new FileMultiReportOutput(htmlReportDir);
        try {
            IReportVisitor visitor = htmlFormatter.createVisitor(multiReportOutput);
            visitor.visitInfo(sessionInfoStore.getInfos(), executionDataStore.getContents());
            visitor.visitBundle(bundleCoverage, createSourceFileLocator(sourceDirectories));
            visitor.visitEnd();
        } finally {
            try {
                multiReportOutput.close();
            } catch (IOException e) {
                logger.warn("关闭HTML报告输出失败", e);
            }
        }
        logger.info("HTML报告已生成: {}", htmlReportDir.getAbsolutePath());
        return htmlReportDir.getAbsolutePath();
    }

    private IBundleCoverage analyzeCoverage(ExecutionDataStore executionDataStore, List<String> classDirectories,
                                            String bundleName) throws IOException {
        CoverageBuilder coverageBuilder = new CoverageBuilder();
        Analyzer analyzer = new Analyzer(executionDataStore, coverageBuilder);
        for (String classDirStr : classDirectories) {
            File classDir = new File(classDirStr);
            if (classDir.exists()) {
                analyzer.analyzeAll(classDir);
            } else {
                logger.warn("class目录不存在，跳过: {}", classDirStr);
            }
        }
        return coverageBuilder.getBundle(bundleName);
    }

    private ISourceFileLocator createSourceFileLocator(List<String> sourceDirectories) {
        MultiSourceFileLocator multiLocator = new MultiSourceFileLocator(4); // tabWidth = 4
        for (String sourceDirectory : sourceDirectories) {
            File sourceDir = new File(sourceDirectory);
            if (sourceDir.exists()) {
                multiLocator.add(new DirectorySourceFileLocator(sourceDir, runnerConfig.getSourceEncoding(), 4));
            } else {
                logger.warn("源码目录不存在，跳过: {}", sourceDirectory);
            }
        }
        return multiLocator;
    }
}
