package com.mofari.treerunner.config;

import com.mofari.treerunner.util.PathUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.File;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;

import static com.mofari.treerunner.util.PathUtils.findDirectories;

@Component
@ConfigurationProperties(prefix = "runner")
public class RunnerConfig {

    private static final Logger logger = LoggerFactory.getLogger(RunnerConfig.class);

    /**
     * 基础搜索路径，源码和class目录默认在此路径下自动发现
     */
    private String basePath = ".";

    /**
     * 覆盖率统计的根路径，之外的命中行会被忽略；为空时使用 basePath
     */
    private String coveragePath;

    /**
     * 从覆盖率结果中排除的路径前缀
     */
    private List<String> excludePaths = new ArrayList<>();

    /**
     * 是否统计运行器自身源码的覆盖率
     */
    private boolean selfCoverage = false;

    /**
     * 运行器自身源码路径，selfCoverage 为 false 时自动加入排除列表
     */
    private String engineSourcePath;

    /**
     * 源码路径列表 (支持多模块，为空时自动扫描 src/main/java)
     */
    private List<String> sourceDirectories = new ArrayList<>();

    /**
     * class文件路径列表 (支持多模块，为空时自动扫描 target/classes)
     */
    private List<String> classDirectories = new ArrayList<>();

    /**
     * .exec 文件目录
     */
    private String dumpDirectory = "./dump-files";

    /**
     * 为 true 时从运行中的 JaCoCo agent 收集执行数据，否则读取 dumpDirectory 下的 .exec 文件
     */
    private boolean useAgent = false;

    private String agentHost = "localhost";

    private int agentPort = 6300;

    /**
     * 运行结果(JSON)及 HTML 报告输出目录
     */
    private String reportOutputDirectory = "./run-reports";

    private boolean htmlReport = false;

    private String sourceEncoding = "UTF-8";

    /**
     * 0 静默，1 打点，2 路径，3 详细
     */
    private int verbosity = 1;

    private boolean runOnStartup = false;

    /**
     * 用于解析语句的源码目录；未配置时在 {@code basePath} 下自动发现
     */
    public List<String> resolveSourceDirectories() {
        if (!sourceDirectories.isEmpty()) {
            return expandAll(sourceDirectories);
        }
        List<String> discovered = findDirectories(new File(PathUtils.expandPath(basePath)), "src/main/java");
        logger.info("未配置源码路径，在 {} 下自动发现 {} 个目录", basePath, discovered.size());
        return discovered;
    }

    public List<String> resolveClassDirectories() {
        if (!classDirectories.isEmpty()) {
            return expandAll(classDirectories);
        }
        List<String> discovered = findDirectories(new File(PathUtils.expandPath(basePath)), "target/classes");
        logger.info("未配置class路径，在 {} 下自动发现 {} 个目录", basePath, discovered.size());
        return discovered;
    }

    public String resolveCoveragePath() {
        String path = coveragePath != null && !coveragePath.isEmpty() ? coveragePath : basePath;
        return PathUtils.absolute(path);
    }

    /**
     * 配置的排除路径；未开启自身覆盖率时追加运行器自身的源码路径
     */
    public List<String> effectiveExcludePaths() {
        List<String> paths = expandAll(excludePaths);
        if (!selfCoverage && engineSourcePath != null && !engineSourcePath.isEmpty()) {
            paths.add(PathUtils.expandPath(engineSourcePath));
        }
        return paths;
    }

    public Charset sourceCharset() {
        return Charset.forName(sourceEncoding);
    }

    private static List<String> expandAll(List<String> paths) {
        List<String> expanded = new ArrayList<>();
        for (String path : paths) {
            expanded.add(PathUtils.expandPath(path));
        }
        return expanded;
    }

    // Getters and Setters
    public String getBasePath() {
        return basePath;
    }

    public void setBasePath(String basePath) {
        this.basePath = basePath;
    }

    public String getCoveragePath() {
        return coveragePath;
    }

    public void setCoveragePath(String coveragePath) {
        this.coveragePath = coveragePath;
    }

    public List<String> getExcludePaths() {
        return excludePaths;
    }

    public void setExcludePaths(List<String> excludePaths) {
        this.excludePaths = excludePaths;
    }

    public boolean isSelfCoverage() {
        return selfCoverage;
    }

    public void setSelfCoverage(boolean selfCoverage) {
        this.selfCoverage = selfCoverage;
    }

    public String getEngineSourcePath() {
        return engineSourcePath;
    }

    public void setEngineSourcePath(String engineSourcePath) {
        this.engineSourcePath = engineSourcePath;
    }

    public List<String> getSourceDirectories() {
        return sourceDirectories;
    }

    public void setSourceDirectories(List<String> sourceDirectories) {
        this.sourceDirectories = sourceDirectories;
    }

    public List<String> getClassDirectories() {
        return classDirectories;
    }

    public void setClassDirectories(List<String> classDirectories) {
        this.classDirectories = classDirectories;
    }

    public String getDumpDirectory() {
        return dumpDirectory;
    }

    public void setDumpDirectory(String dumpDirectory) {
        this.dumpDirectory = dumpDirectory;
    }

    public boolean isUseAgent() {
        return useAgent;
    }

    public void setUseAgent(boolean useAgent) {
        this.useAgent = useAgent;
    }

    public String getAgentHost() {
        return agentHost;
    }

    public void setAgentHost(String agentHost) {
        this.agentHost = agentHost;
    }

    public int getAgentPort() {
        return agentPort;
    }

    public void setAgentPort(int agentPort) {
        this.agentPort = agentPort;
    }

    public String getReportOutputDirectory() {
        return reportOutputDirectory;
    }

    public void setReportOutputDirectory(String reportOutputDirectory) {
        this.reportOutputDirectory = reportOutputDirectory;
    }

    public boolean isHtmlReport() {
        return htmlReport;
    }

    public void setHtmlReport(boolean htmlReport) {
        this.htmlReport = htmlReport;
    }

    public String getSourceEncoding() {
        return sourceEncoding;
    }

    public void setSourceEncoding(String sourceEncoding) {
        this.sourceEncoding = sourceEncoding;
    }

    public int getVerbosity() {
        return verbosity;
    }

    public void setVerbosity(int verbosity) {
        this.verbosity = verbosity;
    }

    public boolean isRunOnStartup() {
        return runOnStartup;
    }

    public void setRunOnStartup(boolean runOnStartup) {
        this.runOnStartup = runOnStartup;
    }
}
