package com.mofari.treerunner.coverage.jacoco;

import org.jacoco.core.analysis.Analyzer;
import org.jacoco.core.analysis.CoverageBuilder;
import org.jacoco.core.analysis.ISourceFileCoverage;
import org.jacoco.core.data.ExecutionDataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.Collection;
import java.util.List;

/**
 * 行索引与命中记录器共用的 class 文件分析
 */
final class JaCoCoAnalysis {

    private static final Logger logger = LoggerFactory.getLogger(JaCoCoAnalysis.class);

    private JaCoCoAnalysis() {
    }

    static Collection<ISourceFileCoverage> analyze(ExecutionDataStore executionDataStore,
                                                   List<String> classDirectories) throws IOException {
        CoverageBuilder coverageBuilder = new CoverageBuilder();
        Analyzer analyzer = new Analyzer(executionDataStore, coverageBuilder);
        for (String classDirStr : classDirectories) {
            File classDir = new File(classDirStr);
            if (classDir.exists()) {
                analyzer.analyzeAll(classDir);
                logger.debug("已分析class目录: {}", classDirStr);
            } else {
                logger.warn("class目录不存在，跳过: {}", classDirStr);
            }
        }
        return coverageBuilder.getSourceFiles();
    }

    /**
     * 把源文件节点（{@code com/foo} + {@code Bar.java}）映射为绝对路径：取第一个包含该文件的源码目录，
     * 都不包含时取第一个源码目录
     *
     * @return 未配置源码目录时为 {@code null}
     */
    static String resolveSourcePath(ISourceFileCoverage sourceFile, List<String> sourceDirectories) {
        String relative = sourceFile.getPackageName().isEmpty()
                ? sourceFile.getName()
                : sourceFile.getPackageName() + "/" + sourceFile.getName();
        for (String sourceDir : sourceDirectories) {
            File candidate = new File(sourceDir, relative);
            if (candidate.isFile()) {
                return candidate.toPath().toAbsolutePath().normalize().toString();
            }
        }
        if (sourceDirectories.isEmpty()) {
            return null;
        }
        return new File(sourceDirectories.get(0), relative).toPath().toAbsolutePath().normalize().toString();
    }
}
