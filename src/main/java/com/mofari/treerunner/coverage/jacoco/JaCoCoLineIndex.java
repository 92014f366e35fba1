package com.mofari.treerunner.coverage.jacoco;

import com.mofari.treerunner.coverage.StaticLineIndex;
import org.jacoco.core.analysis.ISourceFileCoverage;
import org.jacoco.core.analysis.ISourceNode;
import org.jacoco.core.data.ExecutionDataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 基于 JaCoCo 字节码分析的静态行索引：包含至少一条指令的源码行即为可执行语句
 *
 * <p>class 目录只在第一次查询时分析一次。
 */
public class JaCoCoLineIndex implements StaticLineIndex {

    private static final Logger logger = LoggerFactory.getLogger(JaCoCoLineIndex.class);

    private final List<String> classDirectories;
    private final List<String> sourceDirectories;
    private Map<String, Set<Integer>> linesByFile;

    public JaCoCoLineIndex(List<String> classDirectories, List<String> sourceDirectories) {
        this.classDirectories = new ArrayList<>(classDirectories);
        this.sourceDirectories = new ArrayList<>(sourceDirectories);
    }

    @Override
    public Set<Integer> executableLines(String file) throws IOException {
        if (linesByFile == null) {
            linesByFile = buildIndex();
        }
        Set<Integer> lines = linesByFile.get(Paths.get(file).toAbsolutePath().normalize().toString());
        return lines != null ? Collections.unmodifiableSet(lines) : Collections.emptySet();
    }

    private Map<String, Set<Integer>> buildIndex() throws IOException {
        Map<String, Set<Integer>> index = new HashMap<>();
        // 没有执行数据时分析结果仍然包含每行的指令计数
        for (ISourceFileCoverage sourceFile : JaCoCoAnalysis.analyze(new ExecutionDataStore(), classDirectories)) {
            String path = JaCoCoAnalysis.resolveSourcePath(sourceFile, sourceDirectories);
            if (path == null || sourceFile.getFirstLine() == ISourceNode.UNKNOWN_LINE) {
                continue;
            }
            Set<Integer> lines = index.computeIfAbsent(path, k -> new TreeSet<>());
            for (int nr = sourceFile.getFirstLine(); nr <= sourceFile.getLastLine(); nr++) {
                if (sourceFile.getLine(nr).getInstructionCounter().getTotalCount() > 0) {
                    lines.add(nr);
                }
            }
        }
        logger.info("已建立 {} 个源文件的可执行行索引", index.size());
        return index;
    }
}
