package com.mofari.treerunner.coverage.jacoco;

import com.mofari.treerunner.coverage.LineHit;
import com.mofari.treerunner.coverage.LineHitRecorder;
import org.jacoco.core.analysis.ICounter;
import org.jacoco.core.analysis.ISourceFileCoverage;
import org.jacoco.core.analysis.ISourceNode;
import org.jacoco.core.data.ExecutionDataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 把 JaCoCo 执行数据转换为行命中；一行中至少有一条指令执行过即视为已执行
 */
public class JaCoCoLineHitRecorder implements LineHitRecorder {

    private static final Logger logger = LoggerFactory.getLogger(JaCoCoLineHitRecorder.class);

    private final ExecutionDataStore executionDataStore;
    private final List<String> classDirectories;
    private final List<String> sourceDirectories;

    public JaCoCoLineHitRecorder(ExecutionDataStore executionDataStore, List<String> classDirectories,
                                 List<String> sourceDirectories) {
        this.executionDataStore = executionDataStore;
        this.classDirectories = new ArrayList<>(classDirectories);
        this.sourceDirectories = new ArrayList<>(sourceDirectories);
    }

    @Override
    public Set<LineHit> collect() throws IOException {
        Set<LineHit> hits = new LinkedHashSet<>();
        for (ISourceFileCoverage sourceFile : JaCoCoAnalysis.analyze(executionDataStore, classDirectories)) {
            String path = JaCoCoAnalysis.resolveSourcePath(sourceFile, sourceDirectories);
            if (path == null || sourceFile.getFirstLine() == ISourceNode.UNKNOWN_LINE) {
                continue;
            }
            for (int nr = sourceFile.getFirstLine(); nr <= sourceFile.getLastLine(); nr++) {
                int status = sourceFile.getLine(nr).getStatus();
                if (status == ICounter.FULLY_COVERED || status == ICounter.PARTLY_COVERED) {
                    hits.add(new LineHit(path, nr));
                }
            }
        }
        logger.info("收集到 {} 个已执行行，执行数据条数: {}",
                hits.size(), executionDataStore.getContents().size());
        return hits;
    }
}
