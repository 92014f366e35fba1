package com.mofari.treerunner.coverage;

import com.mofari.treerunner.model.coverage.FileCoverageStats;
import com.mofari.treerunner.model.coverage.GlobalCoverageStats;
import com.mofari.treerunner.util.PathUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * 覆盖率聚合器：把运行期行命中与静态可执行行合并，计算每个文件的已运行/未运行语句
 *
 * <p>每个覆盖率会话一个实例。原始命中通过 {@link #integrate} 合并，派生的语句集合惰性重算；
 * 每个文件的静态语句集合只在它第一次参与聚合时计算一次。
 *
 * <p>对每个保留的文件，{@code runStatements ⊆ staticStatements}，
 * {@code notRunStatements = staticStatements - runStatements}，升序排列。
 */
public class CoverageAggregator {

    private static final Logger logger = LoggerFactory.getLogger(CoverageAggregator.class);

    public static final String NOT_RUN_MARKER = "> ";

    private final StaticLineIndex lineIndex;
    private final ExclusionScanner exclusionScanner;
    private final String coveragePath;
    private final List<String> excludePaths = new ArrayList<>();
    private final Charset sourceCharset;

    // 保持插入顺序，覆盖情况相同的文件按首次出现的顺序排列
    private final Map<String, Set<Integer>> executedLines = new LinkedHashMap<>();
    private final Map<String, Set<Integer>> staticStatements = new HashMap<>();
    private Map<String, Set<Integer>> runStatements = new HashMap<>();
    private Map<String, List<Integer>> notRunStatements = new HashMap<>();
    private boolean upToDate = true;

    /**
     * @param coveragePath 只保留该根目录下的命中；{@code null} 表示全部保留
     * @param excludePaths 等于或位于这些路径之下的文件不计入结果
     */
    public CoverageAggregator(StaticLineIndex lineIndex, ExclusionScanner exclusionScanner, String coveragePath,
                              Collection<String> excludePaths, Charset sourceCharset) {
        this.lineIndex = lineIndex;
        this.exclusionScanner = exclusionScanner;
        this.coveragePath = coveragePath != null ? PathUtils.absolute(coveragePath) : null;
        for (String excludePath : excludePaths) {
            this.excludePaths.add(PathUtils.absolute(excludePath));
        }
        this.sourceCharset = sourceCharset;
    }

    public String getCoveragePath() {
        return coveragePath;
    }

    /**
     * 合并一批行命中，重复合并同一命中没有额外效果
     */
    public void integrate(Collection<LineHit> hits) {
        int accepted = 0;
        for (LineHit hit : hits) {
            String file = PathUtils.absolute(hit.getFile());
            if (coveragePath != null && !PathUtils.isPathContained(coveragePath, file)) {
                continue;
            }
            executedLines.computeIfAbsent(file, k -> new TreeSet<>()).add(hit.getLine());
            accepted++;
        }
        upToDate = false;
        logger.debug("合并行命中 {}/{}", accepted, hits.size());
    }

    public void integrate(LineHitRecorder recorder) throws IOException {
        integrate(recorder.collect());
    }

    /**
     * 更新派生的语句集合；自上次调用以来没有新命中时直接返回
     */
    public void recompute() throws IOException {
        if (upToDate) {
            return;
        }
        Iterator<Map.Entry<String, Set<Integer>>> iterator = executedLines.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<String, Set<Integer>> entry = iterator.next();
            String file = entry.getKey();
            if (staticStatements.containsKey(file)) {
                continue;
            }
            if (isExcluded(file)) {
                logger.debug("文件在排除路径中，不计入覆盖率: {}", file);
                iterator.remove();
                continue;
            }
            Set<Integer> statements = new TreeSet<>(lineIndex.executableLines(file));
            statements.removeAll(exclusions(file));
            // 运行时执行过的行一定是可执行行，与静态分析结果无关
            statements.addAll(entry.getValue());
            staticStatements.put(file, statements);
        }

        Map<String, Set<Integer>> run = new HashMap<>();
        Map<String, List<Integer>> notRun = new HashMap<>();
        for (Map.Entry<String, Set<Integer>> entry : executedLines.entrySet()) {
            String file = entry.getKey();
            Set<Integer> statements = staticStatements.get(file);
            Set<Integer> fileRun = new TreeSet<>(entry.getValue());
            fileRun.retainAll(statements);
            List<Integer> fileNotRun = new ArrayList<>();
            for (Integer line : statements) {
                if (!fileRun.contains(line)) {
                    fileNotRun.add(line);
                }
            }
            Collections.sort(fileNotRun);
            run.put(file, fileRun);
            notRun.put(file, fileNotRun);
        }
        this.runStatements = run;
        this.notRunStatements = notRun;
        this.upToDate = true;
    }

    private boolean isExcluded(String file) {
        for (String excludePath : excludePaths) {
            if (PathUtils.isPathContained(excludePath, file)) {
                return true;
            }
        }
        return false;
    }

    private Set<Integer> exclusions(String file) throws IOException {
        Path path = Paths.get(file);
        if (!Files.isRegularFile(path)) {
            logger.warn("源文件不可读，不应用 nocover 指令: {}", file);
            return Collections.emptySet();
        }
        return exclusionScanner.scan(path, sourceCharset);
    }

    /**
     * 按文件统计，未运行语句最多的文件排在前面
     */
    public List<FileCoverageStats> perFileStats() throws IOException {
        recompute();
        List<FileCoverageStats> stats = new ArrayList<>();
        for (String file : executedLines.keySet()) {
            int total = staticStatements.get(file).size();
            int run = runStatements.get(file).size();
            // 空文件视为完全覆盖
            double percentage = total == 0 ? 100.0 : 100.0 * run / total;
            stats.add(new FileCoverageStats(file, total, run, percentage,
                    RangeSummarizer.summarize(notRunStatements.get(file))));
        }
        // List.sort 是稳定排序，相同时保持首次出现的顺序
        stats.sort(Comparator.comparingInt(FileCoverageStats::getStatementsNotRun).reversed());
        return stats;
    }

    public GlobalCoverageStats globalStats() throws IOException {
        recompute();
        long run = 0;
        long total = 0;
        for (String file : executedLines.keySet()) {
            run += runStatements.get(file).size();
            total += staticStatements.get(file).size();
        }
        return new GlobalCoverageStats(run, total);
    }

    /**
     * 返回文件内容，未运行的语句行加上 {@value #NOT_RUN_MARKER} 前缀
     *
     * @return 文件未被跟踪、不存在或没有未运行语句时为空
     */
    public Optional<List<String>> annotatedSource(String file) throws IOException {
        recompute();
        List<Integer> notRun = notRunStatements.get(PathUtils.absolute(file));
        if (notRun == null || notRun.isEmpty()) {
            return Optional.empty();
        }
        Path path = Paths.get(PathUtils.absolute(file));
        if (!Files.isRegularFile(path)) {
            logger.warn("源文件不存在，跳过标注: {}", path);
            return Optional.empty();
        }
        List<String> lines = new ArrayList<>(Files.readAllLines(path, sourceCharset));
        for (Integer line : notRun) {
            if (line >= 1 && line <= lines.size()) {
                lines.set(line - 1, NOT_RUN_MARKER + lines.get(line - 1));
            }
        }
        return Optional.of(lines);
    }

    /**
     * 所有含未运行语句的文件的标注源码，按路径索引
     */
    public Map<String, List<String>> annotations() throws IOException {
        recompute();
        Map<String, List<String>> annotations = new LinkedHashMap<>();
        for (String file : executedLines.keySet()) {
            Optional<List<String>> annotated = annotatedSource(file);
            annotated.ifPresent(lines -> annotations.put(file, lines));
        }
        return annotations;
    }

    // --- 派生集合的访问方法 ---

    public Set<String> getTrackedFiles() throws IOException {
        recompute();
        return Collections.unmodifiableSet(executedLines.keySet());
    }

    public Set<Integer> getStaticStatements(String file) throws IOException {
        recompute();
        return unmodifiable(staticStatements.get(PathUtils.absolute(file)));
    }

    public Set<Integer> getRunStatements(String file) throws IOException {
        recompute();
        return unmodifiable(runStatements.get(PathUtils.absolute(file)));
    }

    public List<Integer> getNotRunStatements(String file) throws IOException {
        recompute();
        List<Integer> lines = notRunStatements.get(PathUtils.absolute(file));
        return lines != null ? Collections.unmodifiableList(lines) : Collections.emptyList();
    }

    private static Set<Integer> unmodifiable(Set<Integer> lines) {
        return lines != null ? Collections.unmodifiableSet(lines) : Collections.emptySet();
    }

    public boolean isUpToDate() {
        return upToDate;
    }
}
