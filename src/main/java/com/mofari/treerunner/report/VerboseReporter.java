package com.mofari.treerunner.report;

import com.mofari.treerunner.coverage.LineRange;
import com.mofari.treerunner.model.coverage.CoverageReport;
import com.mofari.treerunner.model.coverage.FileCoverageStats;
import com.mofari.treerunner.model.coverage.GlobalCoverageStats;
import com.mofari.treerunner.tree.TestNode;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 与 {@link PathReporter} 相同的逐条输出，结束时额外打印统计、错误详情以及覆盖率表
 */
public class VerboseReporter extends PathReporter {

    private static final String RULE = "----------------------------------------------------------------------";

    public VerboseReporter(PrintWriter out) {
        super(out);
    }

    @Override
    public void onFinal(TestNode root) {
        out.print('\n');
        List<TestNode> errors = new ArrayList<>();
        for (TestNode node : root.preOrder()) {
            if (node.isSelected() && node.isError()) {
                errors.add(node);
            }
        }
        for (TestNode node : errors) {
            out.println(RULE);
            out.println(node.getError().render());
        }
        out.println(RULE);
        out.printf(Locale.ROOT, "Ran %d tests: %d passed, %d errors, %d not run%n",
                root.allPassed().size() + root.allError().size(),
                root.allPassed().size(), root.allError().size(), root.allNotRun().size());
        if (!errors.isEmpty()) {
            out.printf(Locale.ROOT, "FAILED (%d nodes with errors)%n", errors.size());
        } else {
            out.println("OK");
        }
        out.flush();
    }

    @Override
    public void onCoverage(CoverageReport report) {
        out.println(RULE);
        out.printf(Locale.ROOT, "%-50s %6s %6s %7s  %s%n", "Name", "Stmts", "Exec", "Cover", "Missing");
        for (FileCoverageStats file : report.getFiles()) {
            out.printf(Locale.ROOT, "%-50s %6d %6d %6.1f%%  %s%n", file.getFilePath(), file.getTotalStatements(),
                    file.getStatementsRun(), file.getPercentage(), joinRanges(file.getNotRunRanges()));
        }
        GlobalCoverageStats global = report.getGlobalStats();
        if (global != null) {
            out.printf(Locale.ROOT, "%-50s %6d %6d %6.1f%%%n", "TOTAL", global.getTotalStatements(),
                    global.getStatementsRun(), global.getPercentage());
        }
        out.flush();
    }

    private static String joinRanges(List<LineRange> ranges) {
        List<String> parts = new ArrayList<>();
        for (LineRange range : ranges) {
            parts.add(range.toString());
        }
        return String.join(", ", parts);
    }
}
