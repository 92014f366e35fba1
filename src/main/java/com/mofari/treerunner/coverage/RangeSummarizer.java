package com.mofari.treerunner.coverage;

import java.util.ArrayList;
import java.util.List;

/**
 * 将排好序的未覆盖行号压缩为单行和区间，例如 [1, 2, 3, 4, 9] -> [1-4, 9]
 */
public final class RangeSummarizer {

    private RangeSummarizer() {
    }

    /**
     * @param sortedLines 升序行号；间隔大于 1 时开始新的区间
     */
    public static List<LineRange> summarize(List<Integer> sortedLines) {
        List<LineRange> ranges = new ArrayList<>();
        if (sortedLines.isEmpty()) {
            return ranges;
        }
        int start = sortedLines.get(0);
        int previous = start;
        for (int i = 1; i < sortedLines.size(); i++) {
            int current = sortedLines.get(i);
            if (current - previous > 1) {
                ranges.add(start == previous ? LineRange.single(start) : LineRange.of(start, previous));
                start = current;
            }
            previous = current;
        }
        ranges.add(start == previous ? LineRange.single(start) : LineRange.of(start, previous));
        return ranges;
    }
}
