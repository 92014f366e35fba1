package com.mofari.treerunner.coverage;

import java.io.IOException;
import java.util.Set;

/**
 * 已执行行的来源。如何观测（agent、探针或采样）由实现决定，
 * 聚合器只消费收集好的一批结果。
 */
public interface LineHitRecorder {

    Set<LineHit> collect() throws IOException;
}
