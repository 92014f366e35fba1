package com.mofari.treerunner.coverage;

import java.io.IOException;
import java.util.Set;

/**
 * 提供源文件的可执行语句行。注释和空行已被排除；
 * nocover 区域不在此处理，由聚合器自行去除。
 */
public interface StaticLineIndex {

    /**
     * @param file 源文件绝对路径
     * @return 从 1 开始的行号，索引中没有该文件时为空
     */
    Set<Integer> executableLines(String file) throws IOException;
}
