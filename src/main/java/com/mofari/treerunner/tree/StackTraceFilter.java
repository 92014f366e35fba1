package com.mofari.treerunner.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * 把异常渲染为堆栈行，去掉属于运行器自身的栈帧。
 * {@link TestNode#invokePhase} 及其以下的栈帧都是运行器或框架代码，
 * 对阅读失败信息没有帮助。
 */
final class StackTraceFilter {

    private static final String BOUNDARY_CLASS = TestNode.class.getName();
    private static final String BOUNDARY_METHOD = "invokePhase";

    private StackTraceFilter() {
    }

    static List<String> traceLines(Throwable throwable) {
        List<String> lines = new ArrayList<>();
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Throwable current = throwable;
        String prefix = "";
        while (current != null && seen.add(current)) {
            lines.add(prefix + current);
            for (StackTraceElement frame : userFrames(current.getStackTrace())) {
                lines.add("    at " + frame);
            }
            current = current.getCause();
            prefix = "Caused by: ";
        }
        return lines;
    }

    static List<StackTraceElement> userFrames(StackTraceElement[] frames) {
        int end = frames.length;
        for (int i = 0; i < frames.length; i++) {
            if (BOUNDARY_CLASS.equals(frames[i].getClassName()) && BOUNDARY_METHOD.equals(frames[i].getMethodName())) {
                end = i;
                break;
            }
        }
        // leaf/suite 类的 lambda 适配帧紧挨在边界之上
        while (end > 0 && isRunnerFrame(frames[end - 1])) {
            end--;
        }
        List<StackTraceElement> kept = new ArrayList<>(end);
        for (int i = 0; i < end; i++) {
            kept.add(frames[i]);
        }
        return kept;
    }

    private static boolean isRunnerFrame(StackTraceElement frame) {
        String className = frame.getClassName();
        return isSameClass(className, TestCase.class.getName()) || isSameClass(className, TestSuite.class.getName())
                || isSameClass(className, BOUNDARY_CLASS);
    }

    private static boolean isSameClass(String className, String runnerClass) {
        return className.equals(runnerClass) || className.startsWith(runnerClass + "$");
    }
}
