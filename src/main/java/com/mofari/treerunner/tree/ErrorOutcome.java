package com.mofari.treerunner.tree;

import java.util.Collections;
import java.util.List;

public final class ErrorOutcome extends Outcome {

    private final Throwable cause;
    private final List<String> traceLines;

    public ErrorOutcome(TestNode node, Phase phase, Throwable cause) {
        super(node, phase);
        this.cause = cause;
        this.traceLines = Collections.unmodifiableList(StackTraceFilter.traceLines(cause));
    }

    public Throwable getCause() {
        return cause;
    }

    public String getMessage() {
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getName();
    }

    /**
     * 异常的堆栈行，已去掉运行器自身的栈帧
     */
    public List<String> getTraceLines() {
        return traceLines;
    }

    @Override
    public boolean isError() {
        return true;
    }

    /**
     * 节点路径，后跟缩进的堆栈
     */
    public String render() {
        StringBuilder sb = new StringBuilder(getNode().fullPath());
        sb.append(" [").append(getPhase().getHookName()).append("]");
        for (String line : traceLines) {
            sb.append(System.lineSeparator()).append("    ").append(line);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "Error(" + getPhase().getHookName() + ", " + getMessage() + ")";
    }
}
