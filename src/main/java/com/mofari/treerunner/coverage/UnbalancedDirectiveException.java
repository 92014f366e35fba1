package com.mofari.treerunner.coverage;

/**
 * nocover 区域被重复开启，或未开启就被关闭
 */
public class UnbalancedDirectiveException extends RuntimeException {

    private final String file;
    private final int line;

    public UnbalancedDirectiveException(String file, int line) {
        super("Unbalanced nocover directive at line " + line + " of " + file);
        this.file = file;
        this.line = line;
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }
}
