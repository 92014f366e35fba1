package com.mofari.treerunner.coverage;

import java.util.Objects;

/**
 * {@link LineHitRecorder} 上报的一条已执行源码行
 */
public final class LineHit {

    private final String file;
    private final int line;

    public LineHit(String file, int line) {
        this.file = Objects.requireNonNull(file, "file");
        this.line = line;
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LineHit)) {
            return false;
        }
        LineHit other = (LineHit) o;
        return line == other.line && file.equals(other.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, line);
    }

    @Override
    public String toString() {
        return file + ":" + line;
    }
}
