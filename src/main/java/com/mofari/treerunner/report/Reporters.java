package com.mofari.treerunner.report;

import java.io.PrintWriter;

public final class Reporters {

    public static final int SILENT = 0;
    public static final int DOTS = 1;
    public static final int PATHS = 2;
    public static final int VERBOSE = 3;

    private Reporters() {
    }

    /**
     * 0 及以下静默，1 打点，2 打印路径，3 及以上详细输出
     */
    public static Reporter forVerbosity(int verbosity, PrintWriter out) {
        if (verbosity <= SILENT) {
            return new SilentReporter();
        }
        if (verbosity == DOTS) {
            return new DotReporter(out);
        }
        if (verbosity == PATHS) {
            return new PathReporter(out);
        }
        return new VerboseReporter(out);
    }
}
