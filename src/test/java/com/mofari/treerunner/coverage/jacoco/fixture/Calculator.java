package com.mofari.treerunner.coverage.jacoco.fixture;

public class Calculator {

    public int add(int a, int b) {
        // plain comment
        return a + b;
    }

    public int abs(int value) {
        if (value < 0) {
            return -value;
        }
        return value;
    }
}
