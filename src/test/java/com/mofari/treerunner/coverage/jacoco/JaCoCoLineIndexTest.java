package com.mofari.treerunner.coverage.jacoco;

import com.mofari.treerunner.coverage.LineHit;
import com.mofari.treerunner.coverage.jacoco.fixture.Calculator;
import org.jacoco.core.data.ExecutionDataStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class JaCoCoLineIndexTest {

    private String classDir;
    private String sourceDir;
    private Path sourceFile;
    private List<String> sourceLines;

    @BeforeEach
    public void locateFixture() throws URISyntaxException, IOException {
        Path testClasses = Paths.get(Calculator.class.getProtectionDomain().getCodeSource().getLocation().toURI());
        classDir = testClasses.resolve("com/mofari/treerunner/coverage/jacoco/fixture").toString();
        sourceDir = Paths.get("src/test/java").toAbsolutePath().toString();
        sourceFile = Paths.get(sourceDir, "com/mofari/treerunner/coverage/jacoco/fixture/Calculator.java");
        sourceLines = Files.readAllLines(sourceFile, StandardCharsets.UTF_8);
    }

    private int lineOf(String text) {
        for (int i = 0; i < sourceLines.size(); i++) {
            if (sourceLines.get(i).contains(text)) {
                return i + 1;
            }
        }
        throw new IllegalArgumentException("not in fixture: " + text);
    }

    @Test
    public void statementLinesAreExecutable() throws IOException {
        JaCoCoLineIndex index = new JaCoCoLineIndex(Collections.singletonList(classDir),
                Collections.singletonList(sourceDir));

        Set<Integer> lines = index.executableLines(sourceFile.toString());

        assertTrue(lines.contains(lineOf("return a + b;")));
        assertTrue(lines.contains(lineOf("if (value < 0)")));
        assertTrue(lines.contains(lineOf("return -value;")));
        assertFalse(lines.contains(lineOf("// plain comment")));
        assertFalse(lines.contains(lineOf("public int add(int a, int b)")));
    }

    @Test
    public void unknownFileHasNoLines() throws IOException {
        JaCoCoLineIndex index = new JaCoCoLineIndex(Collections.singletonList(classDir),
                Collections.singletonList(sourceDir));

        assertTrue(index.executableLines(Paths.get(sourceDir, "Missing.java").toString()).isEmpty());
    }

    @Test
    public void missingClassDirectoryIsSkipped() throws IOException {
        JaCoCoLineIndex index = new JaCoCoLineIndex(Collections.singletonList(classDir + "-missing"),
                Collections.singletonList(sourceDir));

        assertTrue(index.executableLines(sourceFile.toString()).isEmpty());
    }

    @Test
    public void noExecutionDataMeansNoHits() throws IOException {
        JaCoCoLineHitRecorder recorder = new JaCoCoLineHitRecorder(new ExecutionDataStore(),
                Collections.singletonList(classDir), Collections.singletonList(sourceDir));

        Set<LineHit> hits = recorder.collect();

        assertTrue(hits.isEmpty());
    }
}
