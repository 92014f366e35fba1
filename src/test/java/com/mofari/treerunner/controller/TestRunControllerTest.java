package com.mofari.treerunner.controller;

import com.mofari.treerunner.model.RunSummary;
import com.mofari.treerunner.service.ExecutionDataService;
import com.mofari.treerunner.service.TestRunService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.io.FileNotFoundException;
import java.io.IOException;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
public class TestRunControllerTest {

    @Mock
    private TestRunService testRunService;

    @Mock
    private ExecutionDataService executionDataService;

    @InjectMocks
    private TestRunController testRunController;

    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(testRunController).build();
    }

    private static RunSummary summary() {
        RunSummary summary = new RunSummary();
        summary.setRunId("r1");
        summary.setPattern("orders");
        summary.setPassed(2);
        summary.setTotalTests(2);
        return summary;
    }

    @Test
    public void postRunsTheTree() throws Exception {
        when(testRunService.run("orders", 2, true)).thenReturn(summary());

        mockMvc.perform(post("/api/runs").param("pattern", "orders").param("verbosity", "2").param("coverage", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.summary.runId").value("r1"))
                .andExpect(jsonPath("$.summary.passed").value(2));
    }

    @Test
    public void runFailureAnswers500() throws Exception {
        when(testRunService.run(isNull(), isNull(), eq(false)))
                .thenThrow(new IOException("dump directory unreadable"));

        mockMvc.perform(post("/api/runs"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value(containsString("dump directory unreadable")));
    }

    @Test
    public void latestWithoutRunIs404() throws Exception {
        when(testRunService.getLatestSummary()).thenReturn(null);

        mockMvc.perform(get("/api/runs/latest"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    public void latestReturnsTheLastSummary() throws Exception {
        when(testRunService.getLatestSummary()).thenReturn(summary());

        mockMvc.perform(get("/api/runs/latest"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.summary.pattern").value("orders"));
    }

    @Test
    public void structureListsTheTree() throws Exception {
        when(testRunService.structure("orders")).thenReturn("orders\n    create\n");

        mockMvc.perform(get("/api/runs/structure").param("pattern", "orders"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.structure").value("orders\n    create\n"));
    }

    @Test
    public void mergeReturnsTheMergedFile() throws Exception {
        when(executionDataService.mergeDumpFiles()).thenReturn("/dumps/jacoco_merged_20240101.exec");

        mockMvc.perform(post("/api/runs/dumps/merge"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.mergedFile").value("/dumps/jacoco_merged_20240101.exec"));
    }

    @Test
    public void mergeWithoutDumpsAnswers500() throws Exception {
        when(executionDataService.mergeDumpFiles()).thenThrow(new FileNotFoundException("no dumps in /dumps"));

        mockMvc.perform(post("/api/runs/dumps/merge"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value(containsString("no dumps in /dumps")));
    }
}
