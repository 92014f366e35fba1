package com.mofari.treerunner.config;

import com.mofari.treerunner.model.RunSummary;
import com.mofari.treerunner.service.TestRunService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class StartupRunnerTest {

    @Mock
    private TestRunService testRunService;

    @Spy
    private RunnerConfig runnerConfig = new RunnerConfig();

    @InjectMocks
    private StartupRunner startupRunner;

    @Test
    public void disabledByDefault() throws Exception {
        startupRunner.run(new DefaultApplicationArguments("--pattern=orders"));

        verifyNoInteractions(testRunService);
    }

    @Test
    public void runsWithCommandLineOptions() throws Exception {
        runnerConfig.setRunOnStartup(true);
        RunSummary summary = new RunSummary();
        summary.setOutput("..\n");
        when(testRunService.run("orders", null, true)).thenReturn(summary);

        startupRunner.run(new DefaultApplicationArguments("--pattern=orders", "--coverage"));

        verify(testRunService).run("orders", null, true);
    }

    @Test
    public void patternIsOptional() throws Exception {
        runnerConfig.setRunOnStartup(true);
        RunSummary summary = new RunSummary();
        summary.setOutput("");
        when(testRunService.run(isNull(), isNull(), eq(false))).thenReturn(summary);

        startupRunner.run(new DefaultApplicationArguments());

        verify(testRunService).run(null, null, false);
    }
}
