package com.mofari.treerunner.config;

import com.mofari.treerunner.model.RunSummary;
import com.mofari.treerunner.service.TestRunService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * 设置 {@code runner.run-on-startup} 时在启动后执行一次测试树
 * {@code --pattern=...} 过滤运行范围，{@code --coverage} 开启覆盖率收集
 */
@Component
public class StartupRunner implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(StartupRunner.class);

    @Autowired
    private RunnerConfig runnerConfig;

    @Autowired
    private TestRunService testRunService;

    @Override
    public void run(ApplicationArguments args) throws Exception {
        if (!runnerConfig.isRunOnStartup()) {
            return;
        }
        String pattern = args.containsOption("pattern") ? args.getOptionValues("pattern").get(0) : null;
        boolean coverage = args.containsOption("coverage");
        logger.info("启动时执行测试运行");
        RunSummary summary = testRunService.run(pattern, null, coverage);
        System.out.print(summary.getOutput());
        System.out.flush();
    }
}
