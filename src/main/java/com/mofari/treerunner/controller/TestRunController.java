package com.mofari.treerunner.controller;

import com.mofari.treerunner.model.RunSummary;
import com.mofari.treerunner.service.ExecutionDataService;
import com.mofari.treerunner.service.TestRunService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/runs")
public class TestRunController {

    private static final Logger logger = LoggerFactory.getLogger(TestRunController.class);

    @Autowired
    private TestRunService testRunService;

    @Autowired
    private ExecutionDataService executionDataService;

    /**
     * 执行测试树
     * @param pattern 路径过滤（可选）
     * @param verbosity 输出级别（可选）
     * @param coverage 是否收集覆盖率
     * @return 运行摘要
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> run(
            @RequestParam(required = false) String pattern,
            @RequestParam(required = false) Integer verbosity,
            @RequestParam(defaultValue = "false") boolean coverage) {

        Map<String, Object> response = new HashMap<>();

        try {
            logger.info("收到测试运行请求，pattern: {}, verbosity: {}, coverage: {}", pattern, verbosity, coverage);
            RunSummary summary = testRunService.run(pattern, verbosity, coverage);

            response.put("success", true);
            response.put("message", summary.isSuccessful() ? "测试全部通过" : "存在失败的测试");
            response.put("summary", summary);

            return ResponseEntity.ok(response);

        } catch (Exception e) {
            logger.error("测试运行失败", e);

            response.put("success", false);
            response.put("message", "测试运行失败: " + e.getMessage());

            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }

    /**
     * 获取最近一次运行的摘要
     */
    @GetMapping("/latest")
    public ResponseEntity<Map<String, Object>> latest() {
        Map<String, Object> response = new HashMap<>();
        RunSummary summary = testRunService.getLatestSummary();
        if (summary == null) {
            response.put("success", false);
            response.put("message", "尚未执行过测试");
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
        }
        response.put("success", true);
        response.put("summary", summary);
        return ResponseEntity.ok(response);
    }

    /**
     * 查看测试树结构
     * @param pattern 路径过滤（可选）
     */
    @GetMapping("/structure")
    public ResponseEntity<Map<String, Object>> structure(@RequestParam(required = false) String pattern) {
        Map<String, Object> response = new HashMap<>();
        try {
            response.put("success", true);
            response.put("pattern", pattern);
            response.put("structure", testRunService.structure(pattern));
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("获取测试树结构失败", e);
            response.put("success", false);
            response.put("message", "获取测试树结构失败: " + e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }

    /**
     * 合并 dump 目录下的执行数据文件
     * @return 合并后的文件路径
     */
    @PostMapping("/dumps/merge")
    public ResponseEntity<Map<String, Object>> mergeDumps() {
        Map<String, Object> response = new HashMap<>();
        try {
            logger.info("收到合并dump文件请求");
            String mergedFile = executionDataService.mergeDumpFiles();
            response.put("success", true);
            response.put("message", "dump文件合并成功");
            response.put("mergedFile", mergedFile);
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("合并dump文件失败", e);
            response.put("success", false);
            response.put("message", "合并dump文件失败: " + e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }
}
