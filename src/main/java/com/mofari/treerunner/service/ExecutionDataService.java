package com.mofari.treerunner.service;

import com.mofari.treerunner.config.RunnerConfig;
import org.jacoco.core.data.ExecutionDataReader;
import org.jacoco.core.data.ExecutionDataStore;
import org.jacoco.core.data.ExecutionDataWriter;
import org.jacoco.core.data.SessionInfoStore;
import org.jacoco.core.runtime.RemoteControlReader;
import org.jacoco.core.runtime.RemoteControlWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.net.Socket;
import java.text.SimpleDateFormat;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Date;
import java.util.List;

/**
 * 执行数据(.exec)的读取、合并，以及与 tcpserver 模式 JaCoCo agent 的通信
 */
@Service
public class ExecutionDataService {

    private static final Logger logger = LoggerFactory.getLogger(ExecutionDataService.class);

    static final String MERGED_PREFIX = "jacoco_merged_";

    @Autowired
    private RunnerConfig runnerConfig;

    /**
     * 获取 dump 目录下的所有 .exec 文件（合并文件除外），最新的在前
     */
    public List<File> getDumpFiles() {
        File dumpDir = new File(runnerConfig.getDumpDirectory());
        if (!dumpDir.isDirectory()) {
            return Collections.emptyList();
        }
        File[] dumpFiles = dumpDir.listFiles((dir, name) -> name.endsWith(".exec") && !name.startsWith(MERGED_PREFIX));
        if (dumpFiles == null) {
            return Collections.emptyList();
        }
        List<File> files = new ArrayList<>(Arrays.asList(dumpFiles));
        files.sort((f1, f2) -> Long.compare(f2.lastModified(), f1.lastModified())); // Newest first
        return files;
    }

    /**
     * 读取所有 dump 文件到同一个 store；dump 目录不存在或为空时返回空 store
     */
    public ExecutionDataStore loadDumpFiles(SessionInfoStore sessionInfoStore) throws IOException {
        ExecutionDataStore executionDataStore = new ExecutionDataStore();
        List<File> dumpFiles = getDumpFiles();
        if (dumpFiles.isEmpty()) {
            logger.warn("在 {} 中未找到执行数据文件", runnerConfig.getDumpDirectory());
            return executionDataStore;
        }
        for (File dumpFile : dumpFiles) {
            read(dumpFile, executionDataStore, sessionInfoStore);
        }
        logger.info("已从 {} 个dump文件加载执行数据", dumpFiles.size());
        return executionDataStore;
    }

    private void read(File dumpFile, ExecutionDataStore executionDataStore, SessionInfoStore sessionInfoStore)
            throws IOException {
        try (FileInputStream fis = new FileInputStream(dumpFile)) {
            ExecutionDataReader reader = new ExecutionDataReader(fis);
            reader.setExecutionDataVisitor(executionDataStore);
            reader.setSessionInfoVisitor(sessionInfoStore);
            reader.read();
        } catch (IOException e) {
            logger.error("读取dump文件失败: {}", dumpFile.getName(), e);
            throw new IOException("读取dump文件失败: " + dumpFile.getName(), e);
        }
    }

    /**
     * 合并 dump 目录下的所有 dump 文件
     *
     * @return 合并后的文件路径；只有一个文件时直接返回该文件
     */
    public String mergeDumpFiles() throws IOException {
        List<File> dumpFiles = getDumpFiles();
        if (dumpFiles.isEmpty()) {
            throw new FileNotFoundException("未找到dump文件在目录: " + new File(runnerConfig.getDumpDirectory()).getAbsolutePath());
        }
        if (dumpFiles.size() == 1) {
            logger.info("只有一个dump文件，无需合并: {}", dumpFiles.get(0).getAbsolutePath());
            return dumpFiles.get(0).getAbsolutePath();
        }

        SessionInfoStore sessionInfoStore = new SessionInfoStore();
        ExecutionDataStore executionDataStore = new ExecutionDataStore();
        for (File dumpFile : dumpFiles) {
            read(dumpFile, executionDataStore, sessionInfoStore);
        }
        File mergedFile = new File(runnerConfig.getDumpDirectory(), MERGED_PREFIX + timestamp() + ".exec");
        write(mergedFile, sessionInfoStore, executionDataStore);
        logger.info("合并 {} 个dump文件到: {}", dumpFiles.size(), mergedFile.getAbsolutePath());
        return mergedFile.getAbsolutePath();
    }

    /**
     * 从 JaCoCo agent 拉取执行数据，同时保存为 dump 文件
     *
     * @param reset 拉取后是否重置 agent 中的数据
     */
    public ExecutionDataStore dumpFromAgent(boolean reset, SessionInfoStore sessionInfoStore) throws IOException {
        String host = runnerConfig.getAgentHost();
        int port = runnerConfig.getAgentPort();
        ExecutionDataStore executionDataStore = new ExecutionDataStore();

        try (Socket socket = new Socket(host, port)) {
            RemoteControlWriter writer = new RemoteControlWriter(socket.getOutputStream());
            RemoteControlReader reader = new RemoteControlReader(socket.getInputStream());
            reader.setSessionInfoVisitor(sessionInfoStore);
            reader.setExecutionDataVisitor(executionDataStore);

            writer.visitDumpCommand(true, reset);
            if (!reader.read()) {
                throw new IOException("从JaCoCo agent读取数据失败");
            }
            logger.info("成功从agent {}:{} 收集到执行数据", host, port);
        } catch (IOException e) {
            logger.error("连接JaCoCo agent失败: {}", e.getMessage());
            throw new IOException("连接JaCoCo agent失败 " + host + ":" + port + ": " + e.getMessage(), e);
        }

        File dumpDir = new File(runnerConfig.getDumpDirectory());
        if (!dumpDir.exists() && !dumpDir.mkdirs()) {
            logger.warn("无法创建dump目录: {}", dumpDir.getAbsolutePath());
            return executionDataStore;
        }
        write(new File(dumpDir, "jacoco_" + timestamp() + ".exec"), sessionInfoStore, executionDataStore);
        return executionDataStore;
    }

    /**
     * 重置 JaCoCo agent 的覆盖率数据
     */
    public void resetAgent() throws IOException {
        String host = runnerConfig.getAgentHost();
        int port = runnerConfig.getAgentPort();
        try (Socket socket = new Socket(host, port)) {
            RemoteControlWriter writer = new RemoteControlWriter(socket.getOutputStream());
            RemoteControlReader reader = new RemoteControlReader(socket.getInputStream());
            writer.visitDumpCommand(false, true);
            // 等待 agent 确认命令
            if (!reader.read()) {
                throw new IOException("JaCoCo agent未确认重置命令");
            }
            logger.info("成功重置覆盖率数据 {}:{}", host, port);
        } catch (IOException e) {
            logger.error("重置覆盖率数据失败: {}", e.getMessage());
            throw new IOException("重置覆盖率数据失败 " + host + ":" + port + ": " + e.getMessage(), e);
        }
    }

    private void write(File file, SessionInfoStore sessionInfoStore, ExecutionDataStore executionDataStore)
            throws IOException {
        try (FileOutputStream fos = new FileOutputStream(file)) {
            ExecutionDataWriter writer = new ExecutionDataWriter(fos);
            sessionInfoStore.accept(writer);
            executionDataStore.accept(writer);
        }
        logger.debug("dump文件已保存到: {}", file.getAbsolutePath());
    }

    private static String timestamp() {
        return new SimpleDateFormat("yyyyMMdd_HHmmss_SSS").format(new Date());
    }
}
