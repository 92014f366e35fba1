package com.mofari.treerunner.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

public final class PathUtils {

    private static final Logger logger = LoggerFactory.getLogger(PathUtils.class);

    private PathUtils() {
    }

    /**
     * 将路径规范化为绝对路径字符串
     */
    public static String absolute(String path) {
        return Paths.get(expandPath(path)).toAbsolutePath().normalize().toString();
    }

    /**
     * 判断 path 是否等于 parent 或位于 parent 目录之下（按路径层级比较，而非字符串前缀）
     */
    public static boolean isPathContained(String parent, String path) {
        Path parentPath = Paths.get(absolute(parent));
        Path childPath = Paths.get(absolute(path));
        return childPath.startsWith(parentPath);
    }

    /**
     * 展开路径中的~符号
     */
    public static String expandPath(String path) {
        if (path.equals("~")) {
            return System.getProperty("user.home");
        }
        if (path.startsWith("~/")) {
            return System.getProperty("user.home") + path.substring(1);
        }
        return path;
    }

    /**
     * 递归查找指定根目录下的所有符合目标模式的目录。
     *
     * @param rootDir       查找的起始根目录
     * @param targetPattern 要查找的目录模式，例如 "src/main/java" 或 "target/classes"
     * @return 找到的符合模式的目录的绝对路径列表
     */
    public static List<String> findDirectories(File rootDir, String targetPattern) {
        List<String> foundPaths = new ArrayList<>();
        Path rootPath = rootDir.toPath();

        if (!Files.isDirectory(rootPath)) {
            logger.warn("提供的路径不是目录: {}", rootDir.getAbsolutePath());
            return foundPaths;
        }

        // 确保目标模式使用统一的分隔符，处理跨平台兼容性
        String normalizedTargetPattern = targetPattern.replace(File.separatorChar, '/');

        try (Stream<Path> walk = Files.walk(rootPath)) {
            walk.filter(Files::isDirectory).forEach(path -> {
                String relativePath = rootPath.relativize(path).toString();
                if (File.separatorChar == '\\') {
                    relativePath = relativePath.replace('\\', '/');
                }
                if (relativePath.equals(normalizedTargetPattern) || relativePath.endsWith("/" + normalizedTargetPattern)) {
                    foundPaths.add(path.toAbsolutePath().toString());
                }
            });
        } catch (IOException e) {
            logger.error("遍历目录出错: {}", rootDir.getAbsolutePath(), e);
        }
        return foundPaths;
    }
}
