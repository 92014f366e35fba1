package com.mofari.treerunner.coverage;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 扫描源码中的 "begin nocover" / "end nocover" 注释，返回被排除的行号（1起始，包含标记行本身）
 *
 * <pre>
 *     // begin nocover
 *     debugOnly();
 *     // end nocover
 * </pre>
 */
public class ExclusionScanner {

    private static final Pattern DIRECTIVE =
            Pattern.compile("^\\s*(?://+|#|/\\*+)\\s*(begin|end)\\s+nocover\\b", Pattern.CASE_INSENSITIVE);

    public Set<Integer> scan(Path file, Charset charset) throws IOException {
        return scan(file.toString(), Files.readAllLines(file, charset));
    }

    /**
     * @param fileName 仅用于错误信息
     * @throws UnbalancedDirectiveException 区域内再次出现 begin，或区域外出现 end
     */
    public Set<Integer> scan(String fileName, List<String> sourceLines) {
        Set<Integer> excluded = new TreeSet<>();
        boolean inExclusion = false;
        for (int i = 0; i < sourceLines.size(); i++) {
            int lineNumber = i + 1;
            Matcher matcher = DIRECTIVE.matcher(sourceLines.get(i));
            if (matcher.find()) {
                boolean begin = "begin".equalsIgnoreCase(matcher.group(1));
                if (begin == inExclusion) {
                    throw new UnbalancedDirectiveException(fileName, lineNumber);
                }
                inExclusion = begin;
                // 结束标记所在行同样被排除
                excluded.add(lineNumber);
                continue;
            }
            if (inExclusion) {
                excluded.add(lineNumber);
            }
        }
        return excluded;
    }
}
