package org.csu.konf.engine;

import lombok.Builder;
import lombok.Getter;
import org.csu.konf.compiler.parser.Parser;

import java.io.PrintStream;

/**
 * 流水线的配置项，不读取环境变量或配置文件。
 */
@Getter
@Builder
public class KonfOptions {

    // JSON 输出是否缩进
    @Builder.Default
    private final boolean prettyPrint = false;

    // 是否打印每个阶段的 [TRACE] 信息
    @Builder.Default
    private final boolean trace = false;

    @Builder.Default
    private final int maxNestingDepth = Parser.DEFAULT_MAX_NESTING_DEPTH;

    @Builder.Default
    private final PrintStream traceOut = System.out;

    public static KonfOptions defaults() {
        return KonfOptions.builder().build();
    }
}
