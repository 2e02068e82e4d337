package org.csu.konf.cli;

import org.csu.konf.common.exception.KonfException;
import org.csu.konf.engine.KonfOptions;
import org.csu.konf.engine.KonfProcessor;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 命令行入口：读取一份 konf 源码 (文件或标准输入)，执行一次流水线并打印 JSON。
 *
 * <pre>
 * java org.csu.konf.cli.KonfRunner [--pretty] [--trace] [file|-]
 * </pre>
 * 退出码：0 成功，2 konf 错误，3 参数或 I/O 错误。
 */
public class KonfRunner {

    static final int EXIT_OK = 0;
    static final int EXIT_KONF_ERROR = 2;
    static final int EXIT_USAGE_OR_IO_ERROR = 3;

    private static final String USAGE = "Usage: konf [--pretty] [--trace] [file|-]";

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        boolean pretty = false;
        boolean trace = false;
        String file = null;
        for (String arg : args) {
            switch (arg) {
                case "--pretty":
                    pretty = true;
                    break;
                case "--trace":
                    trace = true;
                    break;
                case "-h":
                case "--help":
                    out.println(USAGE);
                    return EXIT_OK;
                default:
                    if (arg.startsWith("--") || file != null) {
                        err.println("Unknown argument: " + arg);
                        err.println(USAGE);
                        return EXIT_USAGE_OR_IO_ERROR;
                    }
                    file = arg;
            }
        }

        String source;
        try {
            source = (file == null || file.equals("-"))
                    ? new String(in.readAllBytes(), StandardCharsets.UTF_8)
                    : Files.readString(Path.of(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("ERROR: Cannot read input: " + e.getMessage());
            return EXIT_USAGE_OR_IO_ERROR;
        }

        KonfProcessor processor = new KonfProcessor(KonfOptions.builder()
                .prettyPrint(pretty)
                .trace(trace)
                .traceOut(err)
                .build());
        try {
            out.println(processor.execute(source));
            return EXIT_OK;
        } catch (KonfException e) {
            err.println("ERROR [" + e.getKind() + "]: " + e.getMessage());
            return EXIT_KONF_ERROR;
        }
    }
}
