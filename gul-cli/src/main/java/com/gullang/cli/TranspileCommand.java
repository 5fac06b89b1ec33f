package com.gullang.cli;

import com.gullang.compiler.transpiler.ProjectTranspiler;
import com.gullang.compiler.transpiler.TranspileException;
import com.gullang.compiler.transpiler.TranspileReport;
import com.gullang.compiler.transpiler.TranspileResult;
import com.gullang.compiler.transpiler.TranspilerConfig;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * picocli transpile 子命令：把 GUL 源码目录（或单个文件）转译为 Rust
 */
@Command(name = "transpile", description = "GUL → Rust 转译（目录或单个文件）")
public class TranspileCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", description = "源码目录（默认 compiler）")
    String srcDir;

    @Parameters(index = "1", arity = "0..1", description = "输出目录（默认 compiler_rust）")
    String destDir;

    @Option(names = "--config", description = "JSON 配置文件")
    Path configFile;

    @Option(names = "--file", description = "只转译单个文件")
    Path singleFile;

    @Option(names = {"-o", "--output"}, description = "单文件模式的输出路径（默认替换扩展名）")
    Path output;

    @Option(names = "--debug", description = "输出调试日志")
    boolean debug;

    PrintStream out = System.out;
    PrintStream err = System.err;

    @Override
    public Integer call() {
        LogSetup.install(debug, err);

        TranspilerConfig config;
        try {
            config = configFile != null ? TranspilerConfig.load(configFile) : TranspilerConfig.defaults();
        } catch (IOException e) {
            err.println("❌ Error: " + e.getMessage());
            return 1;
        }
        if (srcDir != null) {
            config.setSrcDir(srcDir);
        }
        if (destDir != null) {
            config.setDestDir(destDir);
        }

        ProjectTranspiler transpiler = new ProjectTranspiler(config);
        try {
            if (singleFile != null) {
                Path target = output != null ? output : transpiler.defaultOutput(singleFile);
                out.println("Transpiling " + singleFile + " -> " + target);
                TranspileResult result = transpiler.transpileFile(singleFile, target);
                out.println("✅ Generated " + target + (result.isBalanced() ? "" : " (unbalanced blocks)"));
                return 0;
            }
            TranspileReport report = transpiler.transpileProject();
            out.println((report.isSuccess() ? "✅ " : "❌ ") + report.summary() + " to " + config.getDestDir());
            return report.isSuccess() ? 0 : 1;
        } catch (TranspileException e) {
            err.println("❌ Error: " + e.getMessage());
            return 1;
        }
    }
}
