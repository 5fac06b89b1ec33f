package com.gullang.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * GUL 引导工具链 CLI 入口点（picocli）
 */
@Command(name = "gul", version = "GUL bootstrap v0.1.0",
         mixinStandardHelpOptions = true,
         description = "GUL 引导解释器与 GUL → Rust 转译器",
         subcommands = {RunCommand.class, TranspileCommand.class})
public class Main implements Runnable {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        // 未给子命令时输出用法
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    public static CommandLine commandLine() {
        return new CommandLine(new Main());
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
