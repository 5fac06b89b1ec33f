package com.gullang.cli;

import gul.runtime.interpreter.GulRuntimeException;
import gul.runtime.interpreter.Interpreter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * picocli run 子命令：解释执行 GUL 源文件
 */
@Command(name = "run", description = "解释执行 GUL 源文件")
public class RunCommand implements Callable<Integer> {

    private static final Logger LOG = Logger.getLogger(RunCommand.class.getName());

    /** 脚本执行线程的栈大小，保证默认调用深度上限先于 Java 栈耗尽生效 */
    static final long SCRIPT_STACK_SIZE = 512L * 1024 * 1024;

    @Parameters(index = "0", description = "源文件（.mn）")
    Path file;

    @Parameters(index = "1..*", arity = "0..*", description = "传给脚本的参数（sys.argv[1:]）")
    List<String> scriptArgs = new ArrayList<String>();

    @Option(names = "--debug", description = "输出逐行调试日志")
    boolean debug;

    @Option(names = "--max-steps", defaultValue = "0", description = "指令预算，0 表示不限制")
    long maxSteps;

    PrintStream out = System.out;
    PrintStream err = System.err;

    @Override
    public Integer call() {
        LogSetup.install(debug, err);

        Interpreter interpreter = new Interpreter();
        interpreter.setStdout(out);
        interpreter.setDebug(debug);
        interpreter.setMaxSteps(maxSteps);
        List<String> argv = new ArrayList<String>();
        argv.add(file.toString());
        argv.addAll(scriptArgs);
        interpreter.setArgv(argv);

        AtomicInteger exitCode = new AtomicInteger(1);
        Thread worker = new Thread(null, () -> exitCode.set(execute(interpreter)), "gul-main", SCRIPT_STACK_SIZE);
        worker.start();
        try {
            worker.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("❌ Error: Interrupted");
            return 1;
        }
        return exitCode.get();
    }

    private int execute(Interpreter interpreter) {
        try {
            interpreter.runFile(file);
            return 0;
        } catch (NoSuchFileException e) {
            err.println("❌ Error: No such file or directory: '" + file + "'");
            return 1;
        } catch (IOException e) {
            err.println("❌ Error: Cannot read " + file + ": " + e.getMessage());
            return 1;
        } catch (GulRuntimeException e) {
            err.println("❌ Error: " + e.getMessage());
            if (debug) {
                e.printStackTrace(err);
            }
            LOG.fine("Executed " + interpreter.getSteps() + " statements before failure");
            return 1;
        }
    }
}
