package com.gullang.cli;

import java.io.PrintStream;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.StreamHandler;

/**
 * CLI 日志配置：一个输出到 stderr 的处理器，单行格式
 */
final class LogSetup {

    /** 解释器与编译器的日志树 */
    static final String[] ROOTS = {"gul", "com.gullang"};

    // 持有引用，避免 Logger 被回收后配置丢失
    private static final Logger[] CONFIGURED = new Logger[ROOTS.length];

    private LogSetup() {
    }

    static void install(boolean debug, PrintStream stream) {
        Level level = debug ? Level.FINE : Level.INFO;
        Handler handler = new FlushingHandler(stream);
        handler.setLevel(level);
        for (int i = 0; i < ROOTS.length; i++) {
            Logger logger = Logger.getLogger(ROOTS[i]);
            for (Handler old : logger.getHandlers()) {
                logger.removeHandler(old);
            }
            logger.setUseParentHandlers(false);
            logger.setLevel(level);
            logger.addHandler(handler);
            CONFIGURED[i] = logger;
        }
    }

    /**
     * [LEVEL] SimpleClassName: message
     */
    static final class OneLineFormatter extends Formatter {
        @Override
        public String format(LogRecord record) {
            String name = record.getLoggerName();
            if (name != null) {
                name = name.substring(name.lastIndexOf('.') + 1);
            }
            StringBuilder sb = new StringBuilder();
            sb.append('[').append(record.getLevel().getName()).append("] ");
            if (name != null) {
                sb.append(name).append(": ");
            }
            sb.append(formatMessage(record)).append(System.lineSeparator());
            if (record.getThrown() != null) {
                sb.append("  caused by ").append(record.getThrown()).append(System.lineSeparator());
            }
            return sb.toString();
        }
    }

    private static final class FlushingHandler extends StreamHandler {
        FlushingHandler(PrintStream stream) {
            super(stream, new OneLineFormatter());
        }

        @Override
        public synchronized void publish(LogRecord record) {
            super.publish(record);
            flush();
        }
    }
}
