package com.gullang.compiler.source;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * 缩进块追踪器
 *
 * <p>只依据缩进推导块边界：每遇到一个非空行，弹出所有起始缩进 &gt;= 该行缩进的帧
 * （同级的后继语句因此能关闭前一个块）。行尾为 ':' 或 '{' 的行开启新块。
 * 括号跨行的参数列表通过括号深度计数识别，续行不会被当作新块或触发关闭。
 * 帧由调用方按块头的语义构造后 {@link #push} 进来。</p>
 *
 * <p>帧的压入与弹出严格后进先出。</p>
 */
public class IndentationBlockTracker {

    private final Deque<BlockFrame> stack = new ArrayDeque<BlockFrame>();
    private int parenDepth;
    private int opened;
    private int closed;

    /**
     * 处理一行，返回因此关闭的帧（按弹出顺序）。
     * 空行、纯注释行和括号续行不关闭任何帧。
     */
    public List<BlockFrame> advance(LogicalLine line) {
        if (line.isBlank()) {
            return Collections.emptyList();
        }
        if (parenDepth > 0) {
            parenDepth = opensBlock(line.getCode()) ? 0 : Math.max(0, parenDepth + parenDelta(line.getCode()));
            return Collections.emptyList();
        }
        List<BlockFrame> popped = new ArrayList<BlockFrame>();
        while (!stack.isEmpty() && stack.peek().getIndent() >= line.getIndent()) {
            popped.add(stack.pop());
            closed++;
        }
        // 以 '{' 结尾的行把未闭合的括号交给块帧，不进入续行状态
        parenDepth = opensBlock(line.getCode()) ? 0 : Math.max(0, parenDelta(line.getCode()));
        return popped;
    }

    public void push(BlockFrame frame) {
        stack.push(frame);
        opened++;
    }

    /** 弹出栈顶帧（用于显式 '}' 行消费对应的隐式关闭） */
    public BlockFrame pop() {
        closed++;
        return stack.pop();
    }

    public BlockFrame peek() {
        return stack.peek();
    }

    /** 上一行留下了未闭合的括号，下一行是续行 */
    public boolean isContinuation() {
        return parenDepth > 0;
    }

    /**
     * 输入结束：按栈序强制关闭所有未结束的块
     */
    public List<BlockFrame> drain() {
        List<BlockFrame> popped = new ArrayList<BlockFrame>(stack.size());
        while (!stack.isEmpty()) {
            popped.add(stack.pop());
            closed++;
        }
        parenDepth = 0;
        return popped;
    }

    public int getOpenedCount() {
        return opened;
    }

    public int getClosedCount() {
        return closed;
    }

    /** 行尾（去掉注释后）为 ':' 或 '{' */
    private static boolean opensBlock(String code) {
        return code.endsWith(":") || code.endsWith("{");
    }

    /**
     * 从块头 headerIndex 向后扫描，返回第一个缩进 &lt;= 块头缩进的非空行下标，
     * 到达末尾返回 lines.size()
     */
    public static int blockEnd(List<LogicalLine> lines, int headerIndex) {
        int headerIndent = lines.get(headerIndex).getIndent();
        for (int i = headerIndex + 1; i < lines.size(); i++) {
            LogicalLine line = lines.get(i);
            if (!line.isBlank() && line.getIndent() <= headerIndent) {
                return i;
            }
        }
        return lines.size();
    }

    /** 只计圆括号和方括号，花括号由块帧处理 */
    private static int parenDelta(String code) {
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < code.length(); i++) {
            char c = code.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '(' || c == '[') {
                depth++;
            } else if (c == ')' || c == ']') {
                depth--;
            }
        }
        return depth;
    }
}
