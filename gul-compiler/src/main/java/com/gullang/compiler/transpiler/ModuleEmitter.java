package com.gullang.compiler.transpiler;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collection;

/**
 * 生成模块声明与固定的兼容前导代码
 *
 * <p>入口文件 = 前导 + {@code mod x;} 声明 + 转译正文；
 * 其他文件 = 简短文件头 + 转译正文；子目录各生成一个 {@code mod.rs}。</p>
 */
public class ModuleEmitter {

    static final String PRELUDE_RESOURCE = "/com/gullang/compiler/transpiler/prelude.rs";

    private static volatile String prelude;

    /**
     * 入口文件前导：容器导入、字符串拼接辅助 trait、dict! 宏、sys 与文件 I/O 垫片
     */
    public String prelude() {
        String p = prelude;
        if (p == null) {
            p = loadPrelude();
            prelude = p;
        }
        return p;
    }

    /** 非入口文件的文件头 */
    public String header() {
        return "// Auto-generated from GUL source\n"
                + "#![allow(unused_variables, dead_code, unused_mut, unused_imports, non_snake_case)]\n"
                + "\n"
                + "use std::collections::{HashMap, HashSet};\n"
                + "use crate::*;\n"
                + "\n";
    }

    /** 入口文件中的 {@code mod x;} 列表 */
    public String moduleDeclarations(Collection<String> modules) {
        StringBuilder sb = new StringBuilder();
        for (String module : modules) {
            sb.append("mod ").append(module).append(";\n");
        }
        return sb.toString();
    }

    /** 子目录的 mod.rs */
    public String modRs(Collection<String> children) {
        StringBuilder sb = new StringBuilder("// Auto-generated module index\n");
        for (String child : children) {
            sb.append("pub mod ").append(child).append(";\n");
        }
        return sb.toString();
    }

    public String emitEntry(String body, Collection<String> modules) {
        StringBuilder sb = new StringBuilder(prelude());
        String mods = moduleDeclarations(modules);
        if (!mods.isEmpty()) {
            sb.append(mods).append('\n');
        }
        return sb.append(body).toString();
    }

    public String emitModule(String body) {
        return header() + body;
    }

    private static String loadPrelude() {
        InputStream in = ModuleEmitter.class.getResourceAsStream(PRELUDE_RESOURCE);
        if (in == null) {
            throw new IllegalStateException("Missing resource " + PRELUDE_RESOURCE);
        }
        try (InputStream stream = in) {
            String text = new String(stream.readAllBytes(), StandardCharsets.UTF_8);
            return text.endsWith("\n") ? text : text + "\n";
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
