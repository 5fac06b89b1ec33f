package com.gullang.compiler.transpiler;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 目录级转译驱动
 *
 * <p>遍历源目录下所有源文件（跳过排除目录），镜像目录结构写出目标文件。
 * 根目录的入口文件加上前导与 {@code mod} 声明，每个子目录生成 {@code mod.rs}。
 * 单个文件失败只记录日志并计入报告，不影响其他文件。</p>
 */
public class ProjectTranspiler {

    private static final Logger LOG = Logger.getLogger(ProjectTranspiler.class.getName());

    private static final String ROOT = "";

    private final TranspilerConfig config;
    private final ModuleEmitter emitter = new ModuleEmitter();

    public ProjectTranspiler(TranspilerConfig config) {
        this.config = config;
    }

    public ProjectTranspiler() {
        this(TranspilerConfig.defaults());
    }

    /** 按配置中的 src_dir / dest_dir 转译 */
    public TranspileReport transpileProject() {
        return transpileProject(Path.of(config.getSrcDir()), Path.of(config.getDestDir()));
    }

    public TranspileReport transpileProject(Path srcDir, Path destDir) {
        if (!Files.isDirectory(srcDir)) {
            throw new TranspileException("Source directory not found", srcDir, null);
        }
        List<Path> sources = collectSources(srcDir);
        LOG.info("Found " + sources.size() + " GUL files in " + srcDir);

        TranspileReport report = new TranspileReport();
        Map<Path, String> contents = new LinkedHashMap<Path, String>();
        Set<String> enums = new LinkedHashSet<String>();
        Set<String> structs = new LinkedHashSet<String>();
        for (Path source : sources) {
            try {
                String text = Files.readString(source, StandardCharsets.UTF_8);
                contents.put(source, text);
                enums.addAll(SyntaxRewriteEngine.declaredEnums(text));
                structs.addAll(SyntaxRewriteEngine.declaredStructs(text));
            } catch (IOException e) {
                LOG.log(Level.WARNING, "Cannot read " + source, e);
                report.addFailed(source);
            }
        }

        SyntaxRewriteEngine engine = new SyntaxRewriteEngine(config);
        engine.registerTypes(enums, structs);

        // 目录（相对路径，'/' 分隔）→ 其下的模块名
        Map<String, Set<String>> modules = new TreeMap<String, Set<String>>();
        modules.put(ROOT, new TreeSet<String>());
        Path entrySource = null;
        String entryBody = null;

        for (Map.Entry<Path, String> entry : contents.entrySet()) {
            Path source = entry.getKey();
            Path rel = srcDir.relativize(source);
            try {
                TranspileResult result = engine.transpile(entry.getValue());
                if (!result.isBalanced()) {
                    LOG.warning("Unbalanced block frames in " + rel + ": opened " + result.getFramesOpened()
                            + ", closed " + result.getFramesClosed());
                    report.addUnbalanced();
                }
                if (rel.getParent() == null && rel.getFileName().toString().equals(config.getEntryFile())) {
                    entrySource = source;
                    entryBody = result.getCode();
                    continue;
                }
                registerModule(modules, rel);
                Path out = destDir.resolve(targetPath(rel));
                write(out, emitter.emitModule(result.getCode()));
                report.addWritten(out);
                LOG.fine("Transpiled " + rel);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Error transpiling " + source + ": " + e.getMessage(), e);
                report.addFailed(source);
            }
        }

        for (Map.Entry<String, Set<String>> dir : modules.entrySet()) {
            if (ROOT.equals(dir.getKey())) {
                continue;
            }
            Path out = destDir.resolve(dir.getKey()).resolve("mod" + config.getTargetExtension());
            try {
                write(out, emitter.modRs(dir.getValue()));
                report.addWritten(out);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Cannot write " + out, e);
            }
        }

        if (entrySource != null) {
            Path out = destDir.resolve(targetPath(srcDir.relativize(entrySource)));
            try {
                write(out, emitter.emitEntry(entryBody, modules.get(ROOT)));
                report.addWritten(out);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Cannot write " + out, e);
                report.addFailed(entrySource);
            }
        } else {
            LOG.info("No entry file " + config.getEntryFile() + " in " + srcDir + ", prelude not emitted");
        }
        LOG.info(report.summary() + " to " + destDir);
        return report;
    }

    /**
     * 单文件模式：输出带前导，可独立编译
     */
    public TranspileResult transpileFile(Path input, Path output) {
        String text;
        try {
            text = Files.readString(input, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TranspileException("Cannot read source file", input, e);
        }
        SyntaxRewriteEngine engine = new SyntaxRewriteEngine(config);
        TranspileResult result = engine.transpile(text);
        if (!result.isBalanced()) {
            LOG.warning("Unbalanced block frames in " + input);
        }
        write(output, emitter.emitEntry(result.getCode(), new ArrayList<String>()));
        LOG.info("Generated " + output);
        return result;
    }

    /** 单文件模式的默认输出路径：替换扩展名 */
    public Path defaultOutput(Path input) {
        return input.resolveSibling(replaceExtension(input.getFileName().toString()));
    }

    private List<Path> collectSources(Path srcDir) {
        try (Stream<Path> walk = Files.walk(srcDir)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(config.getSourceExtension()))
                    .filter(p -> !excluded(srcDir.relativize(p)))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new TranspileException("Cannot list source directory", srcDir, e);
        }
    }

    private boolean excluded(Path rel) {
        Path parent = rel.getParent();
        if (parent == null) {
            return false;
        }
        for (Path segment : parent) {
            if (config.getExcludeDirs().contains(segment.toString())) {
                return true;
            }
        }
        return false;
    }

    /** 把文件登记到所在目录，并把每级目录登记到上一级 */
    private void registerModule(Map<String, Set<String>> modules, Path rel) {
        String stem = stem(rel.getFileName().toString());
        Path parent = rel.getParent();
        String dir = parent == null ? ROOT : slashed(parent);
        modules.computeIfAbsent(dir, k -> new TreeSet<String>()).add(stem);
        while (parent != null) {
            Path up = parent.getParent();
            String upKey = up == null ? ROOT : slashed(up);
            modules.computeIfAbsent(upKey, k -> new TreeSet<String>()).add(parent.getFileName().toString());
            parent = up;
        }
    }

    private Path targetPath(Path rel) {
        String name = replaceExtension(rel.getFileName().toString());
        return rel.getParent() == null ? Path.of(name) : rel.getParent().resolve(name);
    }

    private String replaceExtension(String fileName) {
        return stem(fileName) + config.getTargetExtension();
    }

    private String stem(String fileName) {
        String ext = config.getSourceExtension();
        if (fileName.endsWith(ext)) {
            return fileName.substring(0, fileName.length() - ext.length());
        }
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private static String slashed(Path path) {
        StringBuilder sb = new StringBuilder();
        for (Path segment : path) {
            if (sb.length() > 0) {
                sb.append('/');
            }
            sb.append(segment);
        }
        return sb.toString();
    }

    private static void write(Path out, String content) {
        try {
            Path parent = out.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(out, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TranspileException("Cannot write output file", out, e);
        }
    }
}
