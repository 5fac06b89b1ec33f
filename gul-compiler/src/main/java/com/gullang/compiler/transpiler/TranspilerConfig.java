package com.gullang.compiler.transpiler;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 转译器配置
 *
 * <p>默认值对应引导编译器的目录布局，可以由 JSON 文件覆盖：</p>
 * <pre>
 * {
 *   "src_dir": "compiler",
 *   "dest_dir": "compiler_rust",
 *   "exclude_dirs": ["tests", "examples"]
 * }
 * </pre>
 */
public final class TranspilerConfig {

    public static final String DEFAULT_SRC_DIR = "compiler";
    public static final String DEFAULT_DEST_DIR = "compiler_rust";

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    @SerializedName("src_dir")
    private String srcDir = DEFAULT_SRC_DIR;

    @SerializedName("dest_dir")
    private String destDir = DEFAULT_DEST_DIR;

    @SerializedName("source_extension")
    private String sourceExtension = ".mn";

    @SerializedName("target_extension")
    private String targetExtension = ".rs";

    @SerializedName("entry_file")
    private String entryFile = "main.mn";

    @SerializedName("exclude_dirs")
    private List<String> excludeDirs = new ArrayList<String>(
            Arrays.asList("tests", "examples", "target", "__pycache__"));

    /** import 路径中代表源码根目录的首段，生成 use 时去掉；为空则取 src_dir 的目录名 */
    @SerializedName("import_root")
    private String importRoot;

    public static TranspilerConfig defaults() {
        return new TranspilerConfig();
    }

    /**
     * 从 JSON 文件加载，未出现的字段保持默认值
     */
    public static TranspilerConfig load(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            TranspilerConfig config = GSON.fromJson(reader, TranspilerConfig.class);
            if (config == null) {
                return defaults();
            }
            return config.fillDefaults();
        } catch (JsonParseException e) {
            throw new IOException("Invalid transpiler config " + file + ": " + e.getMessage(), e);
        }
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    // JSON 中显式写 null 的字段补回默认值
    private TranspilerConfig fillDefaults() {
        TranspilerConfig d = defaults();
        if (srcDir == null) srcDir = d.srcDir;
        if (destDir == null) destDir = d.destDir;
        if (sourceExtension == null) sourceExtension = d.sourceExtension;
        if (targetExtension == null) targetExtension = d.targetExtension;
        if (entryFile == null) entryFile = d.entryFile;
        if (excludeDirs == null) excludeDirs = d.excludeDirs;
        return this;
    }

    public String getSrcDir() {
        return srcDir;
    }

    public TranspilerConfig setSrcDir(String srcDir) {
        this.srcDir = srcDir;
        return this;
    }

    public String getDestDir() {
        return destDir;
    }

    public TranspilerConfig setDestDir(String destDir) {
        this.destDir = destDir;
        return this;
    }

    public String getSourceExtension() {
        return sourceExtension;
    }

    public String getTargetExtension() {
        return targetExtension;
    }

    public String getEntryFile() {
        return entryFile;
    }

    public List<String> getExcludeDirs() {
        return Collections.unmodifiableList(excludeDirs);
    }

    public TranspilerConfig setImportRoot(String importRoot) {
        this.importRoot = importRoot;
        return this;
    }

    public String getImportRoot() {
        if (importRoot != null && !importRoot.isEmpty()) {
            return importRoot;
        }
        Path name = Path.of(srcDir).getFileName();
        return name != null ? name.toString() : srcDir;
    }
}
