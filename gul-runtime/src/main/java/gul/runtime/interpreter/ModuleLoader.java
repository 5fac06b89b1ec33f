package gul.runtime.interpreter;

import gul.runtime.GulValue;
import gul.runtime.types.Environment;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 模块加载器
 *
 * <p>{@code @imp a.b.c} 对应文件 {@code a/b/c.mn}，先相对当前执行文件所在目录查找，
 * 再相对工作目录查找。模块在共享环境中执行一次，导出的是执行期间新增的全部绑定；
 * 按点分路径缓存，重复导入直接返回缓存的命名空间。</p>
 *
 * <p>执行前先登记一个空的命名空间，循环导入时后到的一方拿到的是尚未填充的映射。</p>
 */
public final class ModuleLoader {

    private static final Logger LOG = Logger.getLogger(ModuleLoader.class.getName());

    public static final String SOURCE_EXTENSION = ".mn";

    private final Interpreter interpreter;
    private final Map<String, Map<String, GulValue>> loaded = new HashMap<String, Map<String, GulValue>>();

    ModuleLoader(Interpreter interpreter) {
        this.interpreter = interpreter;
    }

    /**
     * 加载模块并返回其导出的绑定
     *
     * @return 找不到文件时返回空映射（不缓存，下次仍会查找）
     */
    public Map<String, GulValue> load(String dottedPath) {
        Map<String, GulValue> cached = loaded.get(dottedPath);
        if (cached != null) {
            LOG.fine("Module cache hit: " + dottedPath);
            return cached;
        }
        String relative = toRelativePath(dottedPath);
        Path file = resolve(relative);
        if (file == null) {
            LOG.warning("Could not find module " + dottedPath + " at " + relative);
            return Collections.emptyMap();
        }
        LOG.fine("Loading module " + dottedPath + " from " + file);

        Map<String, GulValue> exports = new LinkedHashMap<String, GulValue>();
        loaded.put(dottedPath, exports);
        try {
            String source = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
            Environment env = interpreter.getEnvironment();
            Map<String, GulValue> before = env.snapshot();
            interpreter.executeModule(source, file.toString());
            exports.putAll(env.newSince(before));
        } catch (IOException e) {
            loaded.remove(dottedPath);
            throw new GulRuntimeException("Cannot read module " + dottedPath + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            loaded.remove(dottedPath);
            throw e;
        }
        return exports;
    }

    public boolean isLoaded(String dottedPath) {
        return loaded.containsKey(dottedPath);
    }

    public int getLoadedCount() {
        return loaded.size();
    }

    /** a.b.c → a/b/c.mn */
    static String toRelativePath(String dottedPath) {
        return dottedPath.replace('.', '/') + SOURCE_EXTENSION;
    }

    private Path resolve(String relative) {
        Path fromFile = interpreter.currentDirectory().resolve(relative);
        if (Files.isRegularFile(fromFile)) {
            return fromFile;
        }
        Path fromWorkingDir = interpreter.getWorkingDirectory().resolve(Paths.get(relative));
        if (Files.isRegularFile(fromWorkingDir)) {
            return fromWorkingDir;
        }
        return null;
    }
}
