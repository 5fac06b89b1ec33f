package gul.runtime.interpreter;

import gul.runtime.GulBoolean;
import gul.runtime.GulDict;
import gul.runtime.GulFloat;
import gul.runtime.GulInt;
import gul.runtime.GulList;
import gul.runtime.GulNone;
import gul.runtime.GulNumber;
import gul.runtime.GulSet;
import gul.runtime.GulString;
import gul.runtime.GulTuple;
import gul.runtime.GulValue;
import gul.runtime.types.Environment;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 内置函数注册，以及 @type(expr) 与 int()/str() 等共用的类型转换
 */
public final class Builtins {

    private static final Logger LOG = Logger.getLogger(Builtins.class.getName());

    private Builtins() {}

    public static void register(Interpreter interp, Environment env) {
        // ============ I/O ============

        env.define("print", new GulNativeFunction("print", -1, args -> {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < args.size(); i++) {
                if (i > 0) {
                    sb.append(' ');
                }
                sb.append(args.get(i).render());
            }
            interp.getStdout().println(sb);
            return GulNone.NONE;
        }));

        // ============ 类型转换 ============

        env.define("str", new GulNativeFunction("str", -1,
                args -> args.isEmpty() ? GulString.EMPTY : convert("str", args.get(0))));
        env.define("int", new GulNativeFunction("int", -1,
                args -> args.isEmpty() ? GulInt.of(0) : convert("int", args.get(0))));
        env.define("float", new GulNativeFunction("float", -1,
                args -> args.isEmpty() ? GulFloat.of(0.0) : convert("float", args.get(0))));
        env.define("bool", new GulNativeFunction("bool", -1,
                args -> args.isEmpty() ? GulBoolean.FALSE : convert("bool", args.get(0))));
        env.define("list", new GulNativeFunction("list", -1,
                args -> args.isEmpty() ? new GulList() : convert("list", args.get(0))));
        env.define("dict", new GulNativeFunction("dict", -1,
                args -> args.isEmpty() ? new GulDict() : convert("dict", args.get(0))));
        env.define("set", new GulNativeFunction("set", -1,
                args -> args.isEmpty() ? new GulSet() : convert("set", args.get(0))));
        env.define("tuple", new GulNativeFunction("tuple", -1,
                args -> args.isEmpty() ? new GulTuple(new ArrayList<GulValue>()) : convert("tuple", args.get(0))));

        // ============ 序列 ============

        env.define("len", new GulNativeFunction("len", 1, args -> GulInt.of(length(args.get(0)))));

        // range(stop) / range(start, stop[, step])，直接返回列表
        env.define("range", new GulNativeFunction("range", 1, args -> {
            long start = 0;
            long stop;
            long step = 1;
            if (args.size() == 1) {
                stop = args.get(0).asLong();
            } else {
                start = args.get(0).asLong();
                stop = args.get(1).asLong();
                if (args.size() > 2) {
                    step = args.get(2).asLong();
                }
            }
            if (step == 0) {
                throw new GulRuntimeException("range() arg 3 must not be zero");
            }
            GulList result = new GulList();
            for (long i = start; step > 0 ? i < stop : i > stop; i += step) {
                result.add(GulInt.of(i));
            }
            return result;
        }));

        // ============ 文件 ============

        env.define("read_file", new GulNativeFunction("read_file", 1, args -> {
            Path path = interp.resolvePath(args.get(0).render());
            try {
                return GulString.of(new String(Files.readAllBytes(path), StandardCharsets.UTF_8));
            } catch (NoSuchFileException e) {
                throw new GulRuntimeException("No such file or directory: '" + args.get(0).render() + "'", e);
            } catch (IOException e) {
                throw new GulRuntimeException("read_file failed: " + e.getMessage(), e);
            }
        }));

        env.define("write_file", new GulNativeFunction("write_file", 2, args -> {
            Path path = interp.resolvePath(args.get(0).render());
            try {
                Files.write(path, args.get(1).render().getBytes(StandardCharsets.UTF_8));
                return GulBoolean.TRUE;
            } catch (IOException e) {
                LOG.log(Level.WARNING, "Error writing file " + args.get(0).render(), e);
                return GulBoolean.FALSE;
            }
        }));

        env.define("file_exists", new GulNativeFunction("file_exists", 1,
                args -> GulBoolean.of(Files.exists(interp.resolvePath(args.get(0).render())))));

        env.define("sys", interp.getSysModule());
    }

    /**
     * 按类型名转换，供内置函数与 @type(expr) 共用
     */
    static GulValue convert(String typeName, GulValue value) {
        switch (typeName) {
            case "str":
                return value instanceof GulString ? value : GulString.of(value.render());
            case "int":
                return toInt(value);
            case "float":
                return toFloat(value);
            case "bool":
                return GulBoolean.of(value.isTruthy());
            case "list":
                return new GulList(GulIterables.elements(value));
            case "set":
                return new GulSet(GulIterables.elements(value));
            case "tuple":
                return new GulTuple(GulIterables.elements(value));
            case "dict":
                return toDict(value);
            default:
                throw new GulRuntimeException("Unknown type constructor: @" + typeName);
        }
    }

    static boolean isConversion(String typeName) {
        switch (typeName) {
            case "str":
            case "int":
            case "float":
            case "bool":
            case "list":
            case "set":
            case "tuple":
            case "dict":
                return true;
            default:
                return false;
        }
    }

    /** 空值：@list() 之类不带参数的构造 */
    static GulValue emptyOf(String typeName) {
        switch (typeName) {
            case "str": return GulString.EMPTY;
            case "int": return GulInt.of(0);
            case "float": return GulFloat.of(0.0);
            case "bool": return GulBoolean.FALSE;
            case "list": return new GulList();
            case "set": return new GulSet();
            case "tuple": return new GulTuple(new ArrayList<GulValue>());
            case "dict": return new GulDict();
            default:
                throw new GulRuntimeException("Unknown type constructor: @" + typeName);
        }
    }

    static long length(GulValue value) {
        if (value instanceof GulString) {
            return ((GulString) value).length();
        }
        if (value instanceof GulList) {
            return ((GulList) value).size();
        }
        if (value instanceof GulTuple) {
            return ((GulTuple) value).size();
        }
        if (value instanceof GulDict) {
            return ((GulDict) value).size();
        }
        if (value instanceof GulSet) {
            return ((GulSet) value).size();
        }
        throw new GulRuntimeException("object of type '" + value.getTypeName() + "' has no len()");
    }

    private static GulValue toInt(GulValue value) {
        if (value instanceof GulInt) {
            return value;
        }
        if (value instanceof GulNumber || value instanceof GulBoolean) {
            double d = value.asDouble();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new GulRuntimeException("cannot convert float " + value.render() + " to integer");
            }
            return GulInt.of(value.asLong());
        }
        if (value instanceof GulString) {
            String s = ((GulString) value).getValue().trim().replace("_", "");
            try {
                return GulInt.of(Long.parseLong(s));
            } catch (NumberFormatException e) {
                throw new GulRuntimeException("invalid literal for int() with base 10: " + value.repr());
            }
        }
        throw new GulRuntimeException("int() argument must be a string or a number, not '"
                + value.getTypeName() + "'");
    }

    private static GulValue toFloat(GulValue value) {
        if (value instanceof GulFloat) {
            return value;
        }
        if (value instanceof GulNumber || value instanceof GulBoolean) {
            return GulFloat.of(value.asDouble());
        }
        if (value instanceof GulString) {
            String s = ((GulString) value).getValue().trim().toLowerCase();
            switch (s) {
                case "inf":
                case "+inf":
                case "infinity":
                    return GulFloat.INFINITY;
                case "-inf":
                case "-infinity":
                    return GulFloat.of(Double.NEGATIVE_INFINITY);
                case "nan":
                    return GulFloat.of(Double.NaN);
                default:
                    break;
            }
            try {
                return GulFloat.of(Double.parseDouble(s));
            } catch (NumberFormatException e) {
                throw new GulRuntimeException("could not convert string to float: " + value.repr());
            }
        }
        throw new GulRuntimeException("float() argument must be a string or a number, not '"
                + value.getTypeName() + "'");
    }

    // dict(d) 复制；dict([(k, v), ...]) 由键值对构造
    private static GulValue toDict(GulValue value) {
        if (value instanceof GulDict) {
            return new GulDict(((GulDict) value).getEntries());
        }
        GulDict result = new GulDict();
        for (GulValue item : GulIterables.elements(value)) {
            List<GulValue> pair = GulIterables.elements(item);
            if (pair.size() != 2) {
                throw new GulRuntimeException("dictionary update sequence element has length "
                        + pair.size() + "; 2 is required");
            }
            result.put(pair.get(0), pair.get(1));
        }
        return result;
    }
}
