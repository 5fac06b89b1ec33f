package gul.runtime.interpreter;

import gul.runtime.GulCallable;
import gul.runtime.GulValue;

import java.util.List;

/**
 * 原生（Java）函数
 */
public final class GulNativeFunction extends GulValue implements GulCallable {

    /**
     * 原生函数接口
     */
    @FunctionalInterface
    public interface NativeFunc {
        GulValue apply(List<GulValue> args);
    }

    private final String name;
    private final int arity;
    private final NativeFunc function;

    public GulNativeFunction(String name, int arity, NativeFunc function) {
        this.name = name;
        this.arity = arity;
        this.function = function;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getArity() {
        return arity;
    }

    @Override
    public String getTypeName() {
        return "builtin_function_or_method";
    }

    @Override
    public boolean isCallable() {
        return true;
    }

    @Override
    public String render() {
        return "<built-in function " + name + ">";
    }

    @Override
    public GulValue call(List<GulValue> args) {
        if (arity >= 0 && args.size() < arity) {
            throw new GulRuntimeException(name + "() takes " + arity + " argument"
                    + (arity == 1 ? "" : "s") + " (" + args.size() + " given)");
        }
        return function.apply(args);
    }
}
