package gul.runtime;

/**
 * GUL 运行时值的基类
 *
 * <p>值是一个标签联合：整数、浮点、字符串、布尔、None、列表、元组、字典、集合，
 * 以及由其他模块提供的函数、结构体与枚举。渲染规则与 Python 的 str / repr 一致。</p>
 */
public abstract class GulValue {

    /**
     * 获取值的类型名称
     */
    public abstract String getTypeName();

    /**
     * 转换为布尔值（用于条件判断）
     */
    public boolean isTruthy() {
        return true;
    }

    public boolean isNone() {
        return false;
    }

    public boolean isNumber() {
        return false;
    }

    public boolean isString() {
        return false;
    }

    public boolean isCallable() {
        return false;
    }

    /**
     * 转换为 long
     */
    public long asLong() {
        throw new GulException("Cannot convert " + getTypeName() + " to int");
    }

    /**
     * 转换为 double
     */
    public double asDouble() {
        throw new GulException("Cannot convert " + getTypeName() + " to float");
    }

    /**
     * print / str 使用的文本形式
     */
    public String render() {
        return toString();
    }

    /**
     * 嵌在容器中时的文本形式（字符串带引号）
     */
    public String repr() {
        return render();
    }

    @Override
    public String toString() {
        return render();
    }

    /**
     * 获取任意值的类型名，null 视为 None
     */
    public static String typeNameOf(GulValue value) {
        return value == null ? "NoneType" : value.getTypeName();
    }
}
