package gul.runtime.interpreter;

import com.gullang.compiler.source.LogicalLine;
import gul.runtime.GulCallable;
import gul.runtime.GulValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 源码中定义的函数
 *
 * <p>函数体是定义处之后的一段逻辑行；闭包是定义时环境的快照，之后外层的修改对它不可见。</p>
 */
public final class GulFunction extends GulValue implements GulCallable {

    private final String name;
    private final List<Parameter> params;
    private final String returnType;
    private final List<LogicalLine> body;
    private final Map<String, GulValue> closure;
    private final String fileName;
    private final int line;
    private final Interpreter interpreter;

    public GulFunction(String name, List<Parameter> params, String returnType, List<LogicalLine> body,
                       Map<String, GulValue> closure, String fileName, int line, Interpreter interpreter) {
        this.name = name;
        this.params = new ArrayList<Parameter>(params);
        this.returnType = returnType;
        this.body = new ArrayList<LogicalLine>(body);
        this.closure = closure;
        this.fileName = fileName;
        this.line = line;
        this.interpreter = interpreter;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getArity() {
        return params.size();
    }

    public List<Parameter> getParams() {
        return Collections.unmodifiableList(params);
    }

    /** 第一个参数名为 self */
    public boolean isInstanceMethod() {
        return !params.isEmpty() && "self".equals(params.get(0).getName());
    }

    public String getReturnType() {
        return returnType;
    }

    public List<LogicalLine> getBody() {
        return Collections.unmodifiableList(body);
    }

    Map<String, GulValue> getClosure() {
        return closure;
    }

    public String getFileName() {
        return fileName;
    }

    /** fn 声明所在行 */
    public int getLine() {
        return line;
    }

    @Override
    public String getTypeName() {
        return "function";
    }

    @Override
    public boolean isCallable() {
        return true;
    }

    @Override
    public String render() {
        return "<function " + name + ">";
    }

    @Override
    public GulValue call(List<GulValue> args) {
        return interpreter.callFunction(this, args, Collections.<String, GulValue>emptyMap());
    }

    public GulValue call(List<GulValue> args, Map<String, GulValue> namedArgs) {
        return interpreter.callFunction(this, args, namedArgs);
    }
}
