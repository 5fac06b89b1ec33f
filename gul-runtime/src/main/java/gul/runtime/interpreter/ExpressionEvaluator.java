package gul.runtime.interpreter;

import com.gullang.compiler.ast.AstVisitor;
import com.gullang.compiler.ast.expr.AssignExpr;
import com.gullang.compiler.ast.expr.BinaryExpr;
import com.gullang.compiler.ast.expr.CallExpr;
import com.gullang.compiler.ast.expr.CollectionLiteral;
import com.gullang.compiler.ast.expr.Expression;
import com.gullang.compiler.ast.expr.Identifier;
import com.gullang.compiler.ast.expr.IndexExpr;
import com.gullang.compiler.ast.expr.Literal;
import com.gullang.compiler.ast.expr.MemberExpr;
import com.gullang.compiler.ast.expr.StringInterpolation;
import com.gullang.compiler.ast.expr.StructLiteral;
import com.gullang.compiler.ast.expr.TypeConstructorExpr;
import com.gullang.compiler.ast.expr.UnaryExpr;
import gul.runtime.GulBoolean;
import gul.runtime.GulCallable;
import gul.runtime.GulDict;
import gul.runtime.GulFloat;
import gul.runtime.GulInt;
import gul.runtime.GulList;
import gul.runtime.GulNamespace;
import gul.runtime.GulNone;
import gul.runtime.GulSet;
import gul.runtime.GulString;
import gul.runtime.GulTuple;
import gul.runtime.GulValue;
import gul.runtime.types.Environment;
import gul.runtime.types.FieldSpec;
import gul.runtime.types.GulEnumDefinition;
import gul.runtime.types.GulEnumVariant;
import gul.runtime.types.GulStructDefinition;
import gul.runtime.types.GulStructInstance;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 表达式求值器
 *
 * <p>表达式文本先经解析缓存得到 AST，再由本访问者求值。所有值都在解释器唯一的
 * {@link Environment} 中查找。</p>
 *
 * <p>方法调用的查找顺序：接收者的原生方法 → 结构体实例方法表（接收者作为第一个参数）
 * → 结构体定义的静态方法表。</p>
 */
public final class ExpressionEvaluator implements AstVisitor<GulValue, Void> {

    private static final Logger LOG = Logger.getLogger(ExpressionEvaluator.class.getName());

    private final Interpreter interpreter;

    ExpressionEvaluator(Interpreter interpreter) {
        this.interpreter = interpreter;
    }

    /**
     * 求值一段表达式文本，line 为其所在的源码行
     */
    public GulValue evaluate(String text, int line) {
        return evaluate(interpreter.parseExpression(text, line));
    }

    /**
     * 执行表达式语句（可以是赋值或复合赋值）
     */
    public GulValue executeStatement(String text, int line) {
        return evaluate(interpreter.parseStatement(text, line));
    }

    public GulValue evaluate(Expression expr) {
        GulValue value = expr.accept(this, null);
        return value != null ? value : GulNone.NONE;
    }

    private Environment env() {
        return interpreter.getEnvironment();
    }

    // ============ 字面量 ============

    @Override
    public GulValue visitLiteral(Literal node, Void ctx) {
        switch (node.getKind()) {
            case INT: return GulInt.of((Long) node.getValue());
            case FLOAT: return GulFloat.of((Double) node.getValue());
            case STRING: return GulString.of((String) node.getValue());
            case BOOLEAN: return GulBoolean.of((Boolean) node.getValue());
            case NONE:
            default:
                return GulNone.NONE;
        }
    }

    @Override
    public GulValue visitStringInterpolation(StringInterpolation node, Void ctx) {
        StringBuilder sb = new StringBuilder();
        for (Object part : node.getParts()) {
            if (part instanceof Expression) {
                sb.append(evaluate((Expression) part).render());
            } else {
                sb.append(part);
            }
        }
        return GulString.of(sb.toString());
    }

    @Override
    public GulValue visitCollectionLiteral(CollectionLiteral node, Void ctx) {
        switch (node.getKind()) {
            case MAP: {
                GulDict dict = new GulDict();
                for (CollectionLiteral.MapEntry entry : node.getMapEntries()) {
                    dict.put(evaluate(entry.getKey()), evaluate(entry.getValue()));
                }
                return dict;
            }
            case SET:
                return new GulSet(evaluateAll(node.getElements()));
            case LIST:
            default:
                return new GulList(evaluateAll(node.getElements()));
        }
    }

    @Override
    public GulValue visitTypeConstructorExpr(TypeConstructorExpr node, Void ctx) {
        String typeName = node.getTypeName();
        if (!Builtins.isConversion(typeName)) {
            throw new GulRuntimeException("Unknown type constructor: @" + typeName);
        }
        if (node.getArgument() == null) {
            return Builtins.emptyOf(typeName);
        }
        return Builtins.convert(typeName, evaluate(node.getArgument()));
    }

    /**
     * Name{field: expr, ...}：未给出的字段取声明中的默认值，没有默认值为 None
     */
    @Override
    public GulValue visitStructLiteral(StructLiteral node, Void ctx) {
        GulValue bound = env().lookup(node.getTypeName());
        if (bound == null) {
            throw new GulRuntimeException("name '" + node.getTypeName() + "' is not defined");
        }
        if (!(bound instanceof GulStructDefinition)) {
            throw new GulRuntimeException("'" + node.getTypeName() + "' is not a struct");
        }
        GulStructDefinition definition = (GulStructDefinition) bound;
        Map<String, GulValue> given = new LinkedHashMap<String, GulValue>();
        for (Map.Entry<String, Expression> e : node.getFields().entrySet()) {
            given.put(e.getKey(), evaluate(e.getValue()));
        }
        Map<String, GulValue> fields = new LinkedHashMap<String, GulValue>();
        for (FieldSpec spec : definition.getFields()) {
            GulValue value = given.remove(spec.getName());
            if (value == null) {
                value = spec.hasDefault()
                        ? evaluate(spec.getDefaultSource(), node.getLocation().getLine())
                        : GulNone.NONE;
            }
            fields.put(spec.getName(), value);
        }
        // 未声明的字段照样保留
        fields.putAll(given);
        return new GulStructInstance(definition.getName(), definition, fields);
    }

    // ============ 名字与运算 ============

    @Override
    public GulValue visitIdentifier(Identifier node, Void ctx) {
        GulValue value = env().lookup(node.getName());
        if (value == null) {
            throw new GulRuntimeException("name '" + node.getName() + "' is not defined");
        }
        return value;
    }

    @Override
    public GulValue visitBinaryExpr(BinaryExpr node, Void ctx) {
        switch (node.getOperator()) {
            case AND: {
                GulValue left = evaluate(node.getLeft());
                return left.isTruthy() ? evaluate(node.getRight()) : left;
            }
            case OR: {
                GulValue left = evaluate(node.getLeft());
                return left.isTruthy() ? left : evaluate(node.getRight());
            }
            default:
                return BinaryOps.apply(node.getOperator(), evaluate(node.getLeft()), evaluate(node.getRight()));
        }
    }

    @Override
    public GulValue visitUnaryExpr(UnaryExpr node, Void ctx) {
        GulValue operand = evaluate(node.getOperand());
        if (node.getOperator() == UnaryExpr.UnaryOp.NOT) {
            return GulBoolean.of(!operand.isTruthy());
        }
        return BinaryOps.negate(operand);
    }

    // ============ 调用 ============

    @Override
    public GulValue visitCallExpr(CallExpr node, Void ctx) {
        if (node.isMethodCall()) {
            return callMethod(node, (MemberExpr) node.getCallee());
        }
        Expression callee = node.getCallee();
        if (callee instanceof Identifier && env().lookup(((Identifier) callee).getName()) == null) {
            throw new GulRuntimeException("name '" + ((Identifier) callee).getName() + "' is not defined");
        }
        GulValue function = evaluate(callee);
        return invoke(function, evaluateAll(node.getArgs()), evaluateNamed(node.getNamedArgs()));
    }

    private GulValue callMethod(CallExpr node, MemberExpr member) {
        String name = member.getMember();
        GulValue receiver = evaluate(member.getTarget());
        List<GulValue> args = evaluateAll(node.getArgs());
        Map<String, GulValue> named = evaluateNamed(node.getNamedArgs());
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("Dispatching " + receiver.getTypeName() + "." + name + " with " + args.size() + " args");
        }

        // Name.method(...)：先静态表，再实例表（不补接收者）
        if (receiver instanceof GulStructDefinition) {
            GulStructDefinition definition = (GulStructDefinition) receiver;
            GulCallable method = definition.findStaticMethod(name);
            if (method == null) {
                method = definition.findInstanceMethod(name);
            }
            if (method == null) {
                throw new GulRuntimeException("type object '" + definition.getName()
                        + "' has no attribute '" + name + "'");
            }
            return invokeCallable(method, args, named);
        }

        GulValue result = NativeMethods.invoke(receiver, name, args);
        if (result != null) {
            return result;
        }

        if (receiver instanceof GulStructInstance) {
            GulStructInstance instance = (GulStructInstance) receiver;
            GulStructDefinition definition = instance.getDefinition();
            GulCallable method = definition.findInstanceMethod(name);
            if (method != null) {
                List<GulValue> withSelf = new ArrayList<GulValue>(args.size() + 1);
                withSelf.add(instance);
                withSelf.addAll(args);
                return invokeCallable(method, withSelf, named);
            }
            method = definition.findStaticMethod(name);
            if (method != null) {
                return invokeCallable(method, args, named);
            }
            if (instance.hasField(name)) {
                return invoke(instance.getField(name), args, named);
            }
        }
        if (receiver instanceof GulNamespace && ((GulNamespace) receiver).hasAttribute(name)) {
            return invoke(((GulNamespace) receiver).getAttribute(name), args, named);
        }
        throw new GulRuntimeException("'" + receiver.getTypeName() + "' object has no attribute '" + name + "'");
    }

    /**
     * 调用任意值；不可调用时抛出异常
     */
    GulValue invoke(GulValue callee, List<GulValue> args, Map<String, GulValue> named) {
        if (callee instanceof GulCallable) {
            return invokeCallable((GulCallable) callee, args, named);
        }
        throw new GulRuntimeException("'" + callee.getTypeName() + "' object is not callable");
    }

    private GulValue invokeCallable(GulCallable callable, List<GulValue> args, Map<String, GulValue> named) {
        if (callable instanceof GulFunction) {
            return ((GulFunction) callable).call(args, named);
        }
        if (!named.isEmpty()) {
            throw new GulRuntimeException(callable.getName() + "() takes no keyword arguments");
        }
        GulValue result = callable.call(args);
        return result != null ? result : GulNone.NONE;
    }

    private List<GulValue> evaluateAll(List<Expression> exprs) {
        List<GulValue> values = new ArrayList<GulValue>(exprs.size());
        for (Expression e : exprs) {
            values.add(evaluate(e));
        }
        return values;
    }

    private Map<String, GulValue> evaluateNamed(Map<String, Expression> exprs) {
        if (exprs.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, GulValue> values = new LinkedHashMap<String, GulValue>();
        for (Map.Entry<String, Expression> e : exprs.entrySet()) {
            values.put(e.getKey(), evaluate(e.getValue()));
        }
        return values;
    }

    // ============ 下标与属性 ============

    @Override
    public GulValue visitIndexExpr(IndexExpr node, Void ctx) {
        GulValue target = evaluate(node.getTarget());
        GulValue index = evaluate(node.getIndex());
        if (target instanceof GulList) {
            GulList list = (GulList) target;
            return list.get(NativeMethods.normalizeIndex(checkIntIndex(index, "list"), list.size()));
        }
        if (target instanceof GulTuple) {
            GulTuple tuple = (GulTuple) target;
            return tuple.get(NativeMethods.normalizeIndex(checkIntIndex(index, "tuple"), tuple.size()));
        }
        if (target instanceof GulString) {
            String s = ((GulString) target).getValue();
            int cp = NativeMethods.normalizeIndex(checkIntIndex(index, "string"), ((GulString) target).length());
            int offset = s.offsetByCodePoints(0, cp);
            return GulString.of(new String(Character.toChars(s.codePointAt(offset))));
        }
        if (target instanceof GulDict) {
            GulValue value = ((GulDict) target).get(index);
            if (value == null) {
                throw new GulRuntimeException("KeyError: " + index.repr());
            }
            return value;
        }
        throw new GulRuntimeException("'" + target.getTypeName() + "' object is not subscriptable");
    }

    private static GulValue checkIntIndex(GulValue index, String what) {
        if (!BinaryOps.isInteger(index)) {
            throw new GulRuntimeException(what + " indices must be integers, not " + index.getTypeName());
        }
        return index;
    }

    /**
     * 属性访问。纯属性链 a.b.c 的根名字未绑定时，整条链求值为其源码文本
     */
    @Override
    public GulValue visitMemberExpr(MemberExpr node, Void ctx) {
        Identifier root = node.getRootIdentifier();
        if (root != null && env().lookup(root.getName()) == null) {
            LOG.fine("Unbound attribute root '" + root.getName() + "', using source text: " + node.getSourceText());
            return GulString.of(node.getSourceText());
        }
        return attribute(evaluate(node.getTarget()), node.getMember());
    }

    private GulValue attribute(GulValue target, String name) {
        if (target instanceof GulStructInstance) {
            GulStructInstance instance = (GulStructInstance) target;
            if (instance.hasField(name)) {
                return instance.getField(name);
            }
        } else if (target instanceof GulNamespace) {
            GulNamespace namespace = (GulNamespace) target;
            if (namespace.hasAttribute(name)) {
                return namespace.getAttribute(name);
            }
            throw new GulRuntimeException("module '" + namespace.getName() + "' has no attribute '" + name + "'");
        } else if (target instanceof GulEnumDefinition) {
            GulEnumVariant variant = ((GulEnumDefinition) target).getVariant(name);
            if (variant != null) {
                return variant;
            }
            throw new GulRuntimeException("enum '" + ((GulEnumDefinition) target).getName()
                    + "' has no variant '" + name + "'");
        } else if (target instanceof GulStructDefinition) {
            GulStructDefinition definition = (GulStructDefinition) target;
            GulCallable method = definition.findStaticMethod(name);
            if (method == null) {
                method = definition.findInstanceMethod(name);
            }
            if (method instanceof GulValue) {
                return (GulValue) method;
            }
        } else if (target instanceof GulDict) {
            GulValue value = ((GulDict) target).get(GulString.of(name));
            if (value != null) {
                return value;
            }
        }
        throw new GulRuntimeException("'" + target.getTypeName() + "' object has no attribute '" + name + "'");
    }

    // ============ 赋值 ============

    @Override
    public GulValue visitAssignExpr(AssignExpr node, Void ctx) {
        Expression target = node.getTarget();
        GulValue value = evaluate(node.getValue());
        BinaryExpr.BinaryOp op = node.getOperator().getBinaryOp();
        if (op != null) {
            value = BinaryOps.apply(op, evaluate(target), value);
        }
        if (target instanceof Identifier) {
            env().define(((Identifier) target).getName(), value);
        } else if (target instanceof MemberExpr) {
            MemberExpr member = (MemberExpr) target;
            setAttribute(evaluate(member.getTarget()), member.getMember(), value);
        } else if (target instanceof IndexExpr) {
            IndexExpr index = (IndexExpr) target;
            setIndex(evaluate(index.getTarget()), evaluate(index.getIndex()), value);
        } else {
            throw new GulRuntimeException("cannot assign to expression");
        }
        return value;
    }

    private static void setAttribute(GulValue target, String name, GulValue value) {
        if (target instanceof GulStructInstance) {
            ((GulStructInstance) target).setField(name, value);
        } else if (target instanceof GulNamespace) {
            ((GulNamespace) target).setAttribute(name, value);
        } else if (target instanceof GulDict) {
            ((GulDict) target).put(GulString.of(name), value);
        } else {
            throw new GulRuntimeException("'" + target.getTypeName() + "' object has no attribute '" + name + "'");
        }
    }

    private static void setIndex(GulValue target, GulValue index, GulValue value) {
        if (target instanceof GulList) {
            GulList list = (GulList) target;
            list.set(NativeMethods.normalizeIndex(checkIntIndex(index, "list"), list.size()), value);
        } else if (target instanceof GulDict) {
            ((GulDict) target).put(index, value);
        } else {
            throw new GulRuntimeException("'" + target.getTypeName() + "' object does not support item assignment");
        }
    }
}
