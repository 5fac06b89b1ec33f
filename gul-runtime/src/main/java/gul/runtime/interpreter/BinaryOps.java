package gul.runtime.interpreter;

import com.gullang.compiler.ast.expr.BinaryExpr.BinaryOp;
import gul.runtime.GulBoolean;
import gul.runtime.GulDict;
import gul.runtime.GulFloat;
import gul.runtime.GulInt;
import gul.runtime.GulList;
import gul.runtime.GulNumber;
import gul.runtime.GulSet;
import gul.runtime.GulString;
import gul.runtime.GulTuple;
import gul.runtime.GulValue;

import java.util.ArrayList;
import java.util.List;
import java.util.function.DoubleBinaryOperator;
import java.util.function.LongBinaryOperator;

/**
 * 二元运算的统一实现（and / or 的短路在求值器中处理）。
 *
 * <p>语义与 Python 一致：任一操作数为字符串时 + 做字符串拼接，/ 是真除法，
 * % 与整除向负无穷取整。除数为 0 的 / 得到 +inf。
 * 整数是有符号 64 位，+ - * 与取负溢出时报 integer overflow 而不回绕。</p>
 */
public final class BinaryOps {

    private BinaryOps() {}

    public static GulValue apply(BinaryOp op, GulValue left, GulValue right) {
        switch (op) {
            case ADD: return add(left, right);
            case SUB: return subtract(left, right);
            case MUL: return multiply(left, right);
            case DIV: return divide(left, right);
            case MOD: return modulo(left, right);
            case EQ: return GulBoolean.of(left.equals(right));
            case NE: return GulBoolean.of(!left.equals(right));
            case LT: return GulBoolean.of(compare(left, right, "<") < 0);
            case GT: return GulBoolean.of(compare(left, right, ">") > 0);
            case LE: return GulBoolean.of(compare(left, right, "<=") <= 0);
            case GE: return GulBoolean.of(compare(left, right, ">=") >= 0);
            case IN: return GulBoolean.of(contains(right, left));
            case NOT_IN: return GulBoolean.of(!contains(right, left));
            default:
                throw new GulRuntimeException("Unsupported operator: " + op.toSourceString());
        }
    }

    // ============ 算术 ============

    static GulValue add(GulValue left, GulValue right) {
        if (left instanceof GulString || right instanceof GulString) {
            return GulString.of(left.render() + right.render());
        }
        if (isNumeric(left) && isNumeric(right)) {
            return numeric(left, right, Math::addExact, (a, b) -> a + b);
        }
        if (left instanceof GulList && right instanceof GulList) {
            List<GulValue> joined = new ArrayList<GulValue>(((GulList) left).getElements());
            joined.addAll(((GulList) right).getElements());
            return new GulList(joined);
        }
        if (left instanceof GulTuple && right instanceof GulTuple) {
            List<GulValue> joined = new ArrayList<GulValue>(((GulTuple) left).getElements());
            joined.addAll(((GulTuple) right).getElements());
            return new GulTuple(joined);
        }
        throw unsupported("+", left, right);
    }

    static GulValue subtract(GulValue left, GulValue right) {
        if (isNumeric(left) && isNumeric(right)) {
            return numeric(left, right, Math::subtractExact, (a, b) -> a - b);
        }
        if (left instanceof GulSet && right instanceof GulSet) {
            GulSet result = new GulSet(((GulSet) left).getElements());
            result.getElements().removeAll(((GulSet) right).getElements());
            return result;
        }
        throw unsupported("-", left, right);
    }

    static GulValue multiply(GulValue left, GulValue right) {
        if (isNumeric(left) && isNumeric(right)) {
            return numeric(left, right, Math::multiplyExact, (a, b) -> a * b);
        }
        if (left instanceof GulString && isInteger(right)) {
            return GulString.of(repeat(((GulString) left).getValue(), right.asLong()));
        }
        if (isInteger(left) && right instanceof GulString) {
            return GulString.of(repeat(((GulString) right).getValue(), left.asLong()));
        }
        if (left instanceof GulList && isInteger(right)) {
            List<GulValue> result = new ArrayList<GulValue>();
            for (long i = 0; i < right.asLong(); i++) {
                result.addAll(((GulList) left).getElements());
            }
            return new GulList(result);
        }
        throw unsupported("*", left, right);
    }

    static GulValue divide(GulValue left, GulValue right) {
        if (!isNumeric(left) || !isNumeric(right)) {
            throw unsupported("/", left, right);
        }
        double divisor = right.asDouble();
        if (divisor == 0.0) {
            return GulFloat.INFINITY;
        }
        return GulFloat.of(left.asDouble() / divisor);
    }

    static GulValue modulo(GulValue left, GulValue right) {
        if (!isNumeric(left) || !isNumeric(right)) {
            throw unsupported("%", left, right);
        }
        if (isInteger(left) && isInteger(right)) {
            if (right.asLong() == 0) {
                throw new GulRuntimeException("integer modulo by zero");
            }
            return GulInt.of(Math.floorMod(left.asLong(), right.asLong()));
        }
        double b = right.asDouble();
        if (b == 0.0) {
            throw new GulRuntimeException("float modulo");
        }
        double a = left.asDouble();
        double r = a % b;
        if (r != 0 && (r < 0) != (b < 0)) {
            r += b;
        }
        return GulFloat.of(r);
    }

    public static GulValue negate(GulValue operand) {
        if (operand instanceof GulFloat) {
            return GulFloat.of(-operand.asDouble());
        }
        if (isNumeric(operand)) {
            try {
                return GulInt.of(Math.negateExact(operand.asLong()));
            } catch (ArithmeticException e) {
                throw new GulRuntimeException("integer overflow", e);
            }
        }
        throw new GulRuntimeException("bad operand type for unary -: '" + operand.getTypeName() + "'");
    }

    // ============ 比较与包含 ============

    /**
     * 有序比较：数值、字符串、列表（逐元素）
     */
    public static int compare(GulValue left, GulValue right, String op) {
        if (isNumeric(left) && isNumeric(right)) {
            if (isInteger(left) && isInteger(right)) {
                return Long.compare(left.asLong(), right.asLong());
            }
            return Double.compare(left.asDouble(), right.asDouble());
        }
        if (left instanceof GulString && right instanceof GulString) {
            return ((GulString) left).compareTo((GulString) right);
        }
        if (left instanceof GulList && right instanceof GulList) {
            return compareSequences(((GulList) left).getElements(), ((GulList) right).getElements(), op);
        }
        if (left instanceof GulTuple && right instanceof GulTuple) {
            return compareSequences(((GulTuple) left).getElements(), ((GulTuple) right).getElements(), op);
        }
        throw new GulRuntimeException("'" + op + "' not supported between instances of '"
                + left.getTypeName() + "' and '" + right.getTypeName() + "'");
    }

    private static int compareSequences(List<GulValue> a, List<GulValue> b, String op) {
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            if (!a.get(i).equals(b.get(i))) {
                return compare(a.get(i), b.get(i), op);
            }
        }
        return Integer.compare(a.size(), b.size());
    }

    /**
     * container 是否包含 item：字符串为子串，字典为键
     */
    public static boolean contains(GulValue container, GulValue item) {
        if (container instanceof GulString) {
            if (!(item instanceof GulString)) {
                throw new GulRuntimeException("'in <string>' requires string as left operand, not "
                        + item.getTypeName());
            }
            return ((GulString) container).getValue().contains(((GulString) item).getValue());
        }
        if (container instanceof GulList) {
            return ((GulList) container).getElements().contains(item);
        }
        if (container instanceof GulTuple) {
            return ((GulTuple) container).getElements().contains(item);
        }
        if (container instanceof GulDict) {
            return ((GulDict) container).containsKey(item);
        }
        if (container instanceof GulSet) {
            return ((GulSet) container).contains(item);
        }
        throw new GulRuntimeException("argument of type '" + container.getTypeName() + "' is not iterable");
    }

    // ============ 辅助 ============

    static boolean isNumeric(GulValue v) {
        return v instanceof GulNumber || v instanceof GulBoolean;
    }

    static boolean isInteger(GulValue v) {
        return v instanceof GulInt || v instanceof GulBoolean;
    }

    private static GulValue numeric(GulValue left, GulValue right, LongBinaryOperator longOp,
                                    DoubleBinaryOperator doubleOp) {
        if (isInteger(left) && isInteger(right)) {
            try {
                return GulInt.of(longOp.applyAsLong(left.asLong(), right.asLong()));
            } catch (ArithmeticException e) {
                throw new GulRuntimeException("integer overflow", e);
            }
        }
        return GulFloat.of(doubleOp.applyAsDouble(left.asDouble(), right.asDouble()));
    }

    private static String repeat(String s, long times) {
        if (times <= 0) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (long i = 0; i < times; i++) {
            sb.append(s);
        }
        return sb.toString();
    }

    private static GulRuntimeException unsupported(String op, GulValue left, GulValue right) {
        return new GulRuntimeException("unsupported operand type(s) for " + op + ": '"
                + left.getTypeName() + "' and '" + right.getTypeName() + "'");
    }
}
