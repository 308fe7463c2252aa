package rotation3d;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Operators over untyped operands, for callers that only learn operand kinds
 * at runtime (scripting bridges, expression evaluators).
 *
 * Supported pairs mirror the typed overloads on {@link Quat}; anything else is
 * rejected with an {@link InvalidOperandException} naming both kinds.
 */
public final class Operators {
    private static final Logger LOGGER = LoggerFactory.getLogger(Operators.class);

    private Operators() {}

    /**
     * Quat*Quat (Hamilton), Number*Quat and Quat*Number (scale), Quat*Vec3
     * (rotated Vec3), Quat*Frame (Frame) and Vec3*Quat (Frame at that position).
     */
    public static Object mul(Object a, Object b) {
        if (a instanceof Quat) {
            Quat q = (Quat) a;
            if (b instanceof Quat) return q.mul((Quat) b);
            if (b instanceof Number) return q.mul(((Number) b).doubleValue());
            if (b instanceof Vec3) return q.mul((Vec3) b);
            if (b instanceof Frame) return q.mul((Frame) b);
        } else if (b instanceof Quat) {
            Quat q = (Quat) b;
            if (a instanceof Number) return Quat.mul(((Number) a).doubleValue(), q);
            if (a instanceof Vec3) return Quat.mul((Vec3) a, q);
        }
        throw reject("multiply", "with", a, b);
    }

    /** Quat/Number, Number/Quat (component-wise) and Quat/Quat (times inverse). */
    public static Object div(Object a, Object b) {
        if (a instanceof Quat) {
            Quat q = (Quat) a;
            if (b instanceof Number) return q.div(((Number) b).doubleValue());
            if (b instanceof Quat) return q.div((Quat) b);
        } else if (b instanceof Quat && a instanceof Number) {
            return Quat.div(((Number) a).doubleValue(), (Quat) b);
        }
        throw reject("divide", "by", a, b);
    }

    static String kindOf(Object operand) {
        return operand == null ? "null" : operand.getClass().getSimpleName();
    }

    private static InvalidOperandException reject(String verb, String preposition, Object a, Object b) {
        String left = kindOf(a);
        String right = kindOf(b);
        String message = "Cannot " + verb + " " + left + " " + preposition + " " + right + ".";
        LOGGER.debug("Rejected operands: {}", message);
        return new InvalidOperandException(message, left, right);
    }
}
