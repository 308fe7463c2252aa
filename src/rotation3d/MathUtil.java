package rotation3d;

public final class MathUtil {
    private MathUtil(){}

    /** Default tolerance for unit checks, approximate equality and degenerate branches. */
    public static final double EPSILON = 1e-6;

    /** Gimbal-lock threshold of the XYZ Euler extraction. */
    public static final double GIMBAL_XYZ = 0.499999;

    /** Shortest cross product accepted as a usable basis direction. */
    public static final double DIRECTION_EPSILON = 1e-6;

    public static double clamp(double v, double lo, double hi){
        return Math.max(lo, Math.min(hi, v));
    }

    /** Unit vector of v, or fallback when v is too short to normalize. */
    public static Vec3 safeUnit(Vec3 v, Vec3 fallback){
        double len = v.len();
        return len > EPSILON ? v.div(len) : fallback;
    }

    /** Largest absolute value among the arguments. */
    public static double maxAbs(double a, double b, double c, double d){
        return Math.max(Math.max(Math.abs(a), Math.abs(b)), Math.max(Math.abs(c), Math.abs(d)));
    }
}
