package rotation3d;

import java.util.function.DoubleFunction;

/**
 * Slerp between two fixed rotations, with the normalization, hemisphere flip
 * and arc angle computed once at construction.
 */
public final class SlerpFunction implements DoubleFunction<Quat> {
    private final Quat from;
    private final Quat to;
    private final double dot;
    private final double theta0;
    private final double sinTheta0;
    // Ends coincide: interpolate linearly instead of dividing by sin(theta0) ~ 0.
    private final Quat delta;

    SlerpFunction(Quat q0, Quat q1) {
        Quat a = q0.normalized();
        Quat b = q1.normalized();
        double d = a.dot(b);
        if (d < 0) {
            a = a.neg();
            d = -d;
        }
        this.from = a;
        this.to = b;
        this.dot = d;

        if (d >= 1) {
            this.delta = b.sub(a);
            this.theta0 = 0;
            this.sinTheta0 = 0;
        } else {
            this.delta = null;
            this.theta0 = Math.acos(d);
            this.sinTheta0 = Math.sin(theta0);
        }
    }

    @Override
    public Quat apply(double alpha) {
        if (delta != null) {
            return from.add(delta.mul(alpha)).normalized();
        }
        double theta = theta0 * alpha;
        double sinTheta = Math.sin(theta);
        double s0 = Math.cos(theta) - dot * sinTheta / sinTheta0;
        double s1 = sinTheta / sinTheta0;
        return from.mul(s0).add(to.mul(s1)).normalized();
    }
}
