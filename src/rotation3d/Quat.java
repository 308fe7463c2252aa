package rotation3d;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable quaternion (x, y, z, w): imaginary part (x, y, z), real part w.
 *
 * Unit quaternions encode rotations with double cover: q and -q are the same
 * rotation. Components are never normalized on construction; operations that
 * need a rotation (vector rotation, slerp, matrix and axis-angle conversion)
 * normalize internally. Every method returns a new instance.
 */
public final class Quat implements Comparable<Quat> {
    private static final Logger LOGGER = LoggerFactory.getLogger(Quat.class);

    /** No rotation. */
    public static final Quat IDENTITY = new Quat(0, 0, 0, 1);
    /** Zero magnitude; not a rotation. */
    public static final Quat ZERO = new Quat(0, 0, 0, 0);

    public final double x, y, z, w;

    // Write-once memo cells, never part of equals/hashCode. unit is safe through
    // Quat's final fields; the double needs volatile to avoid torn reads.
    private Quat unit;
    private volatile double magnitude = -1;

    public Quat() { this(0, 0, 0, 1); }
    public Quat(double x, double y, double z) { this(x, y, z, 1); }
    public Quat(double x, double y, double z, double w) { this.x = x; this.y = y; this.z = z; this.w = w; }

    /**
     * Builds from up to four components; missing trailing components default
     * to 0, 0, 0, 1, so {@code Quat.of()} is the identity.
     */
    public static Quat of(double... components) {
        if (components.length > 4) {
            throw new IllegalArgumentException("Quat takes at most 4 components, got " + components.length);
        }
        return new Quat(
                components.length > 0 ? components[0] : 0,
                components.length > 1 ? components[1] : 0,
                components.length > 2 ? components[2] : 0,
                components.length > 3 ? components[3] : 1
        );
    }

    public static Quat identity() { return IDENTITY; }

    // ------------------------------------------------------------------
    // Construction helpers
    // ------------------------------------------------------------------

    /** Rotation of angleRad around axis. The axis is normalized; a zero axis means the X axis. */
    public static Quat fromAxisAngle(Vec3 axis, double angleRad) {
        return fromAxisAngleFast(MathUtil.safeUnit(axis, Vec3.X_AXIS), angleRad);
    }

    /** Like {@link #fromAxisAngle} but trusts the caller that axis is already unit length. */
    public static Quat fromAxisAngleFast(Vec3 axis, double angleRad) {
        double half = angleRad / 2;
        double s = Math.sin(half);
        return new Quat(axis.x * s, axis.y * s, axis.z * s, Math.cos(half));
    }

    /** Pure-imaginary quaternion (v, 0). */
    public static Quat fromVector(Vec3 v) {
        return new Quat(v.x, v.y, v.z, 0);
    }

    public static Quat fromFrame(Frame frame) {
        return Mat3.orthonormalize(frame.rightVector(), frame.upVector(), frame.lookVector().neg()).toQuat();
    }

    /** Rotation whose basis has the given right and up columns; back = right x up. */
    public static Quat fromMatrix(Vec3 right, Vec3 up) {
        return fromMatrix(right, up, right.cross(up));
    }

    public static Quat fromMatrix(Vec3 right, Vec3 up, Vec3 back) {
        return Mat3.orthonormalize(right.normalized(), up.normalized(), back.normalized()).toQuat();
    }

    public static Quat lookAt(Vec3 from, Vec3 target) {
        return lookAt(from, target, Vec3.Y_AXIS);
    }

    /** Rotation looking from one point at another, see {@link #fromLookDirection}. */
    public static Quat lookAt(Vec3 from, Vec3 target, Vec3 up) {
        return fromLookDirection(target.sub(from), up);
    }

    /**
     * Rotation whose look vector (negative third column) points along direction.
     * When direction is parallel to up, the X axis is tried as the right-hand
     * reference, and when that is parallel too the up vector becomes +Y.
     */
    public static Quat fromLookDirection(Vec3 direction, Vec3 up) {
        Vec3 look = MathUtil.safeUnit(direction, Vec3.Z_AXIS);
        Vec3 upUnit = MathUtil.safeUnit(up == null ? Vec3.Y_AXIS : up, Vec3.Y_AXIS);

        Vec3 right = look.cross(upUnit);
        if (right.len() > MathUtil.DIRECTION_EPSILON) {
            right = right.normalized();
            return Mat3.fromColumns(right, right.cross(look).normalized(), look.neg()).toQuat();
        }

        Vec3 select = look.cross(Vec3.X_AXIS);
        if (select.len() > MathUtil.DIRECTION_EPSILON) {
            if (LOGGER.isTraceEnabled()) {
                LOGGER.trace("Look direction {} parallel to up {}, using X as reference", direction, up);
            }
            right = select.normalized();
            return Mat3.fromColumns(right, right.cross(look).normalized(), look.neg()).toQuat();
        }

        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("Look direction {} parallel to up and X, forcing +Y up", direction);
        }
        Vec3 upVector = Vec3.Z_AXIS.cross(look);
        upVector = upVector.mul(upVector.dot(Vec3.Y_AXIS));
        return Mat3.fromColumns(look.cross(upVector), upVector, look.neg()).toQuat();
    }

    /** XYZ Euler angles. */
    public static Quat fromEulerAngles(double rx, double ry, double rz) {
        return EulerAngles.compose(EulerOrder.XYZ, rx, ry, rz);
    }

    public static Quat fromEulerAngles(double rx, double ry, double rz, EulerOrder order) {
        return EulerAngles.compose(order, rx, ry, rz);
    }

    /** Alias of XYZ Euler construction. */
    public static Quat angles(double rx, double ry, double rz) {
        return EulerAngles.fromXYZ(rx, ry, rz);
    }

    /** Alias of YXZ Euler construction. */
    public static Quat fromOrientation(double rx, double ry, double rz) {
        return EulerAngles.fromYXZ(rx, ry, rz);
    }

    // ------------------------------------------------------------------
    // Algebra
    // ------------------------------------------------------------------
    public Quat add(Quat q) { return new Quat(x + q.x, y + q.y, z + q.z, w + q.w); }
    public Quat sub(Quat q) { return new Quat(x - q.x, y - q.y, z - q.z, w - q.w); }

    /** Hamilton product this * q. Not commutative. */
    public Quat mul(Quat q) {
        return new Quat(
                w * q.x + x * q.w + y * q.z - z * q.y,
                w * q.y - x * q.z + y * q.w + z * q.x,
                w * q.z + x * q.y - y * q.x + z * q.w,
                w * q.w - x * q.x - y * q.y - z * q.z
        );
    }

    public Quat mul(double s) { return new Quat(x * s, y * s, z * s, w * s); }

    public static Quat mul(double s, Quat q) { return new Quat(s * q.x, s * q.y, s * q.z, s * q.w); }

    /** Rotates v by this quaternion (normalized first). */
    public Vec3 mul(Vec3 v) {
        return rotate(v);
    }

    /** Equivalent to {@code toFrame().mul(frame)}. */
    public Frame mul(Frame frame) {
        return toFrame().mul(frame);
    }

    /** Frame at position rotated by q. */
    public static Frame mul(Vec3 position, Quat q) {
        return q.toFrame(position);
    }

    public Vec3 rotate(Vec3 v) {
        Quat u = normalized();
        return u.mul(fromVector(v)).mul(u.conjugate()).vector();
    }

    public Quat div(double s) { return new Quat(x / s, y / s, z / s, w / s); }

    /** Each component of q divided into s. */
    public static Quat div(double s, Quat q) { return new Quat(s / q.x, s / q.y, s / q.z, s / q.w); }

    /** this * q^-1. */
    public Quat div(Quat q) { return mul(q.inverse()); }

    /** Negates all four components; the same rotation, see {@link #conjugate()} for the inverse rotation. */
    public Quat neg() { return new Quat(-x, -y, -z, -w); }

    /**
     * Real power via polar form: magnitude^n with the angle scaled by n.
     * Returns (0, 0, 0, |q|^n) when the imaginary part is negligible.
     */
    public Quat pow(double n) {
        double im = x * x + y * y + z * z;
        double mag = Math.sqrt(w * w + im);
        double imLen = Math.sqrt(im);
        double cMag = Math.pow(mag, n);
        if (imLen <= MathUtil.EPSILON * mag) {
            return new Quat(0, 0, 0, cMag);
        }

        double angle = n * Math.atan2(imLen, w);
        double s = cMag * Math.sin(angle) / imLen;
        return new Quat(x * s, y * s, z * s, cMag * Math.cos(angle));
    }

    public Quat conjugate() { return new Quat(-x, -y, -z, w); }

    /** conjugate / |q|^2. The zero quaternion yields non-finite components. */
    public Quat inverse() {
        double len2 = lengthSquared();
        return new Quat(-x / len2, -y / len2, -z / len2, w / len2);
    }

    public double dot(Quat q) { return x * q.x + y * q.y + z * q.z + w * q.w; }

    public double lengthSquared() { return x * x + y * y + z * z + w * w; }
    public double length() { return Math.sqrt(lengthSquared()); }

    /** Length computed on components scaled by the largest magnitude, so huge components do not overflow. */
    public double hypot() {
        double max = MathUtil.maxAbs(x, y, z, w);
        if (max == 0) return 0;
        return div(max).length() * max;
    }

    /** Cached {@link #length()}. */
    public double magnitude() {
        double m = magnitude;
        if (m < 0) {
            m = length();
            magnitude = m;
        }
        return m;
    }

    /** this / |this|, or {@link #IDENTITY} when the length is zero. */
    public Quat normalized() {
        double len = length();
        return len > 0 ? div(len) : IDENTITY;
    }

    /** Cached {@link #normalized()}. */
    public Quat unit() {
        Quat u = unit;
        if (u == null) {
            u = normalized();
            unit = u;
        }
        return u;
    }

    public boolean isUnit() { return isUnit(MathUtil.EPSILON); }
    public boolean isUnit(double epsilon) { return Math.abs(1 - length()) < epsilon; }

    public boolean isNaN() {
        return Double.isNaN(x) || Double.isNaN(y) || Double.isNaN(z) || Double.isNaN(w);
    }

    // ------------------------------------------------------------------
    // Exponential / logarithm and geodesic distances
    // ------------------------------------------------------------------
    public Quat exp() {
        double m = Math.exp(w);
        double vv = x * x + y * y + z * z;
        if (vv > 0) {
            double v = Math.sqrt(vv);
            double s = m * Math.sin(v) / v;
            return new Quat(x * s, y * s, z * s, m * Math.cos(v));
        }
        return new Quat(0, 0, 0, m);
    }

    /** Natural logarithm. log(0) is (0, 0, 0, -infinity). */
    public Quat log() {
        double vv = x * x + y * y + z * z;
        double mm = w * w + vv;
        if (mm > 0) {
            if (vv > 0) {
                double m = Math.sqrt(mm);
                double s = Math.acos(MathUtil.clamp(w / m, -1, 1)) / Math.sqrt(vv);
                return new Quat(x * s, y * s, z * s, Math.log(m));
            }
            return new Quat(0, 0, 0, Math.log(mm) / 2);
        }
        return new Quat(0, 0, 0, Double.NEGATIVE_INFINITY);
    }

    /** this * exp(tangent). */
    public Quat expMap(Quat tangent) {
        return mul(tangent.exp());
    }

    /** sqrt(this) * exp(tangent) * sqrt(this). */
    public Quat expMapSym(Quat tangent) {
        Quat sqrt = pow(0.5);
        return sqrt.mul(tangent.exp()).mul(sqrt);
    }

    /** log(this^-1 * q). */
    public Quat logMap(Quat q) {
        return inverse().mul(q).log();
    }

    /** log(this^-1/2 * q * this^-1/2). */
    public Quat logMapSym(Quat q) {
        Quat invSqrt = pow(-0.5);
        return invSqrt.mul(q).mul(invSqrt).log();
    }

    /** log(this * q^-1), no sign resolution. */
    public Quat logInv(Quat q) {
        return mul(q.inverse()).log();
    }

    /**
     * Relative rotation from this to q along the shorter arc: this is negated
     * first when the two lie in opposite hemispheres, so
     * {@code this.mul(this.difference(q))} equals q up to sign.
     */
    public Quat difference(Quat q) {
        Quat q0 = dot(q) < 0 ? neg() : this;
        return q0.inverse().mul(q);
    }

    /** 2 |logMap(q)|; in [0, 2pi] for unit inputs, sign not resolved. */
    public double distance(Quat q) {
        return logMap(q).length() * 2;
    }

    /** 2 |log(difference(q))|; in [0, pi], q and -q are at distance zero. */
    public double distanceSym(Quat q) {
        return difference(q).log().length() * 2;
    }

    /** Chord length of the shortest arc. */
    public double distanceChord(Quat q) {
        return Math.sin(distanceSym(q) / 2) * 2;
    }

    /** min(|this - q|, |this + q|). */
    public double distanceAbs(Quat q) {
        double dMinus = sub(q).length();
        double dPlus = add(q).length();
        return Math.min(dMinus, dPlus);
    }

    public boolean approxEq(Quat q) { return approxEq(q, MathUtil.EPSILON); }
    public boolean approxEq(Quat q, double epsilon) { return distanceSym(q) < epsilon; }

    // ------------------------------------------------------------------
    // Interpolation
    // ------------------------------------------------------------------

    /**
     * Spherical linear interpolation along the shortest arc. Both ends are
     * normalized; alpha outside [0, 1] extrapolates.
     */
    public Quat slerp(Quat q, double alpha) {
        return new SlerpFunction(this, q).apply(alpha);
    }

    /** Slerp from the identity to q without building an identity operand. */
    public static Quat identitySlerp(Quat q, double alpha) {
        Quat b = q.normalized();
        double q0 = 1;
        double dot = b.w;
        if (dot < 0) {
            q0 = -1;
            dot = -dot;
        }
        if (dot >= 1) {
            return new Quat(b.x * alpha, b.y * alpha, b.z * alpha, (b.w - q0) * alpha + q0).normalized();
        }

        double theta0 = Math.acos(dot);
        double sinTheta0 = Math.sin(theta0);
        double theta = theta0 * alpha;
        double sinTheta = Math.sin(theta);
        double s0 = Math.cos(theta) - dot * sinTheta / sinTheta0;
        double s1 = sinTheta / sinTheta0;
        return new Quat(b.x * s1, b.y * s1, b.z * s1, q0 * s0 + b.w * s1).normalized();
    }

    /** Slerp towards q with the angle setup done once. */
    public SlerpFunction slerpFunction(Quat q) {
        return new SlerpFunction(this, q);
    }

    public List<Quat> intermediates(Quat q, int n) {
        return intermediates(q, n, false);
    }

    /**
     * n rotations evenly spaced strictly between this and q, at alpha = k / (n + 1).
     * With includeEndpoints the list starts with this and ends with q.
     */
    public List<Quat> intermediates(Quat q, int n, boolean includeEndpoints) {
        if (n < 0) throw new IllegalArgumentException("n must be non-negative, got " + n);
        double step = 1.0 / (n + 1);
        SlerpFunction slerp = slerpFunction(q);

        List<Quat> steps = new ArrayList<>(n + 2);
        if (includeEndpoints) steps.add(this);
        for (int i = 1; i <= n; i++) {
            steps.add(slerp.apply(step * i));
        }
        if (includeEndpoints) steps.add(q);
        return Collections.unmodifiableList(steps);
    }

    /** dq/dt = 0.5 * q * (rate, 0) for angular velocity rate. */
    public Quat derivative(Vec3 rate) {
        return mul(0.5, this).mul(fromVector(rate));
    }

    /** Closed-form integration of a constant angular velocity over timestep. */
    public Quat integrate(Vec3 rate, double timestep) {
        Quat q0 = normalized();
        Vec3 rotation = rate.mul(timestep);
        double angle = rotation.len();
        if (angle > 0) {
            return q0.mul(fromAxisAngleFast(rotation.div(angle), angle)).normalized();
        }
        return q0;
    }

    // ------------------------------------------------------------------
    // Conversions
    // ------------------------------------------------------------------

    /**
     * Axis and angle of the normalized rotation, angle in [0, 2pi]. Near the
     * identity the raw imaginary part is returned as the axis.
     */
    public AxisAngle toAxisAngle() {
        Quat u = normalized();
        double angle = 2 * Math.acos(MathUtil.clamp(u.w, -1, 1));
        double s = Math.sqrt(Math.max(0, 1 - u.w * u.w));
        if (s < MathUtil.EPSILON) {
            return new AxisAngle(u.vector(), angle);
        }
        return new AxisAngle(new Vec3(u.x / s, u.y / s, u.z / s), angle);
    }

    public Mat3 toMatrix() {
        return Mat3.fromQuat(this);
    }

    /** Right, up and back columns of {@link #toMatrix()}. */
    public Vec3[] toMatrixVectors() {
        Mat3 m = toMatrix();
        return new Vec3[] { m.column(0), m.column(1), m.column(2) };
    }

    public Frame toFrame() {
        return toFrame(Vec3.ZERO);
    }

    public Frame toFrame(Vec3 position) {
        return new Frame(position, Mat3.fromQuat(this));
    }

    /** XYZ Euler angles as (rx, ry, rz). */
    public Vec3 toEulerAngles() {
        return EulerAngles.decompose(EulerOrder.XYZ, this);
    }

    public Vec3 toEulerAngles(EulerOrder order) {
        return EulerAngles.decompose(order, this);
    }

    /** Alias of YXZ Euler extraction. */
    public Vec3 toOrientation() {
        return EulerAngles.toYXZ(this);
    }

    /** Imaginary part as a vector. */
    public Vec3 vector() { return new Vec3(x, y, z); }
    public Quat real() { return new Quat(0, 0, 0, w); }
    public Quat imaginary() { return new Quat(x, y, z, 0); }

    /** {x, y, z, w}, a fresh array on every call. */
    public double[] components() { return new double[] { x, y, z, w }; }

    // ------------------------------------------------------------------
    // Ordering, equality, formatting
    // ------------------------------------------------------------------

    /**
     * Orders by length only. This says nothing about rotations and is
     * inconsistent with {@link #equals}: every unit quaternion compares equal.
     */
    @Override
    public int compareTo(Quat q) {
        return Double.compare(length(), q.length());
    }

    public boolean lessThan(Quat q) { return length() < q.length(); }
    public boolean lessOrEqual(Quat q) { return length() <= q.length(); }

    /** Exact component comparison; use {@link #approxEq} for rotations. */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Quat)) return false;
        Quat o = (Quat) obj;
        return x == o.x && y == o.y && z == o.z && w == o.w;
    }

    @Override
    public int hashCode() {
        int h = Double.hashCode(x + 0.0);
        h = 31 * h + Double.hashCode(y + 0.0);
        h = 31 * h + Double.hashCode(z + 0.0);
        return 31 * h + Double.hashCode(w + 0.0);
    }

    @Override
    public String toString() {
        return x + ", " + y + ", " + z + ", " + w;
    }

    /** Components rounded to decimalPlaces (negative counts as 0), joined by ", ". */
    public String toString(int decimalPlaces) {
        String format = "%." + Math.max(0, decimalPlaces) + "f";
        return String.format(Locale.ROOT, format, x) + ", "
                + String.format(Locale.ROOT, format, y) + ", "
                + String.format(Locale.ROOT, format, z) + ", "
                + String.format(Locale.ROOT, format, w);
    }
}
