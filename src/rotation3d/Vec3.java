package rotation3d;

/**
 * Immutable 3D vector in double precision.
 *
 * Stands in for the host's native vector type: the quaternion code only needs
 * construction, the basic algebra below and the three unit axes.
 */
public final class Vec3 {
    public static final Vec3 ZERO = new Vec3(0, 0, 0);
    public static final Vec3 X_AXIS = new Vec3(1, 0, 0);
    public static final Vec3 Y_AXIS = new Vec3(0, 1, 0);
    public static final Vec3 Z_AXIS = new Vec3(0, 0, 1);

    public final double x, y, z;

    public Vec3(double x, double y, double z) { this.x = x; this.y = y; this.z = z; }

    // ------------------------------------------------------------------
    // Algebra (every call returns a new vector)
    // ------------------------------------------------------------------
    public Vec3 add(Vec3 v) { return new Vec3(x + v.x, y + v.y, z + v.z); }
    public Vec3 sub(Vec3 v) { return new Vec3(x - v.x, y - v.y, z - v.z); }
    public Vec3 mul(double s) { return new Vec3(x * s, y * s, z * s); }
    public Vec3 div(double s) { return new Vec3(x / s, y / s, z / s); }
    public Vec3 neg() { return new Vec3(-x, -y, -z); }

    public Vec3 cross(Vec3 v) {
        return new Vec3(
                y * v.z - z * v.y,
                z * v.x - x * v.z,
                x * v.y - y * v.x
        );
    }

    public double dot(Vec3 v) { return x * v.x + y * v.y + z * v.z; }

    public double len2() { return x * x + y * y + z * z; }
    public double len() { return Math.sqrt(len2()); }

    /** Unit vector, or {@link #ZERO} when the length is below 1e-12. */
    public Vec3 normalized() {
        double l2 = len2();
        if (l2 < 1e-24) return ZERO;
        double inv = 1.0 / Math.sqrt(l2);
        return new Vec3(x * inv, y * inv, z * inv);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Vec3)) return false;
        Vec3 o = (Vec3) obj;
        return x == o.x && y == o.y && z == o.z;
    }

    @Override
    public int hashCode() {
        // +0.0 folds -0.0 onto 0.0 so hashing agrees with ==
        return Double.hashCode(x + 0.0) * 961 + Double.hashCode(y + 0.0) * 31 + Double.hashCode(z + 0.0);
    }

    @Override
    public String toString() {
        return "Vec3(" + x + "," + y + "," + z + ")";
    }
}
