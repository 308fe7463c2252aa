package rotation3d;

/**
 * Immutable 3x3 matrix (row-major fields).
 *
 * Columns are the basis vectors of a rotation: column 0 is the right vector,
 * column 1 the up vector and column 2 the back vector.
 */
public final class Mat3 {
    public static final Mat3 IDENTITY = new Mat3(1, 0, 0,
                                                 0, 1, 0,
                                                 0, 0, 1);

    public final double m00, m01, m02,
                        m10, m11, m12,
                        m20, m21, m22;

    public Mat3(double m00, double m01, double m02,
                double m10, double m11, double m12,
                double m20, double m21, double m22) {
        this.m00 = m00; this.m01 = m01; this.m02 = m02;
        this.m10 = m10; this.m11 = m11; this.m12 = m12;
        this.m20 = m20; this.m21 = m21; this.m22 = m22;
    }

    public static Mat3 fromColumns(Vec3 right, Vec3 up, Vec3 back) {
        return new Mat3(right.x, up.x, back.x,
                        right.y, up.y, back.y,
                        right.z, up.z, back.z);
    }

    public Vec3 column(int i) {
        switch (i) {
            case 0: return new Vec3(m00, m10, m20);
            case 1: return new Vec3(m01, m11, m21);
            case 2: return new Vec3(m02, m12, m22);
            default: throw new IndexOutOfBoundsException("Mat3 column " + i);
        }
    }

    public Vec3 mul(Vec3 v) {
        return new Vec3(
                m00 * v.x + m01 * v.y + m02 * v.z,
                m10 * v.x + m11 * v.y + m12 * v.z,
                m20 * v.x + m21 * v.y + m22 * v.z
        );
    }

    public Mat3 mul(Mat3 b) {
        return new Mat3(
                m00 * b.m00 + m01 * b.m10 + m02 * b.m20,
                m00 * b.m01 + m01 * b.m11 + m02 * b.m21,
                m00 * b.m02 + m01 * b.m12 + m02 * b.m22,

                m10 * b.m00 + m11 * b.m10 + m12 * b.m20,
                m10 * b.m01 + m11 * b.m11 + m12 * b.m21,
                m10 * b.m02 + m11 * b.m12 + m12 * b.m22,

                m20 * b.m00 + m21 * b.m10 + m22 * b.m20,
                m20 * b.m01 + m21 * b.m11 + m22 * b.m21,
                m20 * b.m02 + m21 * b.m12 + m22 * b.m22
        );
    }

    public Mat3 transpose() {
        return new Mat3(
                m00, m10, m20,
                m01, m11, m21,
                m02, m12, m22
        );
    }

    public double det() {
        return m00 * (m11 * m22 - m12 * m21)
             - m01 * (m10 * m22 - m12 * m20)
             + m02 * (m10 * m21 - m11 * m20);
    }

    /** Rotation matrix of q. q is normalized first, so any non-zero quaternion is accepted. */
    public static Mat3 fromQuat(Quat q) {
        Quat u = q.normalized();
        double x = u.x, y = u.y, z = u.z, w = u.w;
        double xx = x * x, yy = y * y, zz = z * z, ww = w * w;
        double xy = x * y, xz = x * z, yz = y * z;
        double wx = w * x, wy = w * y, wz = w * z;

        return new Mat3(
                xx - yy - zz + ww, 2 * (xy - wz),      2 * (xz + wy),
                2 * (xy + wz),     -xx + yy - zz + ww, 2 * (yz - wx),
                2 * (xz - wy),     2 * (yz + wx),      -xx - yy + zz + ww
        );
    }

    /**
     * Quaternion of an orthonormal rotation matrix.
     *
     * Picks the branch whose scale factor is largest (positive trace, or the
     * largest diagonal term), which keeps the divisor away from zero near
     * half-turn rotations.
     */
    public Quat toQuat() {
        double trace = m00 + m11 + m22;
        double x, y, z, w;
        if (trace > 0) {
            double s = Math.sqrt(trace + 1) * 2;
            x = (m21 - m12) / s;
            y = (m02 - m20) / s;
            z = (m10 - m01) / s;
            w = 0.25 * s;
        } else if (m00 > m11 && m00 > m22) {
            double s = Math.sqrt(1 + m00 - m11 - m22) * 2;
            x = 0.25 * s;
            y = (m01 + m10) / s;
            z = (m02 + m20) / s;
            w = (m21 - m12) / s;
        } else if (m11 > m22) {
            double s = Math.sqrt(1 + m11 - m00 - m22) * 2;
            x = (m01 + m10) / s;
            y = 0.25 * s;
            z = (m12 + m21) / s;
            w = (m02 - m20) / s;
        } else {
            double s = Math.sqrt(1 + m22 - m00 - m11) * 2;
            x = (m02 + m20) / s;
            y = (m12 + m21) / s;
            z = 0.25 * s;
            w = (m10 - m01) / s;
        }
        return new Quat(x, y, z, w);
    }

    /**
     * Gram-Schmidt basis from loosely specified right/up/back vectors.
     * Degenerate right or up vectors fall back to the X and Y axes; a back
     * vector is re-derived from right x up (or right x Y when those are
     * parallel) and only its sign is taken from the supplied back vector.
     */
    public static Mat3 orthonormalize(Vec3 right, Vec3 up, Vec3 back) {
        Vec3 xBasis = MathUtil.safeUnit(right, Vec3.X_AXIS);
        Vec3 upUnit = MathUtil.safeUnit(up, Vec3.Y_AXIS);

        Vec3 zBasis = xBasis.cross(upUnit);
        if (zBasis.len() > MathUtil.EPSILON) {
            zBasis = zBasis.normalized();
        } else {
            zBasis = xBasis.cross(Vec3.Y_AXIS);
            zBasis = zBasis.len() > MathUtil.EPSILON ? zBasis.normalized() : Vec3.X_AXIS;
        }
        Vec3 yBasis = zBasis.cross(xBasis).normalized();

        if (zBasis.dot(back) < 0) zBasis = zBasis.neg();
        return fromColumns(xBasis, yBasis, zBasis);
    }

    @Override
    public String toString() {
        return "Mat3(" + m00 + "," + m01 + "," + m02 + "; "
                + m10 + "," + m11 + "," + m12 + "; "
                + m20 + "," + m21 + "," + m22 + ")";
    }
}
