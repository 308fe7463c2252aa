package rotation3d;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Euler-angle conversions for the six Tait-Bryan orders.
 *
 * Each order has its own closed form. Extraction returns (rx, ry, rz) as a
 * {@link Vec3}; when the middle axis reaches +-90 degrees (gimbal lock) the
 * third rotation is pinned to zero and the remaining angle is recovered with
 * atan2 on the raw components. Thresholds and signs differ per order.
 */
public final class EulerAngles {
    private static final Logger LOGGER = LoggerFactory.getLogger(EulerAngles.class);

    private static final double HALF_PI = Math.PI / 2;
    private static final double GIMBAL = 0.5 - MathUtil.EPSILON;

    private EulerAngles() {}

    /** Quaternion of the Euler triple in the given order; null means XYZ. */
    public static Quat compose(EulerOrder order, double rx, double ry, double rz) {
        if (order == null) order = EulerOrder.XYZ;
        switch (order) {
            case XYZ: return fromXYZ(rx, ry, rz);
            case XZY: return fromXZY(rx, ry, rz);
            case YXZ: return fromYXZ(rx, ry, rz);
            case YZX: return fromYZX(rx, ry, rz);
            case ZXY: return fromZXY(rx, ry, rz);
            case ZYX: return fromZYX(rx, ry, rz);
            default: throw new IllegalArgumentException("Unknown rotation order: " + order);
        }
    }

    /** Euler triple (rx, ry, rz) of q in the given order; null means XYZ. */
    public static Vec3 decompose(EulerOrder order, Quat q) {
        if (order == null) order = EulerOrder.XYZ;
        switch (order) {
            case XYZ: return toXYZ(q);
            case XZY: return toXZY(q);
            case YXZ: return toYXZ(q);
            case YZX: return toYZX(q);
            case ZXY: return toZXY(q);
            case ZYX: return toZYX(q);
            default: throw new IllegalArgumentException("Unknown rotation order: " + order);
        }
    }

    // ------------------------------------------------------------------
    // Construction: order ABC -> qA * qB * qC
    // ------------------------------------------------------------------
    public static Quat fromXYZ(double rx, double ry, double rz) {
        Half h = new Half(rx, ry, rz);
        return new Quat(
                h.xSinYCos * h.zCos + h.xCosYSin * h.zSin,
                h.xCosYSin * h.zCos - h.xSinYCos * h.zSin,
                h.xCosYCos * h.zSin + h.xSinYSin * h.zCos,
                h.xCosYCos * h.zCos - h.xSinYSin * h.zSin
        );
    }

    public static Quat fromXZY(double rx, double ry, double rz) {
        Half h = new Half(rx, ry, rz);
        return new Quat(
                h.xSinYCos * h.zCos - h.xCosYSin * h.zSin,
                h.xCosYSin * h.zCos - h.xSinYCos * h.zSin,
                h.xCosYCos * h.zSin + h.xSinYSin * h.zCos,
                h.xCosYCos * h.zCos + h.xSinYSin * h.zSin
        );
    }

    public static Quat fromYXZ(double rx, double ry, double rz) {
        Half h = new Half(rx, ry, rz);
        return new Quat(
                h.xSinYCos * h.zCos + h.xCosYSin * h.zSin,
                h.xCosYSin * h.zCos - h.xSinYCos * h.zSin,
                h.xCosYCos * h.zSin - h.xSinYSin * h.zCos,
                h.xCosYCos * h.zCos + h.xSinYSin * h.zSin
        );
    }

    public static Quat fromYZX(double rx, double ry, double rz) {
        Half h = new Half(rx, ry, rz);
        return new Quat(
                h.xSinYCos * h.zCos + h.xCosYSin * h.zSin,
                h.xCosYSin * h.zCos + h.xSinYCos * h.zSin,
                h.xCosYCos * h.zSin - h.xSinYSin * h.zCos,
                h.xCosYCos * h.zCos - h.xSinYSin * h.zSin
        );
    }

    public static Quat fromZXY(double rx, double ry, double rz) {
        Half h = new Half(rx, ry, rz);
        return new Quat(
                h.xSinYCos * h.zCos - h.xCosYSin * h.zSin,
                h.xCosYSin * h.zCos + h.xSinYCos * h.zSin,
                h.xCosYCos * h.zSin + h.xSinYSin * h.zCos,
                h.xCosYCos * h.zCos - h.xSinYSin * h.zSin
        );
    }

    public static Quat fromZYX(double rx, double ry, double rz) {
        Half h = new Half(rx, ry, rz);
        return new Quat(
                h.xSinYCos * h.zCos - h.xCosYSin * h.zSin,
                h.xCosYSin * h.zCos + h.xSinYCos * h.zSin,
                h.xCosYCos * h.zSin - h.xSinYSin * h.zCos,
                h.xCosYCos * h.zCos + h.xSinYSin * h.zSin
        );
    }

    // ------------------------------------------------------------------
    // Extraction (input is normalized first)
    // ------------------------------------------------------------------
    public static Vec3 toXYZ(Quat q0) {
        Quat q = q0.normalized();
        double test = q.y * q.w + q.x * q.z;
        if (Math.abs(test) > MathUtil.GIMBAL_XYZ) {
            double sign = test > 0 ? 1 : -1;
            traceGimbal(EulerOrder.XYZ, test);
            return new Vec3(sign * 2 * Math.atan2(q.z, q.w), sign * HALF_PI, 0);
        }
        double sqy = q.y * q.y;
        return new Vec3(
                Math.atan2(2 * (q.x * q.w - q.y * q.z), 1 - 2 * (q.x * q.x + sqy)),
                Math.asin(2 * test),
                Math.atan2(2 * (q.z * q.w - q.x * q.y), 1 - 2 * (q.z * q.z + sqy))
        );
    }

    public static Vec3 toXZY(Quat q0) {
        Quat q = q0.normalized();
        double test = q.z * q.w - q.x * q.y;
        if (Math.abs(test) > GIMBAL) {
            double sign = test >= 0 ? 1 : -1;
            traceGimbal(EulerOrder.XZY, test);
            return new Vec3(sign * 2 * -Math.atan2(q.y, q.w), 0, sign * HALF_PI);
        }
        double sqz = q.z * q.z;
        return new Vec3(
                Math.atan2(2 * (q.x * q.w + q.y * q.z), 1 - 2 * (q.x * q.x + sqz)),
                Math.atan2(2 * (q.x * q.z + q.y * q.w), 1 - 2 * (q.y * q.y + sqz)),
                Math.asin(2 * test)
        );
    }

    public static Vec3 toYXZ(Quat q0) {
        Quat q = q0.normalized();
        double test = q.x * q.w - q.y * q.z;
        if (Math.abs(test) > GIMBAL) {
            double sign = test >= 0 ? 1 : -1;
            traceGimbal(EulerOrder.YXZ, test);
            return new Vec3(sign * HALF_PI, sign * 2 * -Math.atan2(q.z, q.w), 0);
        }
        double sqx = q.x * q.x;
        return new Vec3(
                Math.asin(2 * test),
                Math.atan2(2 * (q.x * q.z + q.y * q.w), 1 - 2 * (q.y * q.y + sqx)),
                Math.atan2(2 * (q.x * q.y + q.z * q.w), 1 - 2 * (q.z * q.z + sqx))
        );
    }

    public static Vec3 toYZX(Quat q0) {
        Quat q = q0.normalized();
        double test = q.z * q.w + q.x * q.y;
        if (Math.abs(test) > GIMBAL) {
            double sign = test >= 0 ? 1 : -1;
            traceGimbal(EulerOrder.YZX, test);
            return new Vec3(0, sign * 2 * Math.atan2(q.x, q.w), sign * HALF_PI);
        }
        double sqz = q.z * q.z;
        return new Vec3(
                Math.atan2(2 * (q.x * q.w - q.y * q.z), 1 - 2 * (q.x * q.x + sqz)),
                Math.atan2(2 * (q.y * q.w - q.x * q.z), 1 - 2 * (q.y * q.y + sqz)),
                Math.asin(2 * test)
        );
    }

    public static Vec3 toZXY(Quat q0) {
        Quat q = q0.normalized();
        double test = q.x * q.w + q.y * q.z;
        if (Math.abs(test) > GIMBAL) {
            double sign = test >= 0 ? 1 : -1;
            traceGimbal(EulerOrder.ZXY, test);
            return new Vec3(sign * HALF_PI, 0, sign * 2 * Math.atan2(q.y, q.w));
        }
        double sqx = q.x * q.x;
        return new Vec3(
                Math.asin(2 * test),
                Math.atan2(2 * (q.y * q.w - q.x * q.z), 1 - 2 * (q.y * q.y + sqx)),
                Math.atan2(2 * (q.z * q.w - q.x * q.y), 1 - 2 * (q.z * q.z + sqx))
        );
    }

    public static Vec3 toZYX(Quat q0) {
        Quat q = q0.normalized();
        double test = q.y * q.w - q.x * q.z;
        if (Math.abs(test) > GIMBAL) {
            double sign = test >= 0 ? 1 : -1;
            traceGimbal(EulerOrder.ZYX, test);
            return new Vec3(0, sign * HALF_PI, sign * 2 * -Math.atan2(q.x, q.w));
        }
        double sqy = q.y * q.y;
        return new Vec3(
                Math.atan2(2 * (q.x * q.w + q.y * q.z), 1 - 2 * (q.x * q.x + sqy)),
                Math.asin(2 * test),
                Math.atan2(2 * (q.x * q.y + q.z * q.w), 1 - 2 * (q.z * q.z + sqy))
        );
    }

    private static void traceGimbal(EulerOrder order, double test) {
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("Gimbal lock in {} extraction (test={})", order, test);
        }
    }

    /** Half-angle sines/cosines and the four products every order needs. */
    private static final class Half {
        final double zCos, zSin;
        final double xSinYCos, xCosYSin, xCosYCos, xSinYSin;

        Half(double rx, double ry, double rz) {
            double xCos = Math.cos(rx / 2), xSin = Math.sin(rx / 2);
            double yCos = Math.cos(ry / 2), ySin = Math.sin(ry / 2);
            zCos = Math.cos(rz / 2);
            zSin = Math.sin(rz / 2);
            xSinYCos = xSin * yCos;
            xCosYSin = xCos * ySin;
            xCosYCos = xCos * yCos;
            xSinYSin = xSin * ySin;
        }
    }
}
