package rotation3d;

import java.util.Locale;

/**
 * Axis order of an Euler-angle triple. Order "ABC" means the rotation
 * R_A * R_B * R_C, i.e. the quaternion qA * qB * qC.
 */
public enum EulerOrder {
    XYZ, XZY, YXZ, YZX, ZXY, ZYX;

    /** Case-insensitive lookup of an order tag such as "yxz". */
    public static EulerOrder parse(String tag) {
        if (tag == null) return XYZ;
        try {
            return valueOf(tag.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown rotation order: " + tag, e);
        }
    }
}
