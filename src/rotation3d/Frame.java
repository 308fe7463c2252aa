package rotation3d;

import java.util.Objects;

/**
 * Rigid transform: a position plus a rotation matrix.
 *
 * Plays the part of the host's coordinate frame type. The look vector points
 * along the negative third column, so the third column is the "back" vector.
 */
public final class Frame {
    public static final Frame IDENTITY = new Frame(Vec3.ZERO, Mat3.IDENTITY);

    public final Vec3 position;
    public final Mat3 rotation;

    public Frame(Vec3 position, Mat3 rotation) {
        this.position = Objects.requireNonNull(position, "position");
        this.rotation = Objects.requireNonNull(rotation, "rotation");
    }

    /** Frame at (px, py, pz) rotated by the quaternion (qx, qy, qz, qw), normalized first. */
    public static Frame of(double px, double py, double pz, double qx, double qy, double qz, double qw) {
        return new Frame(new Vec3(px, py, pz), Mat3.fromQuat(new Quat(qx, qy, qz, qw)));
    }

    public Vec3 rightVector() { return rotation.column(0); }
    public Vec3 upVector() { return rotation.column(1); }
    public Vec3 lookVector() { return rotation.column(2).neg(); }

    /** this * other: other expressed in this frame's space. */
    public Frame mul(Frame other) {
        return new Frame(position.add(rotation.mul(other.position)), rotation.mul(other.rotation));
    }

    /** Transforms a point from local to world space. */
    public Vec3 mul(Vec3 point) {
        return position.add(rotation.mul(point));
    }

    /** Inverse transform; the rotation is assumed orthonormal. */
    public Frame inverse() {
        Mat3 rt = rotation.transpose();
        return new Frame(rt.mul(position).neg(), rt);
    }

    @Override
    public String toString() {
        return "Frame(" + position + ", " + rotation + ")";
    }
}
