package rotation3d;

/** Rotation axis and angle in radians, as returned by {@link Quat#toAxisAngle()}. */
public final class AxisAngle {
    public final Vec3 axis;
    public final double angle;

    public AxisAngle(Vec3 axis, double angle) {
        this.axis = axis;
        this.angle = angle;
    }

    /** axis * angle. */
    public Vec3 rotationVector() {
        return axis.mul(angle);
    }

    public Quat toQuat() {
        return Quat.fromAxisAngle(axis, angle);
    }

    @Override
    public String toString() {
        return "AxisAngle(" + axis + ", " + angle + ")";
    }
}
