package demo3d;

import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import rotation3d.*;

public class DemoMain {
    private static final Logger LOGGER = LoggerFactory.getLogger(DemoMain.class);

    public static void main(String[] args){
        int steps = args.length > 0 ? Integer.parseInt(args[0]) : 600;
        Quat end = run(steps);
        LOGGER.info("Final orientation: {}", end.toString(4));
    }

    /**
     * Spins a body about a tilted axis for the first half of the run, then
     * eases it towards a look-at target. Returns the final orientation.
     */
    public static Quat run(int steps){
        float dt = 1f/60f;

        Quat orientation = Quat.identity();
        Vec3 angularVelocity = new Vec3(0.3, 1.2, 0); // rad/s, body frame

        // Camera-style target: look from the origin towards a point up and to the left
        Quat target = Quat.lookAt(Vec3.ZERO, new Vec3(-4, 2, -6));
        double easing = 0.08; // slerp fraction per step

        for (int i=0;i<steps;i++){
            if (i < steps / 2) {
                orientation = orientation.integrate(angularVelocity, dt);
            } else {
                orientation = orientation.slerp(target, easing);
            }

            if (i % 60 == 0){
                Vec3 euler = orientation.toEulerAngles(EulerOrder.YXZ);
                LOGGER.info("t={} euler(YXZ)=({}, {}, {}) distanceToTarget={}",
                        fixed(i*dt, 2),
                        fixed(euler.x, 3), fixed(euler.y, 3), fixed(euler.z, 3),
                        fixed(orientation.distanceSym(target), 4));
            }
        }
        return orientation;
    }

    static String fixed(double value, int places){
        return String.format(Locale.ROOT, "%." + places + "f", value);
    }
}
