package rotation3d;

import java.util.Random;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Seeded source of uniformly distributed unit quaternions.
 *
 * Each generator owns its random stream; the same seed always yields the same
 * sequence and nothing else in the library touches the stream.
 */
public final class RandomQuat implements Supplier<Quat> {
    private static final Logger LOGGER = LoggerFactory.getLogger(RandomQuat.class);

    private static final double TAU = 2 * Math.PI;

    private final Random random;

    public RandomQuat() { this(1); }

    public RandomQuat(long seed) {
        this.random = new Random(seed);
        LOGGER.debug("Seeded random quaternion stream with {}", seed);
    }

    /** Next rotation, uniform over the unit 3-sphere. */
    public Quat next() {
        double u = random.nextDouble();
        double v = random.nextDouble();
        double w = random.nextDouble();

        double squ = Math.sqrt(u);
        double sqmu = Math.sqrt(1 - u);
        double tpv = TAU * v;
        double tpw = TAU * w;
        return new Quat(
                sqmu * Math.sin(tpv),
                sqmu * Math.cos(tpv),
                squ * Math.sin(tpw),
                squ * Math.cos(tpw)
        );
    }

    @Override
    public Quat get() {
        return next();
    }
}
