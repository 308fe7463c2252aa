package rotation3d;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static rotation3d.QuatTest.assertQuat;
import static rotation3d.QuatTest.assertVec;

/**
 * Composition and extraction for all six Euler orders, including gimbal lock.
 */
@DisplayName("Euler angles")
class EulerAnglesTest {
    private static final double EPS = 1e-12;

    private static final double[][] ANGLES = {
            { 0.3, -0.7, 1.1 },
            { -1.2, 0.9, -0.4 },
            { 0.05, 1.3, -1.35 },
            { 2.5, -0.2, -2.8 },
    };

    private static Quat axisRotation(char axis, double rx, double ry, double rz) {
        switch (axis) {
            case 'X': return Quat.fromAxisAngle(Vec3.X_AXIS, rx);
            case 'Y': return Quat.fromAxisAngle(Vec3.Y_AXIS, ry);
            default: return Quat.fromAxisAngle(Vec3.Z_AXIS, rz);
        }
    }

    /** Middle-axis index (0 = x, 1 = y, 2 = z) of an order. */
    private static int middle(EulerOrder order) {
        return order.name().charAt(1) - 'X';
    }

    private static double component(Vec3 v, int i) {
        return i == 0 ? v.x : i == 1 ? v.y : v.z;
    }

    @Test
    @DisplayName("Order ABC composes as qA * qB * qC")
    void testCompositionOrder() {
        for (EulerOrder order : EulerOrder.values()) {
            String axes = order.name();
            for (double[] a : ANGLES) {
                Quat expected = axisRotation(axes.charAt(0), a[0], a[1], a[2])
                        .mul(axisRotation(axes.charAt(1), a[0], a[1], a[2]))
                        .mul(axisRotation(axes.charAt(2), a[0], a[1], a[2]));
                assertQuat(expected, Quat.fromEulerAngles(a[0], a[1], a[2], order), EPS);
            }
        }
    }

    @Test
    @DisplayName("Extraction recovers the angles away from gimbal lock")
    void testRoundTrip() {
        for (EulerOrder order : EulerOrder.values()) {
            for (double[] a : ANGLES) {
                Vec3 angles = new Vec3(a[0], a[1], a[2]);
                if (Math.abs(component(angles, middle(order))) >= Math.PI / 2) continue;
                Quat q = Quat.fromEulerAngles(a[0], a[1], a[2], order);
                assertVec(angles, q.toEulerAngles(order), 1e-9);
            }
        }
    }

    @Test
    void testExtractionOfRandomRotations() {
        RandomQuat random = new RandomQuat(29);
        for (int i = 0; i < 200; i++) {
            Quat q = random.next();
            for (EulerOrder order : EulerOrder.values()) {
                Vec3 a = q.toEulerAngles(order);
                double m = Math.abs(component(a, middle(order)));
                assertTrue(m <= Math.PI / 2 + 1e-12);
                // the pinned branch only approximates rotations just inside the lock threshold
                if (m > Math.PI / 2 - 0.01) continue;
                assertTrue(Quat.fromEulerAngles(a.x, a.y, a.z, order).approxEq(q), order + " " + q);
            }
        }
    }

    @Test
    void testExtractionNormalizesFirst() {
        Quat q = Quat.fromEulerAngles(0.3, -0.7, 1.1, EulerOrder.ZXY);
        assertVec(q.toEulerAngles(EulerOrder.ZXY), q.mul(4).toEulerAngles(EulerOrder.ZXY), 1e-12);
    }

    @Test
    @DisplayName("At gimbal lock the third angle is pinned and the rotation survives")
    void testGimbalLock() {
        for (EulerOrder order : EulerOrder.values()) {
            int mid = middle(order);
            int last = order.name().charAt(2) - 'X';
            for (double sign : new double[] { 1, -1 }) {
                double[] a = { 0.4, -0.6, 0.25 };
                a[mid] = sign * Math.PI / 2;
                Quat q = Quat.fromEulerAngles(a[0], a[1], a[2], order);

                Vec3 angles = q.toEulerAngles(order);
                assertEquals(sign * Math.PI / 2, component(angles, mid), 1e-12, order.name());
                assertEquals(0.0, component(angles, last), order.name());
                assertTrue(Quat.fromEulerAngles(angles.x, angles.y, angles.z, order).approxEq(q),
                        order + " sign " + sign);
            }
        }
    }

    @Test
    @DisplayName("Unordered calls use XYZ")
    void testDefaultOrder() {
        Quat q = Quat.fromEulerAngles(0.3, -0.7, 1.1);
        assertEquals(Quat.fromEulerAngles(0.3, -0.7, 1.1, EulerOrder.XYZ), q);
        assertEquals(Quat.angles(0.3, -0.7, 1.1), q);
        assertEquals(EulerAngles.toXYZ(q), q.toEulerAngles());
    }

    @Test
    @DisplayName("Orientation helpers use YXZ")
    void testOrientationAliases() {
        Quat q = Quat.fromOrientation(0.3, -0.7, 1.1);
        assertEquals(Quat.fromEulerAngles(0.3, -0.7, 1.1, EulerOrder.YXZ), q);
        assertEquals(q.toEulerAngles(EulerOrder.YXZ), q.toOrientation());
    }

    @Test
    void testSingleAxisAngles() {
        for (EulerOrder order : EulerOrder.values()) {
            assertQuat(Quat.fromAxisAngle(Vec3.X_AXIS, 0.7), Quat.fromEulerAngles(0.7, 0, 0, order), EPS);
            assertQuat(Quat.fromAxisAngle(Vec3.Y_AXIS, 0.7), Quat.fromEulerAngles(0, 0.7, 0, order), EPS);
            assertQuat(Quat.fromAxisAngle(Vec3.Z_AXIS, 0.7), Quat.fromEulerAngles(0, 0, 0.7, order), EPS);
            assertVec(Vec3.ZERO, Quat.IDENTITY.toEulerAngles(order), EPS);
        }
    }

    @Test
    @DisplayName("A null order means XYZ")
    void testNullOrder() {
        assertEquals(Quat.fromEulerAngles(0.3, -0.7, 1.1), Quat.fromEulerAngles(0.3, -0.7, 1.1, null));
        Quat q = Quat.fromAxisAngle(new Vec3(1, 2, 0), 0.8);
        assertEquals(q.toEulerAngles(), q.toEulerAngles(null));
        assertEquals(EulerAngles.toXYZ(q), EulerAngles.decompose(null, q));
    }

    @Test
    void testParse() {
        assertEquals(EulerOrder.YXZ, EulerOrder.parse("yxz"));
        assertEquals(EulerOrder.ZYX, EulerOrder.parse(" ZYX "));
        assertEquals(EulerOrder.XYZ, EulerOrder.parse(null));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> EulerOrder.parse("XXY"));
        assertEquals("Unknown rotation order: XXY", e.getMessage());
    }

    @Test
    void testComposeAndDecomposeDispatch() {
        for (EulerOrder order : EulerOrder.values()) {
            assertEquals(Quat.fromEulerAngles(0.1, 0.2, 0.3, order), EulerAngles.compose(order, 0.1, 0.2, 0.3));
        }
        Quat q = Quat.fromAxisAngle(new Vec3(1, 1, 0), 0.5);
        assertEquals(EulerAngles.toZYX(q), EulerAngles.decompose(EulerOrder.ZYX, q));
        assertEquals(EulerAngles.fromXZY(0.1, 0.2, 0.3), EulerAngles.compose(EulerOrder.XZY, 0.1, 0.2, 0.3));
    }
}
