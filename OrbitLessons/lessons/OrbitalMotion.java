package lessons;

import java.lang.Math;
import org.joml.Matrix3f;
import org.joml.Quaternionf;
import org.joml.Vector3f;
import org.joml.Vector3fc;

//Stateless pose math; results go into caller supplied destinations
public final class OrbitalMotion {
    public static final Vector3fc UP = new Vector3f(0.0f, 1.0f, 0.0f);
    public static final Vector3fc FORWARD = new Vector3f(0.0f, 0.0f, -1.0f);

    //Squared length under which a direction counts as zero
    static final float DEGENERATE_LENGTH_SQ = 1.0e-6f;

    private OrbitalMotion() {}

    //Belt orbit in the XZ plane
    public static Vector3f circularPosition(Vector3fc pivot, float radius, float angleRadians, Vector3f dest) {
        return dest.set(
            pivot.x() + radius * (float)Math.cos(angleRadians),
            pivot.y(),
            pivot.z() + radius * (float)Math.sin(angleRadians));
    }

    //Sky arc: elevation above the horizon, azimuth around the up axis
    public static Vector3f sphericalPosition(Vector3fc pivot, float radius, float elevation, float azimuth, Vector3f dest) {
        float cosElev = (float)Math.cos(elevation);
        return dest.set(
            pivot.x() + radius * cosElev * (float)Math.sin(azimuth),
            pivot.y() + radius * (float)Math.sin(elevation),
            pivot.z() + radius * cosElev * (float)Math.cos(azimuth));
    }

    //Inverse of circularPosition
    public static float planarAngle(Vector3fc pivot, Vector3fc position) {
        return (float)Math.atan2(position.z() - pivot.z(), position.x() - pivot.x());
    }

    public static float planarRadius(Vector3fc pivot, Vector3fc position) {
        float dx = position.x() - pivot.x();
        float dz = position.z() - pivot.z();
        return (float)Math.sqrt(dx * dx + dz * dz);
    }

    //Inverses of sphericalPosition, offset must not be zero
    public static float elevationOf(Vector3fc offset) {
        float len = offset.length();
        return (float)Math.asin(clamp(offset.y() / len, -1.0f, 1.0f));
    }

    public static float azimuthOf(Vector3fc offset) {
        return (float)Math.atan2(offset.x(), offset.z());
    }

    //Forward (-Z) from -> to. Coincident points: identity and false
    public static boolean lookOrientation(Vector3fc from, Vector3fc to, Quaternionf dest) {
        Vector3f f = new Vector3f(to).sub(from);
        if (!(f.lengthSquared() > DEGENERATE_LENGTH_SQ)) {
            dest.identity();
            return false;
        }
        f.normalize();

        Vector3f right = new Vector3f(f).cross(UP);
        if (right.lengthSquared() <= DEGENERATE_LENGTH_SQ) {
            //Looking straight up or down, borrow -Z as the up reference
            right.set(f).cross(0.0f, 0.0f, -1.0f);
        }
        right.normalize();
        Vector3f up = new Vector3f(right).cross(f);

        Matrix3f basis = new Matrix3f(
            right.x, right.y, right.z,
            up.x, up.y, up.z,
            -f.x, -f.y, -f.z);
        dest.setFromNormalized(basis);
        return true;
    }

    //Degrees into (-180, 180]
    public static float wrapDegrees(float degrees) {
        float d = degrees % 360.0f;
        if (d > 180.0f) d -= 360.0f;
        if (d <= -180.0f) d += 360.0f;
        return d;
    }

    public static float clamp(float v, float lo, float hi) {
        return Math.max(lo, Math.min(hi, v));
    }

    public static float clamp01(float v) {
        return clamp(v, 0.0f, 1.0f);
    }

    public static float lerp(float a, float b, float t) {
        return a + (b - a) * t;
    }

    public static float smoothstep(float edge0, float edge1, float x) {
        float t = clamp01((x - edge0) / (edge1 - edge0));
        return t * t * (3.0f - 2.0f * t);
    }

    //t in [0, 1]
    public static float easeInOutCubic(float t) {
        return t < 0.5f ? 4.0f * t * t * t : 1.0f - (float)Math.pow(-2.0f * t + 2.0f, 3.0f) / 2.0f;
    }
}
