package lessons;

import java.lang.Math;
import org.joml.Vector3f;
import org.joml.Vector3fc;

//Radius is measured once, kept until re-initialized
public final class OrbitState {
    //Offsets shorter than this fall back to the configured default radius
    static final float DEGENERATE_RADIUS = 1.0e-4f;

    private final float radius;
    private final float startAngle;
    private final float startElevation;
    private float angle;
    private float elevation;

    private OrbitState(float radius, float startAngle, float startElevation) {
        this.radius = radius;
        this.startAngle = startAngle;
        this.startElevation = startElevation;
        this.angle = startAngle;
        this.elevation = startElevation;
    }

    //Belt orbit: radius and angle in the XZ plane
    static OrbitState planar(Vector3fc pivot, Vector3fc body, float minRadius, float defaultRadius) {
        float r = OrbitalMotion.planarRadius(pivot, body);
        if (!isUsable(r)) {
            return new OrbitState(Math.max(minRadius, defaultRadius), 0.0f, 0.0f);
        }
        return new OrbitState(Math.max(minRadius, r), OrbitalMotion.planarAngle(pivot, body), 0.0f);
    }

    //Sky arc: full 3-D offset, azimuth plus elevation
    static OrbitState spherical(Vector3fc pivot, Vector3fc body, float minRadius, float defaultRadius,
                                float fallbackElevation, float fallbackAzimuth) {
        Vector3f offset = new Vector3f(body).sub(pivot);
        float r = offset.length();
        if (!isUsable(r)) {
            return new OrbitState(Math.max(minRadius, defaultRadius), fallbackAzimuth, fallbackElevation);
        }
        return new OrbitState(Math.max(minRadius, r), OrbitalMotion.azimuthOf(offset), OrbitalMotion.elevationOf(offset));
    }

    private static boolean isUsable(float r) {
        return r > DEGENERATE_RADIUS && !Float.isNaN(r) && !Float.isInfinite(r);
    }

    public float radius() {
        return radius;
    }

    public float startAngle() {
        return startAngle;
    }

    public float startElevation() {
        return startElevation;
    }

    public float angle() {
        return angle;
    }

    public float elevation() {
        return elevation;
    }

    void setAngle(float angle) {
        this.angle = angle;
    }

    void setElevation(float elevation) {
        this.elevation = elevation;
    }
}
