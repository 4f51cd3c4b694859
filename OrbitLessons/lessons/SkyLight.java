package lessons;

import org.joml.Quaternionf;
import org.joml.Quaternionfc;
import org.joml.Vector3f;
import org.joml.Vector3fc;

//Blend night -> day on t = clamp01(dot(normalize(sun - observer), up))
public class SkyLight {
    public static final Vector3fc NIGHT_COLOR = new Vector3f(0.1f, 0.15f, 0.4f);
    public static final Vector3fc DAY_COLOR = new Vector3f(1.0f, 1.0f, 1.0f);
    public static final float NIGHT_INTENSITY = 0.05f;
    public static final float DAY_INTENSITY = 1.0f;

    private final Vector3f color = new Vector3f(NIGHT_COLOR);
    private final Quaternionf direction = new Quaternionf();
    private float height;
    private float intensity = NIGHT_INTENSITY;

    public void update(Vector3fc sun, Vector3fc observer) {
        Vector3f offset = new Vector3f(sun).sub(observer);
        if (offset.lengthSquared() <= OrbitalMotion.DEGENERATE_LENGTH_SQ) {
            height = 0.0f;
        } else {
            height = OrbitalMotion.clamp01(offset.normalize().dot(OrbitalMotion.UP));
            //Light travels from the sun toward the observer
            OrbitalMotion.lookOrientation(sun, observer, direction);
        }
        intensity = OrbitalMotion.lerp(NIGHT_INTENSITY, DAY_INTENSITY, height);
        NIGHT_COLOR.lerp(DAY_COLOR, height, color);
    }

    //0 at or below the horizon, 1 straight overhead
    public float height() {
        return height;
    }

    public float intensity() {
        return intensity;
    }

    public Vector3fc color() {
        return color;
    }

    public Quaternionfc direction() {
        return direction;
    }
}
