package lessons;

import java.lang.Math;
import org.joml.Matrix4f;
import org.joml.Quaternionf;
import org.joml.Vector3f;
import org.joml.Vector3fc;

//The viewer: free look on the secondary button, eased glides between stage vantage points,
//and a smooth look toward the waypoint while a transition flies it
public class CameraRig extends Body {
    private float lookSensitivity = 0.2f;
    private float pitchClamp = 80.0f;
    private float lookSpeed = 6.0f;

    private boolean freeLookEnabled = true;
    private float yaw, pitch;

    //Glide
    private final Vector3f glideFrom = new Vector3f();
    private final Vector3f glideTo = new Vector3f();
    private final Quaternionf glideFromRot = new Quaternionf();
    private final Quaternionf glideToRot = new Quaternionf();
    private float glideSeconds, glideElapsed;
    private boolean gliding;

    public CameraRig() {
        super("Camera", "Camera", 0.0f);
    }

    //(lookSensitivity, pitchClamp, lookSpeed)
    public CameraRig withLook(float sensitivity, float pitchClampDegrees, float lookSpeed) {
        this.lookSensitivity = sensitivity;
        this.pitchClamp = Math.abs(pitchClampDegrees);
        this.lookSpeed = lookSpeed;
        return this;
    }

    public void freeLook(float dx, float dy) {
        if (!freeLookEnabled || gliding) return;
        yaw -= dx * lookSensitivity;
        pitch = OrbitalMotion.clamp(pitch - dy * lookSensitivity, -pitchClamp, pitchClamp);
        setOrientation(new Quaternionf().rotationYXZ((float)Math.toRadians(yaw), (float)Math.toRadians(pitch), 0.0f));
    }

    //One smoothing step toward facing target
    public void lookTowards(Vector3fc target, float dt) {
        Quaternionf desired = new Quaternionf();
        if (!OrbitalMotion.lookOrientation(position(), target, desired)) return;
        Quaternionf q = new Quaternionf(orientation());
        q.slerp(desired, OrbitalMotion.clamp01(dt * lookSpeed));
        setOrientation(q);
        syncAngles();
    }

    //Jump to a vantage point facing target
    public void placeAt(Vector3fc position, Vector3fc target) {
        gliding = false;
        moveTo(position);
        Quaternionf q = new Quaternionf();
        if (OrbitalMotion.lookOrientation(position, target, q)) {
            setOrientation(q);
            syncAngles();
        }
    }

    //Ease over to a vantage point; seconds <= 0 jumps straight there
    public void glideTo(Vector3fc position, Vector3fc target, float seconds) {
        if (!(seconds > 0.0f)) {
            placeAt(position, target);
            return;
        }
        glideFrom.set(position());
        glideTo.set(position);
        glideFromRot.set(orientation());
        if (!OrbitalMotion.lookOrientation(position, target, glideToRot)) glideToRot.set(orientation());
        glideSeconds = seconds;
        glideElapsed = 0.0f;
        gliding = true;
    }

    public void tick(float dt) {
        if (!gliding) return;
        glideElapsed = Math.min(glideElapsed + dt, glideSeconds);
        float t = glideElapsed / glideSeconds;
        if (glideElapsed >= glideSeconds) {
            moveTo(glideTo);
            setOrientation(glideToRot);
            gliding = false;
        } else {
            moveTo(new Vector3f(glideFrom).lerp(glideTo, OrbitalMotion.easeInOutCubic(t)));
            setOrientation(new Quaternionf(glideFromRot).slerp(glideToRot, OrbitalMotion.smoothstep(0.0f, 1.0f, t)));
        }
        syncAngles();
    }

    //Leaves the camera wherever the glide had got to
    public void stopGlide() {
        gliding = false;
    }

    public boolean isGliding() {
        return gliding;
    }

    private void syncAngles() {
        Vector3f f = orientation().transform(new Vector3f(OrbitalMotion.FORWARD));
        yaw = (float)Math.toDegrees(Math.atan2(-f.x, -f.z));
        pitch = OrbitalMotion.clamp((float)Math.toDegrees(Math.asin(OrbitalMotion.clamp(f.y, -1.0f, 1.0f))), -pitchClamp, pitchClamp);
    }

    public Vector3f forward(Vector3f dest) {
        return orientation().transform(dest.set(OrbitalMotion.FORWARD));
    }

    public Matrix4f viewMatrix(Matrix4f dest) {
        Vector3f f = forward(new Vector3f());
        Vector3f up = orientation().transform(new Vector3f(OrbitalMotion.UP));
        Vector3fc p = position();
        return dest.setLookAt(p.x(), p.y(), p.z(), p.x() + f.x, p.y() + f.y, p.z() + f.z, up.x, up.y, up.z);
    }

    public boolean isFreeLookEnabled() {
        return freeLookEnabled;
    }

    public void setFreeLookEnabled(boolean enabled) {
        this.freeLookEnabled = enabled;
    }

    public float yaw() {
        return yaw;
    }

    public float pitch() {
        return pitch;
    }
}
