package lessons;

import java.lang.Math;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.joml.Quaternionf;
import org.joml.Vector2fc;
import org.joml.Vector3f;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

//One drag lesson: DragSession -> ProgressTracker -> body pose, per MotionKind.
//Progress survives letting go. Missing body or pivot disables the lesson
public class LessonController implements GrabHandler {
    private static final Logger log = LoggerFactory.getLogger(LessonController.class);

    private final LessonSettings settings;
    private final Body body;
    private final Pivot pivot;
    private final PickProvider picker;
    private final DragSession session;
    private final ProgressTracker tracker;
    private final SkyLight light = new SkyLight();
    private final List<LessonListener> listeners = new ArrayList<>();
    private final Vector3f scratch = new Vector3f();

    private LessonPhase phase = LessonPhase.INACTIVE;
    private boolean enabled;
    private boolean selfDisabled;
    private OrbitState orbit;
    private float minElevation, maxElevation;

    //Spin
    private final Quaternionf startRotation = new Quaternionf();
    private float netSpin;

    //Tilt
    private final Vector3f tiltAxis = new Vector3f();
    private float netTilt;
    private float holdTimer;
    private boolean inRange;

    public LessonController(LessonSettings settings, Body body, Pivot pivot, PickProvider picker) {
        this.settings = settings;
        this.body = body;
        this.pivot = pivot;
        this.picker = picker;
        this.tracker = new ProgressTracker(settings.cap, settings.effectiveUnitSize(), settings.policy, settings.maxStepDegrees);
        this.tracker.setTerminalPose(this::snapToTerminal);
        this.tracker.addListener(new ProgressTracker.Listener() {
            @Override
            public void onUnitAdvanced(int unit) {
                log.debug("Lesson '{}' reached {} {}", settings.id, settings.unitLabel, unit);
                for (LessonListener l : listeners) l.onUnitAdvanced(LessonController.this, unit);
            }

            @Override
            public void onCompleted(float accumulatedDegrees) {
                complete();
            }
        });
        this.session = new DragSession(this);
        initialize();
    }

    public void addListener(LessonListener l) {
        if (l != null && !listeners.contains(l)) listeners.add(l);
    }

    private boolean initialize() {
        if (body == null || (settings.kind.needsPivot() && pivot == null)) {
            selfDisabled = true;
            log.warn("Lesson '{}' has no {} ({}), it will be skipped", settings.id,
                body == null ? "body" : "pivot", body == null ? settings.bodyTag : settings.pivotTag);
            return false;
        }
        selfDisabled = false;

        tracker.reinitialize();
        startRotation.set(body.orientation());
        netSpin = 0.0f;
        netTilt = 0.0f;
        holdTimer = 0.0f;
        inRange = false;
        tiltAxis.set(settings.tiltAxis);
        if (tiltAxis.lengthSquared() <= OrbitalMotion.DEGENERATE_LENGTH_SQ) tiltAxis.set(1.0f, 0.0f, 0.0f);
        tiltAxis.normalize();

        switch (settings.kind) {
            case RADIAL_ORBIT:
            case AUTO_ORBIT:
                orbit = OrbitState.planar(pivot.position(), body.position(), settings.minRadius, settings.defaultRadius);
                break;
            case SPHERICAL_ORBIT:
                minElevation = (float)Math.toRadians(Math.min(settings.minElevation, settings.maxElevation));
                maxElevation = (float)Math.toRadians(Math.max(settings.minElevation, settings.maxElevation));
                orbit = OrbitState.spherical(pivot.position(), body.position(), settings.minRadius, settings.defaultRadius,
                    minElevation, 0.0f);
                orbit.setElevation(OrbitalMotion.clamp(orbit.elevation(), minElevation, maxElevation));
                light.update(body.position(), pivot.position());
                break;
            default:
                orbit = null;
                break;
        }
        return true;
    }

    //Drops all progress and re-measures from the current pose; lesson ends inactive
    public boolean reinitialize() {
        deactivate();
        phase = LessonPhase.INACTIVE;
        return initialize();
    }

    //Makes the lesson interactive; refused when broken or already done
    public boolean activate() {
        if (selfDisabled || phase == LessonPhase.COMPLETED) return false;
        phase = LessonPhase.ACTIVE;
        enabled = true;
        session.setEnabled(settings.kind.interactive());
        log.info("Lesson '{}' active ({}%)", settings.id, Math.round(progress() * 100.0f));
        return true;
    }

    public void deactivate() {
        enabled = false;
        session.setEnabled(false);
        if (phase == LessonPhase.ACTIVE) phase = LessonPhase.INACTIVE;
    }

    public void tick(PointerSource pointer, float dt) {
        if (!enabled) return;
        if (settings.kind == MotionKind.AUTO_ORBIT) {
            autoOrbit(dt);
        } else {
            session.tick(pointer, dt);
        }
    }

    @Override
    public Optional<Body> hitTest(Vector2fc pointer) {
        if (!enabled || picker == null) return Optional.empty();
        return picker.testPick(pointer)
            .filter(pick -> pick.body() == body || (body.tag() != null && body.tag().equals(pick.tag())))
            .map(pick -> body);
    }

    @Override
    public void onGrabStart(Body handle) {
        if (settings.kind == MotionKind.TILT_TO_TARGET) {
            holdTimer = 0.0f;
            inRange = false;
        }
        log.debug("Grabbed {} for '{}'", handle.name(), settings.id);
        for (LessonListener l : listeners) l.onGrabStarted(this);
    }

    @Override
    public void onGrabUpdate(Body handle, Vector2fc pointerDelta, float dt) {
        if (!enabled) return;
        switch (settings.kind) {
            case AXIS_SPIN:
                spin(pointerDelta.x());
                break;
            case RADIAL_ORBIT:
                radial(pointerDelta.x());
                break;
            case SPHERICAL_ORBIT:
                arc(pointerDelta);
                break;
            case TILT_TO_TARGET:
                tilt(pointerDelta.x(), dt);
                break;
            case AUTO_ORBIT:
            default:
                break;
        }
    }

    @Override
    public void onGrabEnd(Body handle) {
        if (settings.kind == MotionKind.TILT_TO_TARGET) {
            if (inRange) fireTargetRange(false);
            inRange = false;
            holdTimer = 0.0f;
        }
        boolean done = phase == LessonPhase.COMPLETED;
        log.debug("Released {} for '{}' at {}%", handle.name(), settings.id, Math.round(progress() * 100.0f));
        for (LessonListener l : listeners) l.onGrabEnded(this, done);
    }

    //Turn about the body's own up axis; distance spun either way counts
    private void spin(float dx) {
        float angleDelta = dx * settings.sensitivity;
        ProgressEvent e = tracker.applyDegrees(angleDelta);
        if (e.isNone()) return;
        netSpin += Math.copySign(e.appliedDegrees(), angleDelta);
        body.setOrientation(startRotation);
        body.rotateLocal((float)Math.toRadians(OrbitalMotion.wrapDegrees(netSpin)), OrbitalMotion.UP);
    }

    private void radial(float dx) {
        ProgressEvent e = tracker.applyDelta(dx, settings.sensitivity);
        if (e.isNone() || e.completed()) return;
        placeOnOrbit(tracker.accumulatedDegrees());
    }

    //Horizontal drag sweeps the azimuth (progress), vertical drag raises or lowers the sun
    private void arc(Vector2fc delta) {
        //Screen y grows downward, dragging up raises the sun
        float elevationStep = (float)Math.toRadians(-delta.y() * settings.verticalSensitivity);
        orbit.setElevation(OrbitalMotion.clamp(orbit.elevation() + elevationStep, minElevation, maxElevation));

        ProgressEvent e = tracker.applyDelta(delta.x(), settings.sensitivity);
        if (e.completed()) return;
        placeOnArc(tracker.accumulatedDegrees());
    }

    private void tilt(float dx, float dt) {
        float angleDelta = dx * settings.sensitivity;
        if (Math.abs(angleDelta) >= settings.minAnglePerTick) {
            netTilt += angleDelta;
            body.rotateWorld((float)Math.toRadians(angleDelta), tiltAxis);
        }

        float current = OrbitalMotion.wrapDegrees(netTilt);
        boolean near = Math.abs(current - settings.targetTilt) <= settings.tiltMargin
            || (settings.mirrored && Math.abs(current + settings.targetTilt) <= settings.tiltMargin);

        if (near) {
            if (!inRange) {
                //Entry tick starts the clock at zero
                inRange = true;
                holdTimer = 0.0f;
                fireTargetRange(true);
            } else {
                holdTimer += dt;
            }
            if (holdTimer >= settings.holdSeconds) {
                log.info("Lesson '{}' held {} degrees for {}s", settings.id, current, settings.holdSeconds);
                complete();
            }
        } else {
            if (inRange) fireTargetRange(false);
            inRange = false;
            holdTimer = 0.0f;
        }
    }

    private void autoOrbit(float dt) {
        ProgressEvent e = tracker.applyDegrees(settings.angularSpeed * dt);
        if (e.isNone() || e.completed()) return;
        placeOnOrbit(tracker.accumulatedDegrees());
    }

    private void snapToTerminal(float terminalDegrees) {
        switch (settings.kind) {
            case RADIAL_ORBIT:
            case AUTO_ORBIT:
                placeOnOrbit(terminalDegrees);
                break;
            case SPHERICAL_ORBIT:
                placeOnArc(terminalDegrees);
                break;
            default:
                //Spin sets its pose from the applied step right after
                break;
        }
    }

    private void placeOnOrbit(float degrees) {
        //A whole turn lands exactly on the start angle
        float angle = orbit.startAngle() + (float)Math.toRadians(degrees % 360.0f);
        OrbitalMotion.circularPosition(pivot.position(), orbit.radius(), angle, scratch);
        if (settings.preserveHeight) scratch.y = body.position().y();
        body.moveTo(scratch);
        orbit.setAngle(angle);
    }

    private void placeOnArc(float degrees) {
        float azimuth = orbit.startAngle() + (float)Math.toRadians(degrees % 360.0f);
        OrbitalMotion.sphericalPosition(pivot.position(), orbit.radius(), orbit.elevation(), azimuth, scratch);
        body.moveTo(scratch);
        orbit.setAngle(azimuth);
        light.update(body.position(), pivot.position());
    }

    private void complete() {
        if (phase == LessonPhase.COMPLETED) return;
        phase = LessonPhase.COMPLETED;
        enabled = false;
        session.setEnabled(false);
        log.info("Lesson '{}' completed", settings.id);
        for (LessonListener l : listeners) l.onLessonCompleted(this);
    }

    private void fireTargetRange(boolean entered) {
        log.debug("Lesson '{}' {} target range", settings.id, entered ? "entered" : "left");
        for (LessonListener l : listeners) l.onTargetRange(this, entered);
    }

    //0..1; for tilt lessons the share of the hold time already served
    public float progress() {
        if (settings.kind == MotionKind.TILT_TO_TARGET) {
            if (phase == LessonPhase.COMPLETED) return 1.0f;
            return settings.holdSeconds > 0.0f ? OrbitalMotion.clamp01(holdTimer / settings.holdSeconds) : 0.0f;
        }
        return tracker.fraction();
    }

    public String id() {
        return settings.id;
    }

    public MotionKind kind() {
        return settings.kind;
    }

    public LessonSettings settings() {
        return settings;
    }

    public LessonPhase phase() {
        return phase;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isSelfDisabled() {
        return selfDisabled;
    }

    public Body body() {
        return body;
    }

    public float accumulatedDegrees() {
        return tracker.accumulatedDegrees();
    }

    public int currentUnit() {
        return tracker.currentUnit();
    }

    public float netTilt() {
        return OrbitalMotion.wrapDegrees(netTilt);
    }

    public float holdTimer() {
        return holdTimer;
    }

    public boolean isInTargetRange() {
        return inRange;
    }

    //Null for lessons that do not orbit
    public OrbitState orbit() {
        return orbit;
    }

    public SkyLight skyLight() {
        return light;
    }

    DragSession session() {
        return session;
    }

    ProgressTracker tracker() {
        return tracker;
    }
}
