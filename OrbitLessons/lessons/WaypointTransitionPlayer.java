package lessons;

import java.util.ArrayList;
import java.util.List;
import org.joml.Vector3f;
import org.joml.Vector3fc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

//Moves one body along waypoints at a fixed speed, one step per tick, so a run can be cut short between ticks.
//Free look is off while running and the camera turns toward the waypoint ahead.
public class WaypointTransitionPlayer {
    private static final Logger log = LoggerFactory.getLogger(WaypointTransitionPlayer.class);

    //Closer than this counts as arrived
    static final float ARRIVE_EPSILON = 0.05f;

    private final Body driven;
    private final List<TransitionListener> listeners = new ArrayList<>();
    private final List<Vector3f> waypoints = new ArrayList<>();
    private final Vector3f scratch = new Vector3f();
    private CameraRig camera;
    private boolean lookAtDuringTransition = true;

    private int currentIndex;
    private boolean running;
    private float speed;
    private boolean loop;
    private boolean cachedFreeLook;

    public WaypointTransitionPlayer(Body driven) {
        if (driven == null) throw new IllegalArgumentException("driven");
        this.driven = driven;
    }

    //Camera to steer while running; may be the driven body itself
    public WaypointTransitionPlayer withCamera(CameraRig camera, boolean lookAtDuringTransition) {
        this.camera = camera;
        this.lookAtDuringTransition = lookAtDuringTransition;
        return this;
    }

    public void addListener(TransitionListener l) {
        if (l != null && !listeners.contains(l)) listeners.add(l);
    }

    //False, changing nothing, if already running, given no waypoints or a non-positive speed
    public boolean start(List<? extends Vector3fc> points, float speed, boolean loop) {
        if (running) {
            log.debug("Transition already running, start ignored");
            return false;
        }
        if (points == null || points.isEmpty()) {
            log.warn("Transition has no waypoints");
            return false;
        }
        if (!(speed > 0.0f)) {
            log.warn("Transition speed must be positive, got {}", speed);
            return false;
        }

        waypoints.clear();
        for (Vector3fc p : points) waypoints.add(new Vector3f(p));
        this.speed = speed;
        this.loop = loop;
        currentIndex = 0;
        running = true;

        if (camera != null) {
            camera.stopGlide();
            cachedFreeLook = camera.isFreeLookEnabled();
            camera.setFreeLookEnabled(false);
        }
        log.info("Transition started: {} waypoints at {} units/s{}", waypoints.size(), speed, loop ? ", looping" : "");
        return true;
    }

    public void tick(float dt) {
        if (!running) return;

        Vector3f target = waypoints.get(currentIndex);
        moveTowards(target, speed * dt);
        if (camera != null && lookAtDuringTransition) camera.lookTowards(target, dt);

        if (driven.position().distance(target) > ARRIVE_EPSILON) return;

        driven.moveTo(target);
        int reached = currentIndex++;
        for (TransitionListener l : listeners) l.onWaypointReached(reached);
        //A listener may have stopped us
        if (!running) return;

        if (currentIndex >= waypoints.size()) {
            currentIndex = 0;
            if (!loop) {
                finish();
                log.info("Transition complete");
                for (TransitionListener l : listeners) l.onTransitionComplete();
            }
        }
    }

    //Halts where it is; no completion event follows
    public void stop() {
        if (!running) return;
        finish();
        log.info("Transition stopped at waypoint {}", currentIndex);
    }

    private void finish() {
        running = false;
        if (camera != null) {
            camera.setFreeLookEnabled(cachedFreeLook);
        }
    }

    private void moveTowards(Vector3fc target, float maxStep) {
        scratch.set(target).sub(driven.position());
        float dist = scratch.length();
        if (dist <= maxStep || dist == 0.0f) {
            driven.moveTo(target);
        } else {
            scratch.mul(maxStep / dist).add(driven.position());
            driven.moveTo(scratch);
        }
    }

    public boolean isRunning() {
        return running;
    }

    public int currentIndex() {
        return currentIndex;
    }

    //Target being approached, null when idle
    public Vector3fc currentWaypoint() {
        return running ? waypoints.get(currentIndex) : null;
    }

    public Body driven() {
        return driven;
    }
}
