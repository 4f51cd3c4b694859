package lessons;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.joml.Vector3f;
import org.joml.Vector3fc;

//One step of the lesson flow: a lesson, and optionally how the camera gets there and leaves
public final class Stage {
    private final LessonController controller;
    private final List<Vector3f> transition = new ArrayList<>();
    private float transitionSpeed = 5.0f;
    private Vector3f cameraPosition;
    private Vector3f cameraTarget;
    private float cameraGlide;

    private Stage(LessonController controller) {
        if (controller == null) throw new IllegalArgumentException("controller");
        this.controller = controller;
    }

    public static Stage of(LessonController controller) {
        return new Stage(controller);
    }

    //Waypoints to travel once this stage's lesson is complete, before the next one starts
    public Stage withTransition(List<? extends Vector3fc> waypoints, float speed) {
        transition.clear();
        for (Vector3fc p : waypoints) transition.add(new Vector3f(p));
        this.transitionSpeed = speed;
        return this;
    }

    //Vantage point the camera jumps to when the stage is entered
    public Stage withCamera(Vector3fc position, Vector3fc target) {
        return withCamera(position, target, 0.0f);
    }

    //Same, easing over glideSeconds instead of jumping
    public Stage withCamera(Vector3fc position, Vector3fc target, float glideSeconds) {
        this.cameraPosition = new Vector3f(position);
        this.cameraTarget = new Vector3f(target);
        this.cameraGlide = glideSeconds;
        return this;
    }

    public LessonController controller() {
        return controller;
    }

    public boolean hasTransition() {
        return !transition.isEmpty();
    }

    public List<Vector3f> transition() {
        return Collections.unmodifiableList(transition);
    }

    public float transitionSpeed() {
        return transitionSpeed;
    }

    void applyCamera(CameraRig camera) {
        if (camera != null && cameraPosition != null) {
            camera.glideTo(cameraPosition, cameraTarget, cameraGlide);
        }
    }
}
