package lessons;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import org.joml.Vector2f;
import org.joml.Vector3f;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

//One lesson run wired together: scene, a controller per configured stage, sequencer and transition player.
//The host calls tick once per frame; everything below is only touched from that thread.
public class LessonSimulation {
    private static final Logger log = LoggerFactory.getLogger(LessonSimulation.class);

    //Requests from other threads (key handlers), run at the top of the next tick
    public enum Command { START, SKIP_STAGE, CANCEL_TRANSITION }

    private final LessonScene scene;
    private final List<LessonController> controllers;
    private final WaypointTransitionPlayer player;
    private final PhaseSequencer sequencer;
    private final Queue<Command> commands = new ConcurrentLinkedQueue<>();

    private final Vector2f lastLook = new Vector2f();
    private boolean looking;

    private LessonSimulation(LessonScene scene, List<LessonController> controllers, WaypointTransitionPlayer player,
                             PhaseSequencer sequencer) {
        this.scene = scene;
        this.controllers = controllers;
        this.player = player;
        this.sequencer = sequencer;
    }

    public static LessonSimulation create(SimulationConfig config, LessonScene scene, PickProvider picker) {
        CameraRig camera = scene.camera();
        if (camera != null) {
            camera.withLook(config.lookSensitivity(), config.pitchClamp(), config.lookSpeed());
        }

        List<LessonController> controllers = new ArrayList<>();
        List<Stage> stages = new ArrayList<>();
        for (String id : config.stageIds()) {
            LessonSettings settings = config.lesson(id);
            LessonController controller = new LessonController(settings, scene.body(settings.bodyTag()),
                scene.body(settings.pivotTag()), picker);
            controllers.add(controller);

            Stage stage = Stage.of(controller);
            List<Vector3f> path = config.transition(id);
            if (!path.isEmpty()) stage.withTransition(path, config.transitionSpeed(id));
            Vector3f[] pose = config.cameraPose(id);
            if (pose != null) stage.withCamera(pose[0], pose[1], config.cameraGlide(id));
            stages.add(stage);
        }

        WaypointTransitionPlayer player = null;
        if (camera != null) {
            player = new WaypointTransitionPlayer(camera).withCamera(camera, true);
        }
        PhaseSequencer sequencer = new PhaseSequencer(stages, player, camera);
        log.info("Lesson run ready: {} stages", stages.size());
        return new LessonSimulation(scene, controllers, player, sequencer);
    }

    public void tick(PointerSource pointer, float dt) {
        Command command;
        while ((command = commands.poll()) != null) run(command);
        freeLook(pointer);
        if (scene.camera() != null) scene.camera().tick(dt);
        for (LessonController c : controllers) c.tick(pointer, dt);
        if (player != null) player.tick(dt);
        sequencer.tick();
    }

    private void freeLook(PointerSource pointer) {
        CameraRig camera = scene.camera();
        if (camera == null) return;
        if (!pointer.secondaryHeld()) {
            looking = false;
            return;
        }
        if (looking) {
            camera.freeLook(pointer.position().x() - lastLook.x, pointer.position().y() - lastLook.y);
        }
        lastLook.set(pointer.position());
        looking = true;
    }

    //Safe from any thread
    public void request(Command command) {
        if (command != null) commands.add(command);
    }

    private void run(Command command) {
        switch (command) {
            case START:
                if (!start()) log.debug("Start ignored, lessons already running");
                break;
            case SKIP_STAGE:
                if (!skipStage()) log.debug("Skip refused at stage {}", sequencer.currentIndex());
                break;
            case CANCEL_TRANSITION:
                cancelTransition();
                break;
        }
    }

    public boolean start() {
        return sequencer.start();
    }

    //Moves on to the stage after the current one, abandoning its progress
    public boolean skipStage() {
        return sequencer.enterPhase(sequencer.currentIndex() + 1);
    }

    //Cuts a running transition short; the next stage starts on the following tick
    public void cancelTransition() {
        if (player != null) player.stop();
    }

    public LessonScene scene() {
        return scene;
    }

    public List<LessonController> controllers() {
        return Collections.unmodifiableList(controllers);
    }

    public PhaseSequencer sequencer() {
        return sequencer;
    }

    //Null when the scene has no camera
    public WaypointTransitionPlayer player() {
        return player;
    }
}
