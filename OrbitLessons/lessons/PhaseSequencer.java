package lessons;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

//Stages in order, one lesson interactive at a time. Locks after the last lesson.
//A stopped transition sends no completion, so tick() polls isRunning()
public class PhaseSequencer implements LessonListener, TransitionListener {
    private static final Logger log = LoggerFactory.getLogger(PhaseSequencer.class);

    private final List<Stage> stages;
    private final WaypointTransitionPlayer player;
    private final CameraRig camera;
    private final List<SequencerListener> listeners = new ArrayList<>();

    private int currentIndex = -1;
    private boolean awaitingTransition;
    private boolean locked;

    //player and camera may be null when no stage travels or moves the camera
    public PhaseSequencer(List<Stage> stages, WaypointTransitionPlayer player, CameraRig camera) {
        this.stages = new ArrayList<>(stages);
        this.player = player;
        this.camera = camera;
        for (Stage s : this.stages) {
            s.controller().deactivate();
            s.controller().addListener(this);
        }
        if (player != null) player.addListener(this);
    }

    public void addListener(SequencerListener l) {
        if (l != null && !listeners.contains(l)) listeners.add(l);
    }

    public boolean start() {
        return enterPhase(0);
    }

    //Current index or later only; refused when locked, in transition or out of range
    public boolean enterPhase(int index) {
        if (locked) {
            log.debug("Sequencer locked, enterPhase({}) ignored", index);
            return false;
        }
        if (awaitingTransition) {
            log.debug("Transition in progress, enterPhase({}) ignored", index);
            return false;
        }
        if (index < 0 || index >= stages.size()) {
            log.warn("No stage {} (have {})", index, stages.size());
            return false;
        }
        if (index < currentIndex) {
            log.warn("Stage {} is behind the current stage {}", index, currentIndex);
            return false;
        }
        if (index == currentIndex) {
            LessonController current = stages.get(index).controller();
            return current.isEnabled() || current.activate();
        }
        if (currentIndex >= 0) stages.get(currentIndex).controller().deactivate();
        return activateFrom(index);
    }

    //Enters the first usable stage at or after index; broken lessons are skipped
    private boolean activateFrom(int index) {
        int i = index;
        while (i < stages.size()) {
            Stage stage = stages.get(i);
            stage.applyCamera(camera);
            currentIndex = i;
            if (stage.controller().activate()) {
                log.info("Entered stage {} '{}'", i, stage.controller().id());
                for (SequencerListener l : listeners) l.onPhaseEntered(i, stage.controller());
                return true;
            }
            log.warn("Stage {} '{}' cannot run, skipping it", i, stage.controller().id());
            i++;
        }
        lock();
        return false;
    }

    @Override
    public void onLessonCompleted(LessonController lesson) {
        if (locked || currentIndex < 0 || stages.get(currentIndex).controller() != lesson) {
            log.debug("Ignoring completion of '{}', it is not the current stage", lesson.id());
            return;
        }
        Stage stage = stages.get(currentIndex);
        lesson.deactivate();
        for (SequencerListener l : listeners) l.onLessonCompleted(currentIndex, lesson);

        if (currentIndex == stages.size() - 1) {
            lock();
            return;
        }
        if (stage.hasTransition()) {
            if (player != null && player.start(stage.transition(), stage.transitionSpeed(), false)) {
                awaitingTransition = true;
                for (SequencerListener l : listeners) l.onTransitionStarted(currentIndex);
                return;
            }
            log.warn("Transition after '{}' could not start, going straight to the next stage", lesson.id());
        }
        activateFrom(currentIndex + 1);
    }

    @Override
    public void onGrabEnded(LessonController lesson, boolean completed) {
        if (!completed && lesson.phase() == LessonPhase.ACTIVE) {
            log.debug("'{}' released at {}%, progress kept", lesson.id(), Math.round(lesson.progress() * 100.0f));
        }
    }

    @Override
    public void onTransitionComplete() {
        if (!awaitingTransition) return;
        awaitingTransition = false;
        activateFrom(currentIndex + 1);
    }

    //Per tick: notices transitions that stopped without completing
    public void tick() {
        if (awaitingTransition && (player == null || !player.isRunning())) {
            log.info("Transition ended early, continuing with the next stage");
            awaitingTransition = false;
            activateFrom(currentIndex + 1);
        }
    }

    private void lock() {
        if (locked) return;
        locked = true;
        for (Stage s : stages) s.controller().deactivate();
        log.info("All lessons done, sequencer locked");
        for (SequencerListener l : listeners) l.onLocked();
    }

    public int enabledControllerCount() {
        int n = 0;
        for (Stage s : stages) {
            if (s.controller().isEnabled()) n++;
        }
        return n;
    }

    public int currentIndex() {
        return currentIndex;
    }

    //Null before start()
    public LessonController current() {
        return currentIndex >= 0 ? stages.get(currentIndex).controller() : null;
    }

    public boolean isLocked() {
        return locked;
    }

    public boolean isInTransition() {
        return awaitingTransition;
    }

    public List<Stage> stages() {
        return Collections.unmodifiableList(stages);
    }
}
