package lessons;

import java.lang.Math;
import java.util.ArrayList;
import java.util.List;

//Pointer motion in, bounded angular progress out. accumulatedDegrees stays in [0, cap].
//Each crossed unit is announced once and in order; reaching the cap snaps the pose and completes once.
//After completion every call is a no-op until reinitialize().
public class ProgressTracker {

    public interface Listener {
        default void onUnitAdvanced(int unit) {}

        default void onCompleted(float accumulatedDegrees) {}
    }

    //Places the driven body at the exact pose for the given total
    @FunctionalInterface
    public interface TerminalPose {
        void snapTo(float terminalDegrees);
    }

    private final float cap;
    private final float unitSize;
    private final int unitCount;
    private final ForwardPolicy policy;
    private final float maxStepDegrees;
    private final List<Listener> listeners = new ArrayList<>();
    private TerminalPose terminalPose;

    private float accumulatedDegrees;
    private int lastUnit;
    private boolean completed;

    public ProgressTracker(float cap, float unitSize, ForwardPolicy policy) {
        this(cap, unitSize, policy, 0.0f);
    }

    //maxStepDegrees > 0 limits how much a single step may move (in either direction)
    public ProgressTracker(float cap, float unitSize, ForwardPolicy policy, float maxStepDegrees) {
        if (!(cap > 0.0f)) throw new IllegalArgumentException("cap must be positive: " + cap);
        if (!(unitSize > 0.0f)) throw new IllegalArgumentException("unitSize must be positive: " + unitSize);
        if (policy == null) throw new IllegalArgumentException("policy");
        this.cap = cap;
        this.unitSize = unitSize;
        //Tolerance so 360 / (360 / 365f) still counts 365 units
        this.unitCount = (int)Math.floor(cap / unitSize + 1.0e-3f);
        this.policy = policy;
        this.maxStepDegrees = Math.max(0.0f, maxStepDegrees);
    }

    public void addListener(Listener l) {
        if (l != null && !listeners.contains(l)) listeners.add(l);
    }

    public void setTerminalPose(TerminalPose terminalPose) {
        this.terminalPose = terminalPose;
    }

    public ProgressEvent applyDelta(float rawPointerDeltaX, float sensitivity) {
        return applyDegrees(rawPointerDeltaX * sensitivity);
    }

    public ProgressEvent applyDegrees(float angleDelta) {
        if (completed || Float.isNaN(angleDelta) || Float.isInfinite(angleDelta)) {
            return ProgressEvent.NONE;
        }

        float remaining = cap - accumulatedDegrees;
        switch (policy) {
            case FORWARD_ONLY:
                angleDelta = Math.min(Math.max(angleDelta, 0.0f), remaining);
                break;
            case MAGNITUDE:
                angleDelta = Math.min(Math.abs(angleDelta), remaining);
                break;
            case BIDIRECTIONAL:
            default:
                break;
        }
        if (maxStepDegrees > 0.0f) {
            angleDelta = OrbitalMotion.clamp(angleDelta, -maxStepDegrees, maxStepDegrees);
        }

        float before = accumulatedDegrees;
        accumulatedDegrees = OrbitalMotion.clamp(accumulatedDegrees + angleDelta, 0.0f, cap);
        float applied = accumulatedDegrees - before;

        int fromUnit = lastUnit;
        boolean reachedCap = accumulatedDegrees >= cap;
        int newUnit = reachedCap ? unitCount : Math.min(unitCount, (int)Math.floor(accumulatedDegrees / unitSize));

        //One event per crossed unit; units never count back down
        while (lastUnit < newUnit) {
            lastUnit++;
            for (Listener l : listeners) l.onUnitAdvanced(lastUnit);
        }

        if (reachedCap) {
            accumulatedDegrees = cap;
            completed = true;
            if (terminalPose != null) terminalPose.snapTo(cap);
            for (Listener l : listeners) l.onCompleted(cap);
            return new ProgressEvent(applied, cap, fromUnit, lastUnit, true);
        }

        if (applied == 0.0f && fromUnit == lastUnit) {
            return ProgressEvent.NONE;
        }
        return new ProgressEvent(applied, accumulatedDegrees, fromUnit, lastUnit, false);
    }

    //Back to zero progress; the only way to clear completion
    public void reinitialize() {
        accumulatedDegrees = 0.0f;
        lastUnit = 0;
        completed = false;
    }

    public float accumulatedDegrees() {
        return accumulatedDegrees;
    }

    public float fraction() {
        return accumulatedDegrees / cap;
    }

    public boolean isCompleted() {
        return completed;
    }

    public int currentUnit() {
        return lastUnit;
    }

    public int unitCount() {
        return unitCount;
    }

    public float cap() {
        return cap;
    }
}
