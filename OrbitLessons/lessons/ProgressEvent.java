package lessons;

public final class ProgressEvent {
    public static final ProgressEvent NONE = new ProgressEvent(0.0f, 0.0f, 0, 0, false);

    private final float appliedDegrees;
    private final float accumulatedDegrees;
    private final int fromUnit;
    private final int toUnit;
    private final boolean completed;

    ProgressEvent(float appliedDegrees, float accumulatedDegrees, int fromUnit, int toUnit, boolean completed) {
        this.appliedDegrees = appliedDegrees;
        this.accumulatedDegrees = accumulatedDegrees;
        this.fromUnit = fromUnit;
        this.toUnit = toUnit;
        this.completed = completed;
    }

    public boolean isNone() {
        return this == NONE;
    }

    //Signed change actually taken after policy and clamping
    public float appliedDegrees() {
        return appliedDegrees;
    }

    public float accumulatedDegrees() {
        return accumulatedDegrees;
    }

    public int fromUnit() {
        return fromUnit;
    }

    public int toUnit() {
        return toUnit;
    }

    public int unitsAdvanced() {
        return toUnit - fromUnit;
    }

    //True only on the call that reached the cap
    public boolean completed() {
        return completed;
    }

    @Override
    public String toString() {
        return isNone() ? "ProgressEvent[none]"
            : "ProgressEvent[applied=" + appliedDegrees + ", total=" + accumulatedDegrees
                + ", units " + fromUnit + "->" + toUnit + (completed ? ", completed" : "") + "]";
    }
}
