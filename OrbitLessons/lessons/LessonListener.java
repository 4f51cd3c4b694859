package lessons;

//Called synchronously on the tick, in registration order
public interface LessonListener {
    default void onGrabStarted(LessonController lesson) {}

    //completed is false when the user let go early; progress is kept either way
    default void onGrabEnded(LessonController lesson, boolean completed) {}

    default void onUnitAdvanced(LessonController lesson, int unit) {}

    default void onLessonCompleted(LessonController lesson) {}

    //Tilt lessons only: entered or left the target band
    default void onTargetRange(LessonController lesson, boolean inRange) {}
}
