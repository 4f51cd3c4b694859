package lessons;

public interface SequencerListener {
    default void onPhaseEntered(int index, LessonController lesson) {}

    default void onLessonCompleted(int index, LessonController lesson) {}

    default void onTransitionStarted(int fromIndex) {}

    //Final lesson done; everything is frozen from here on
    default void onLocked() {}
}
