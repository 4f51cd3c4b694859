package lessons;

public enum LessonPhase {
    INACTIVE,
    ACTIVE,
    COMPLETED
}
