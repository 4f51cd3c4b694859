package lessons;

public interface TransitionListener {
    default void onWaypointReached(int index) {}

    //Never sent for looping runs or runs cut short by stop()
    default void onTransitionComplete() {}
}
