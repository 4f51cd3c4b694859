package lessons;

//How a tracker treats the sign of each drag step
public enum ForwardPolicy {
    //Both directions count, clamped to [0, cap]
    BIDIRECTIONAL,
    //Backward steps count as zero, forward steps are capped at the remaining budget
    FORWARD_ONLY,
    //Distance dragged either way counts forward (spinning a body back and forth still spins it)
    MAGNITUDE
}
