package lessons;

//Motion law a lesson applies to its body
public enum MotionKind {
    AXIS_SPIN(true, false, ForwardPolicy.MAGNITUDE),
    RADIAL_ORBIT(true, true, ForwardPolicy.FORWARD_ONLY),
    SPHERICAL_ORBIT(true, true, ForwardPolicy.FORWARD_ONLY),
    TILT_TO_TARGET(true, false, ForwardPolicy.BIDIRECTIONAL),
    //Runs by itself on the clock, no dragging
    AUTO_ORBIT(false, true, ForwardPolicy.FORWARD_ONLY);

    private final boolean interactive;
    private final boolean needsPivot;
    private final ForwardPolicy defaultPolicy;

    MotionKind(boolean interactive, boolean needsPivot, ForwardPolicy defaultPolicy) {
        this.interactive = interactive;
        this.needsPivot = needsPivot;
        this.defaultPolicy = defaultPolicy;
    }

    public boolean interactive() {
        return interactive;
    }

    public boolean needsPivot() {
        return needsPivot;
    }

    public ForwardPolicy defaultPolicy() {
        return defaultPolicy;
    }
}
