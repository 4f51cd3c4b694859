package lessons;

import java.util.Locale;
import org.joml.Vector3f;

//Tunables for one lesson, fluent with... or from properties
public class LessonSettings {
    final String id;
    final MotionKind kind;

    String bodyTag;
    String pivotTag;
    String unitLabel = "Step";

    //Degrees of progress per pixel dragged; the sign picks the drag direction
    float sensitivity = 0.2f;
    float verticalSensitivity = 0.2f;
    float cap = 360.0f;
    float unitSize = 360.0f;
    //When set, the cap is split into this many units and unitSize is ignored
    int unitCount = 0;
    ForwardPolicy policy;
    float maxStepDegrees = 0.0f;

    //Orbits
    float minRadius = 0.5f;
    float defaultRadius = 5.0f;
    boolean preserveHeight = true;
    float angularSpeed = 30.0f;

    //Sky arc
    float minElevation = 10.0f;
    float maxElevation = 80.0f;

    //Tilt
    float targetTilt = 20.0f;
    float tiltMargin = 2.0f;
    float holdSeconds = 3.0f;
    final Vector3f tiltAxis = new Vector3f(1.0f, 0.0f, 0.0f);
    boolean mirrored = true;
    float minAnglePerTick = 0.001f;

    LessonSettings(String id, MotionKind kind) {
        this.id = id;
        this.kind = kind;
        this.policy = kind.defaultPolicy();
    }

    public static LessonSettings of(String id, MotionKind kind) {
        return new LessonSettings(id, kind);
    }

    public LessonSettings withBody(String tag) {
        this.bodyTag = tag;
        return this;
    }

    public LessonSettings withPivot(String tag) {
        this.pivotTag = tag;
        return this;
    }

    public LessonSettings withSensitivity(float degreesPerPixel) {
        this.sensitivity = degreesPerPixel;
        return this;
    }

    public LessonSettings withVerticalSensitivity(float degreesPerPixel) {
        this.verticalSensitivity = degreesPerPixel;
        return this;
    }

    //(cap, unitSize)
    public LessonSettings withProgress(float cap, float unitSize) {
        this.cap = cap;
        this.unitSize = unitSize;
        this.unitCount = 0;
        return this;
    }

    public LessonSettings withUnits(int count, String label) {
        this.unitCount = count;
        this.unitLabel = label;
        return this;
    }

    public LessonSettings withPolicy(ForwardPolicy policy, float maxStepDegrees) {
        this.policy = policy;
        this.maxStepDegrees = maxStepDegrees;
        return this;
    }

    //(minRadius, defaultRadius)
    public LessonSettings withRadius(float minRadius, float defaultRadius) {
        this.minRadius = minRadius;
        this.defaultRadius = defaultRadius;
        return this;
    }

    public LessonSettings withAngularSpeed(float degreesPerSecond) {
        this.angularSpeed = degreesPerSecond;
        return this;
    }

    public LessonSettings withElevationRange(float minDegrees, float maxDegrees) {
        this.minElevation = minDegrees;
        this.maxElevation = maxDegrees;
        return this;
    }

    //(targetTilt, margin, holdSeconds)
    public LessonSettings withTiltTarget(float targetDegrees, float marginDegrees, float holdSeconds) {
        this.targetTilt = targetDegrees;
        this.tiltMargin = marginDegrees;
        this.holdSeconds = holdSeconds;
        return this;
    }

    public LessonSettings withTiltAxis(float x, float y, float z) {
        this.tiltAxis.set(x, y, z);
        return this;
    }

    public LessonSettings withMirroredTarget(boolean mirrored) {
        this.mirrored = mirrored;
        return this;
    }

    //lesson.<id>.<field> = value; false for unknown fields or out of range values
    public boolean apply(String field, String value) {
        String v = value.trim();
        try {
            switch (field) {
                case "body":
                    if (v.isEmpty()) return false;
                    bodyTag = v;
                    return true;
                case "pivot":
                    if (v.isEmpty()) return false;
                    pivotTag = v;
                    return true;
                case "unitLabel": unitLabel = v; return true;
                case "sensitivity": return finite(v, f -> sensitivity = f);
                case "verticalSensitivity": return finite(v, f -> verticalSensitivity = f);
                case "cap": return positive(v, f -> cap = f);
                case "unitSize": return positive(v, f -> unitSize = f);
                case "units": {
                    int count = Integer.parseInt(v);
                    if (count <= 0) return false;
                    unitCount = count;
                    return true;
                }
                case "policy": policy = ForwardPolicy.valueOf(v.toUpperCase(Locale.ROOT)); return true;
                case "maxStep": return nonNegative(v, f -> maxStepDegrees = f);
                case "minRadius": return nonNegative(v, f -> minRadius = f);
                case "defaultRadius": return positive(v, f -> defaultRadius = f);
                case "preserveHeight": preserveHeight = Boolean.parseBoolean(v); return true;
                case "angularSpeed": return positive(v, f -> angularSpeed = f);
                case "minElevation": return inRange(v, -90.0f, 90.0f, f -> minElevation = f);
                case "maxElevation": return inRange(v, -90.0f, 90.0f, f -> maxElevation = f);
                case "targetTilt": return inRange(v, -180.0f, 180.0f, f -> targetTilt = f);
                case "tiltMargin": return nonNegative(v, f -> tiltMargin = f);
                case "holdSeconds": return nonNegative(v, f -> holdSeconds = f);
                case "minAnglePerTick": return nonNegative(v, f -> minAnglePerTick = f);
                case "mirrored": mirrored = Boolean.parseBoolean(v); return true;
                case "tiltAxis": {
                    Vector3f axis = SimulationConfig.parseVector(v);
                    if (axis == null || axis.lengthSquared() <= OrbitalMotion.DEGENERATE_LENGTH_SQ) return false;
                    tiltAxis.set(axis).normalize();
                    return true;
                }
                default:
                    return false;
            }
        } catch (IllegalArgumentException e) {
            //NumberFormatException and bad enum names
            return false;
        }
    }

    private interface FloatSetter {
        void set(float f);
    }

    private static boolean finite(String v, FloatSetter setter) {
        float f = Float.parseFloat(v);
        if (Float.isNaN(f) || Float.isInfinite(f)) return false;
        setter.set(f);
        return true;
    }

    private static boolean positive(String v, FloatSetter setter) {
        return inRange(v, Float.MIN_VALUE, Float.MAX_VALUE, setter);
    }

    private static boolean nonNegative(String v, FloatSetter setter) {
        return inRange(v, 0.0f, Float.MAX_VALUE, setter);
    }

    private static boolean inRange(String v, float lo, float hi, FloatSetter setter) {
        float f = Float.parseFloat(v);
        if (!(f >= lo && f <= hi)) return false;
        setter.set(f);
        return true;
    }

    float effectiveUnitSize() {
        return unitCount > 0 ? cap / unitCount : unitSize;
    }

    public String id() {
        return id;
    }

    public MotionKind kind() {
        return kind;
    }

    public String bodyTag() {
        return bodyTag;
    }

    public String pivotTag() {
        return pivotTag;
    }

    public String unitLabel() {
        return unitLabel;
    }
}
