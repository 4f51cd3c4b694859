package lessons;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import org.joml.Vector3f;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

//Lesson flow and tunables read from lessons.properties:
//  stages = spin, sun-arc, ...
//  lesson.<id>.kind = AXIS_SPIN | RADIAL_ORBIT | SPHERICAL_ORBIT | TILT_TO_TARGET | AUTO_ORBIT
//  lesson.<id>.<field> = value (see LessonSettings.apply)
//  stage.<id>.transition = x,y,z; x,y,z; ...
//  stage.<id>.transitionSpeed = 5
//  stage.<id>.camera = x,y,z > x,y,z (position > look target)
//  stage.<id>.cameraGlide = seconds, 0 jumps
//  camera.lookSpeed, camera.lookSensitivity, camera.pitchClamp
//Values that do not parse or are out of range are logged and left at their defaults.
public class SimulationConfig {
    private static final Logger log = LoggerFactory.getLogger(SimulationConfig.class);

    static final String RESOURCE = "/lessons/lessons.properties";
    private static final String LESSON_PREFIX = "lesson.";
    private static final String STAGE_PREFIX = "stage.";

    private final List<String> stageIds = new ArrayList<>();
    private final Map<String, LessonSettings> lessons = new LinkedHashMap<>();
    private final Map<String, List<Vector3f>> transitions = new HashMap<>();
    private final Map<String, Float> transitionSpeeds = new HashMap<>();
    private final Map<String, Vector3f[]> cameraPoses = new HashMap<>();
    private final Map<String, Float> cameraGlides = new HashMap<>();

    private float lookSpeed = 6.0f;
    private float lookSensitivity = 0.2f;
    private float pitchClamp = 80.0f;
    private int rejected;

    private SimulationConfig() {}

    //Bundled defaults
    public static SimulationConfig load() {
        return from(readDefaults());
    }

    //Bundled defaults overridden by the keys in file
    public static SimulationConfig load(Path file) throws IOException {
        Properties props = new Properties(readDefaults());
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            props.load(in);
        }
        log.info("Loaded lesson configuration from {}", file);
        return from(props);
    }

    private static Properties readDefaults() {
        Properties props = new Properties();
        try (InputStream in = SimulationConfig.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                log.warn("{} not found on the classpath, no lessons configured", RESOURCE);
                return props;
            }
            props.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, e);
        }
        return props;
    }

    public static SimulationConfig from(Properties props) {
        SimulationConfig config = new SimulationConfig();
        config.read(props);
        return config;
    }

    private void read(Properties props) {
        lookSpeed = positive(props, "camera.lookSpeed", lookSpeed);
        lookSensitivity = positive(props, "camera.lookSensitivity", lookSensitivity);
        pitchClamp = positive(props, "camera.pitchClamp", pitchClamp);
        if (pitchClamp > 89.0f) {
            reject("camera.pitchClamp", String.valueOf(pitchClamp));
            pitchClamp = 80.0f;
        }

        String order = props.getProperty("stages", "");
        for (String raw : order.split(",")) {
            String id = raw.trim();
            if (id.isEmpty()) continue;
            if (stageIds.contains(id)) {
                reject("stages", id + " (listed twice)");
                continue;
            }
            LessonSettings settings = readLesson(props, id);
            if (settings == null) continue;
            lessons.put(id, settings);
            stageIds.add(id);
            readStage(props, id);
        }
    }

    private LessonSettings readLesson(Properties props, String id) {
        String prefix = LESSON_PREFIX + id + ".";
        String kindName = props.getProperty(prefix + "kind");
        if (kindName == null) {
            reject(prefix + "kind", "<missing>");
            return null;
        }
        MotionKind kind;
        try {
            kind = MotionKind.valueOf(kindName.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            reject(prefix + "kind", kindName);
            return null;
        }

        LessonSettings settings = LessonSettings.of(id, kind);
        for (String key : props.stringPropertyNames()) {
            if (!key.startsWith(prefix)) continue;
            String field = key.substring(prefix.length());
            if (field.equals("kind")) continue;
            String value = props.getProperty(key);
            if (!settings.apply(field, value)) reject(key, value);
        }
        return settings;
    }

    private void readStage(Properties props, String id) {
        String prefix = STAGE_PREFIX + id + ".";

        String path = props.getProperty(prefix + "transition");
        if (path != null) {
            List<Vector3f> points = parseWaypoints(path);
            if (points == null || points.isEmpty()) {
                reject(prefix + "transition", path);
            } else {
                transitions.put(id, points);
            }
        }
        float speed = positive(props, prefix + "transitionSpeed", 5.0f);
        transitionSpeeds.put(id, speed);

        String pose = props.getProperty(prefix + "camera");
        if (pose != null) {
            String[] parts = pose.split(">");
            Vector3f position = parts.length == 2 ? parseVector(parts[0]) : null;
            Vector3f target = parts.length == 2 ? parseVector(parts[1]) : null;
            if (position == null || target == null) {
                reject(prefix + "camera", pose);
            } else {
                cameraPoses.put(id, new Vector3f[] { position, target });
            }
        }
        cameraGlides.put(id, nonNegative(props, prefix + "cameraGlide", 0.0f));
    }

    private float positive(Properties props, String key, float fallback) {
        String value = props.getProperty(key);
        if (value == null) return fallback;
        try {
            float f = Float.parseFloat(value.trim());
            if (f > 0.0f && Float.isFinite(f)) return f;
        } catch (NumberFormatException e) {
            //Falls through to the rejection below
        }
        reject(key, value);
        return fallback;
    }

    private float nonNegative(Properties props, String key, float fallback) {
        String value = props.getProperty(key);
        if (value == null) return fallback;
        try {
            float f = Float.parseFloat(value.trim());
            if (f >= 0.0f && Float.isFinite(f)) return f;
        } catch (NumberFormatException e) {
            //Falls through to the rejection below
        }
        reject(key, value);
        return fallback;
    }

    private void reject(String key, String value) {
        rejected++;
        log.warn("Ignoring configuration value {} = {}", key, value);
    }

    //"x,y,z" or null when it is not three finite numbers
    public static Vector3f parseVector(String text) {
        if (text == null) return null;
        String[] parts = text.trim().split("\\s*,\\s*");
        if (parts.length != 3) return null;
        try {
            float x = Float.parseFloat(parts[0]);
            float y = Float.parseFloat(parts[1]);
            float z = Float.parseFloat(parts[2]);
            if (!Float.isFinite(x) || !Float.isFinite(y) || !Float.isFinite(z)) return null;
            return new Vector3f(x, y, z);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    //"x,y,z; x,y,z; ..." or null when any point is malformed
    public static List<Vector3f> parseWaypoints(String text) {
        List<Vector3f> points = new ArrayList<>();
        for (String part : text.split(";")) {
            if (part.trim().isEmpty()) continue;
            Vector3f p = parseVector(part);
            if (p == null) return null;
            points.add(p);
        }
        return points;
    }

    public List<String> stageIds() {
        return Collections.unmodifiableList(stageIds);
    }

    //Null for ids that are not stages
    public LessonSettings lesson(String id) {
        return lessons.get(id);
    }

    //Empty when the stage has no transition
    public List<Vector3f> transition(String id) {
        List<Vector3f> points = transitions.get(id);
        return points == null ? Collections.emptyList() : Collections.unmodifiableList(points);
    }

    public float transitionSpeed(String id) {
        return transitionSpeeds.getOrDefault(id, 5.0f);
    }

    //{position, target} or null
    public Vector3f[] cameraPose(String id) {
        return cameraPoses.get(id);
    }

    //Seconds the camera takes to reach the stage pose
    public float cameraGlide(String id) {
        return cameraGlides.getOrDefault(id, 0.0f);
    }

    public float lookSpeed() {
        return lookSpeed;
    }

    public float lookSensitivity() {
        return lookSensitivity;
    }

    public float pitchClamp() {
        return pitchClamp;
    }

    //Values dropped while reading
    public int rejectedCount() {
        return rejected;
    }
}
