package lessons;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.joml.Vector3f;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

//Bodies lessons act on, by tag
public class LessonScene {
    private static final Logger log = LoggerFactory.getLogger(LessonScene.class);

    private final Map<String, Body> bodies = new LinkedHashMap<>();
    private final CameraRig camera;

    public LessonScene(CameraRig camera) {
        this.camera = camera;
        if (camera != null) add(camera);
    }

    //Sun, Earth, Moon, the sun as seen from the ground, and the camera
    public static LessonScene standard() {
        LessonScene scene = new LessonScene(new CameraRig());
        scene.add(new Body("Sun", "Sun", 3.0f).at(0.0f, 0.0f, 0.0f));
        scene.add(new Body("Earth", "Earth", 1.0f).at(20.0f, 0.0f, 0.0f));
        scene.add(new Body("Moon", "Moon", 0.3f).at(23.0f, 0.0f, 0.0f));
        //Sun as seen from the ground in the sky lesson
        scene.add(new Body("Sky Sun", "SkySun", 1.5f).at(60.0f, 10.0f, 20.0f));
        scene.camera.placeAt(new Vector3f(20.0f, 8.0f, 15.0f), scene.body("Earth").position());
        return scene;
    }

    //A tag already in use keeps its first body
    public LessonScene add(Body body) {
        Body existing = bodies.putIfAbsent(body.tag(), body);
        if (existing != null && existing != body) {
            log.warn("Tag '{}' already belongs to {}, ignoring {}", body.tag(), existing.name(), body.name());
        }
        return this;
    }

    //Null when no body carries the tag
    public Body body(String tag) {
        return tag == null ? null : bodies.get(tag);
    }

    public Collection<Body> bodies() {
        return Collections.unmodifiableCollection(bodies.values());
    }

    public CameraRig camera() {
        return camera;
    }
}
