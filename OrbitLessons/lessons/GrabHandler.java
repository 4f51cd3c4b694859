package lessons;

import java.util.Optional;
import org.joml.Vector2fc;

public interface GrabHandler {
    Optional<Body> hitTest(Vector2fc pointer);

    void onGrabStart(Body handle);

    //pointerDelta is the screen motion since the previous tick of this drag
    void onGrabUpdate(Body handle, Vector2fc pointerDelta, float dt);

    void onGrabEnd(Body handle);
}
