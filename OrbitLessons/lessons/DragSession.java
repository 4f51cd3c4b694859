package lessons;

import java.util.Optional;
import org.joml.Vector2f;

//Press, drag, release for one grabbable object. Hit test once per press, one update per held tick.
//Disabling drops a drag in flight without an end callback
public class DragSession {
    private final GrabHandler handler;
    private final Vector2f lastPointer = new Vector2f();
    private final Vector2f delta = new Vector2f();
    private boolean enabled;
    private boolean dragging;
    private Body handle;

    public DragSession(GrabHandler handler) {
        if (handler == null) throw new IllegalArgumentException("handler");
        this.handler = handler;
    }

    public void tick(PointerSource pointer, float dt) {
        if (!enabled) return;

        if (pointer.pressed() && !dragging) {
            Optional<Body> hit = handler.hitTest(pointer.position());
            if (hit.isPresent()) {
                dragging = true;
                handle = hit.get();
                lastPointer.set(pointer.position());
                handler.onGrabStart(handle);
            }
        }

        if (dragging && pointer.held()) {
            delta.set(pointer.position()).sub(lastPointer);
            handler.onGrabUpdate(handle, delta, dt);
            //The update may have completed the lesson and disabled us
            if (!dragging) return;
            lastPointer.set(pointer.position());
        }

        if (dragging && pointer.released()) {
            Body released = handle;
            dragging = false;
            handle = null;
            handler.onGrabEnd(released);
        }
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
        if (!enabled) {
            dragging = false;
            handle = null;
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isDragging() {
        return dragging;
    }

    public Body handle() {
        return handle;
    }
}
