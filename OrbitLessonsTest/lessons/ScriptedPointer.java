package lessons;

import org.joml.Vector2f;
import org.joml.Vector2fc;

//Pointer driven by the test; edges last until endTick()
final class ScriptedPointer implements PointerSource {
    private final Vector2f position = new Vector2f();
    private boolean pressed, held, released, secondary;

    ScriptedPointer press(float x, float y) {
        position.set(x, y);
        pressed = true;
        held = true;
        return this;
    }

    ScriptedPointer moveTo(float x, float y) {
        position.set(x, y);
        return this;
    }

    ScriptedPointer moveBy(float dx, float dy) {
        position.add(dx, dy);
        return this;
    }

    ScriptedPointer release() {
        held = false;
        released = true;
        return this;
    }

    ScriptedPointer secondary(boolean down) {
        secondary = down;
        return this;
    }

    void endTick() {
        pressed = false;
        released = false;
    }

    public Vector2fc position() { return position; }
    public boolean pressed() { return pressed; }
    public boolean held() { return held; }
    public boolean released() { return released; }
    public boolean secondaryHeld() { return secondary; }
}
