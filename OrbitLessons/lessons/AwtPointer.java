package lessons;

import java.awt.event.MouseAdapter;
import java.awt.event.MouseEvent;
import javax.swing.SwingUtilities;
import org.joml.Vector2f;
import org.joml.Vector2fc;

//Mouse events from the window thread, one snapshot per frame. Press/release edges are latched
public class AwtPointer extends MouseAdapter {
    private float x, y;
    private boolean held, pressedEdge, releasedEdge;
    private boolean secondary;

    @Override
    public synchronized void mousePressed(MouseEvent e) {
        x = e.getX();
        y = e.getY();
        if (SwingUtilities.isLeftMouseButton(e)) {
            held = true;
            pressedEdge = true;
        } else if (SwingUtilities.isRightMouseButton(e)) {
            secondary = true;
        }
    }

    @Override
    public synchronized void mouseReleased(MouseEvent e) {
        x = e.getX();
        y = e.getY();
        if (SwingUtilities.isLeftMouseButton(e)) {
            held = false;
            releasedEdge = true;
        } else if (SwingUtilities.isRightMouseButton(e)) {
            secondary = false;
        }
    }

    @Override
    public synchronized void mouseDragged(MouseEvent e) {
        x = e.getX();
        y = e.getY();
    }

    @Override
    public synchronized void mouseMoved(MouseEvent e) {
        x = e.getX();
        y = e.getY();
    }

    //Takes this frame's state and clears the edges
    public synchronized PointerSource sample() {
        //A press and release inside one frame still reads as held for that frame
        Sample s = new Sample(x, y, pressedEdge, held || (pressedEdge && releasedEdge), releasedEdge, secondary);
        pressedEdge = false;
        releasedEdge = false;
        return s;
    }

    private static final class Sample implements PointerSource {
        private final Vector2f position;
        private final boolean pressed, held, released, secondary;

        Sample(float x, float y, boolean pressed, boolean held, boolean released, boolean secondary) {
            this.position = new Vector2f(x, y);
            this.pressed = pressed;
            this.held = held;
            this.released = released;
            this.secondary = secondary;
        }

        public Vector2fc position() { return position; }
        public boolean pressed() { return pressed; }
        public boolean held() { return held; }
        public boolean released() { return released; }
        public boolean secondaryHeld() { return secondary; }
    }
}
