package lessons;

import org.joml.Vector2fc;

//Sampled once per tick. Screen pixels, y down. pressed/released are one-tick edges
public interface PointerSource {
    Vector2fc position();

    boolean pressed();

    boolean held();

    boolean released();

    //Camera look button
    default boolean secondaryHeld() {
        return false;
    }
}
