package lessons;

import java.util.Optional;
import org.joml.Vector2fc;

public interface PickProvider {
    Optional<Pick> testPick(Vector2fc pointerScreenPosition);
}
