package lessons;

import org.joml.Quaternionfc;
import org.joml.Vector3fc;

//Center of a lesson's rotation or orbit. Lessons read it, they never move it.
public interface Pivot {
    Vector3fc position();

    Quaternionfc orientation();
}
