package lessons;

import org.joml.Quaternionf;
import org.joml.Quaternionfc;
import org.joml.Vector3f;
import org.joml.Vector3fc;

//Scene object a lesson drags or orbits around
public class Body implements Pivot {
    private final String name;
    private final String tag;
    private final float size;
    private final Vector3f position = new Vector3f();
    private final Quaternionf rotation = new Quaternionf();

    //(name, tag, size); size is the pick radius, 0 means not pickable
    public Body(String name, String tag, float size) {
        this.name = name;
        this.tag = tag;
        this.size = size;
    }

    Body at(float x, float y, float z) {
        position.set(x, y, z);
        return this;
    }

    public String name() {
        return name;
    }

    public String tag() {
        return tag;
    }

    public float size() {
        return size;
    }

    @Override
    public Vector3fc position() {
        return position;
    }

    @Override
    public Quaternionfc orientation() {
        return rotation;
    }

    public void moveTo(Vector3fc p) {
        position.set(p);
    }

    public void moveTo(float x, float y, float z) {
        position.set(x, y, z);
    }

    public void setOrientation(Quaternionfc q) {
        rotation.set(q);
    }

    //Spin about the body's own axis
    public void rotateLocal(float angleRadians, Vector3fc localAxis) {
        rotation.rotateAxis(angleRadians, localAxis);
    }

    //Turn about a fixed world axis, independent of the current orientation
    public void rotateWorld(float angleRadians, Vector3fc worldAxis) {
        Quaternionf turn = new Quaternionf().rotationAxis(angleRadians, worldAxis);
        turn.mul(rotation, rotation);
    }

    @Override
    public String toString() {
        return name + "[" + tag + "] @ (" + position.x + ", " + position.y + ", " + position.z + ")";
    }
}
