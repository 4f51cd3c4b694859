package lessons;

import java.lang.Math;
import java.util.Optional;
import org.joml.Intersectionf;
import org.joml.Matrix4f;
import org.joml.Vector2f;
import org.joml.Vector2fc;
import org.joml.Vector3f;

//Ray through the pixel against each body sphere, nearest hit wins
public class RaySpherePicker implements PickProvider {
    private final LessonScene scene;
    private final CameraRig camera;
    private final Matrix4f pMat = new Matrix4f();
    private final Matrix4f vMat = new Matrix4f();
    private final Matrix4f pvMat = new Matrix4f();
    private final int[] viewport = new int[4];

    private final Vector3f origin = new Vector3f();
    private final Vector3f dir = new Vector3f();
    private final Vector2f hit = new Vector2f();

    public RaySpherePicker(LessonScene scene, int width, int height) {
        this.scene = scene;
        this.camera = scene.camera();
        resize(width, height);
    }

    public void resize(int width, int height) {
        int w = Math.max(1, width);
        int h = Math.max(1, height);
        viewport[2] = w;
        viewport[3] = h;
        pMat.identity().setPerspective((float)Math.toRadians(60.0f), (float)w / (float)h, 0.1f, 5000.0f);
    }

    @Override
    public Optional<Pick> testPick(Vector2fc pointer) {
        if (camera == null) return Optional.empty();
        camera.viewMatrix(vMat);
        pMat.mul(vMat, pvMat);
        //Window y grows upward
        pvMat.unprojectRay(pointer.x(), viewport[3] - pointer.y(), viewport, origin, dir);
        dir.normalize();

        Body nearest = null;
        float nearestT = Float.POSITIVE_INFINITY;
        for (Body b : scene.bodies()) {
            if (b.size() <= 0.0f) continue;
            if (!Intersectionf.intersectRaySphere(origin, dir, b.position(), b.size() * b.size(), hit)) continue;
            //Near root is negative when the ray starts inside the sphere
            float t = hit.x >= 0.0f ? hit.x : hit.y;
            if (t >= 0.0f && t < nearestT) {
                nearestT = t;
                nearest = b;
            }
        }
        if (nearest == null) return Optional.empty();
        return Optional.of(new Pick(nearest, nearest.tag(), nearestT));
    }

    public int width() {
        return viewport[2];
    }

    public int height() {
        return viewport[3];
    }
}
