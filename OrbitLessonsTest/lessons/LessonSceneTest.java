package lessons;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

public class LessonSceneTest {

    @Test
    void duplicateTagKeepsTheFirstBodyTest() {
        LessonScene scene = LessonScene.standard();
        Body earth = scene.body("Earth");
        int count = scene.bodies().size();

        scene.add(new Body("Second Earth", "Earth", 2.0f));
        assertSame(earth, scene.body("Earth"));
        assertEquals(count, scene.bodies().size());
    }

    @Test
    void addingTheSameBodyTwiceIsHarmlessTest() {
        LessonScene scene = new LessonScene(new CameraRig());
        Body ball = new Body("Ball", "Ball", 1.0f);
        scene.add(ball).add(ball);
        assertSame(ball, scene.body("Ball"));
        assertEquals(2, scene.bodies().size());
    }
}
