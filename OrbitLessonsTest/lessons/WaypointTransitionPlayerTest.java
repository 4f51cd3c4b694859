package lessons;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.joml.Vector3f;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class WaypointTransitionPlayerTest {
    //10 units apart; at speed 5 and dt 0.5 each leg takes exactly four ticks
    private static final List<Vector3f> PATH = List.of(
        new Vector3f(10, 0, 0), new Vector3f(10, 10, 0), new Vector3f(0, 10, 0));

    private Body ship;
    private WaypointTransitionPlayer player;
    private final List<Integer> reached = new ArrayList<>();
    private int completions;

    @BeforeEach
    void setUp() {
        ship = new Body("Ship", "Ship", 0.0f);
        player = new WaypointTransitionPlayer(ship);
        player.addListener(new TransitionListener() {
            @Override
            public void onWaypointReached(int index) {
                reached.add(index);
            }

            @Override
            public void onTransitionComplete() {
                completions++;
            }
        });
    }

    private void ticks(int n) {
        for (int i = 0; i < n; i++) player.tick(0.5f);
    }

    @Test
    void visitsWaypointsInOrderThenCompletesOnceTest() {
        assertTrue(player.start(PATH, 5.0f, false));
        assertTrue(player.isRunning());

        ticks(3);
        assertEquals(new Vector3f(7.5f, 0, 0), ship.position());
        assertTrue(reached.isEmpty());

        ticks(1);
        assertEquals(List.of(0), reached);
        assertEquals(1, player.currentIndex());

        ticks(8);
        assertEquals(List.of(0, 1, 2), reached);
        assertEquals(1, completions);
        assertFalse(player.isRunning());
        assertNull(player.currentWaypoint());
        assertEquals(new Vector3f(0, 10, 0), ship.position());

        ticks(10);
        assertEquals(1, completions);
        assertEquals(3, reached.size());
    }

    @Test
    void stopHaltsWithoutCompletionTest() {
        player.start(PATH, 5.0f, false);
        ticks(6);
        player.stop();

        assertFalse(player.isRunning());
        assertEquals(new Vector3f(10, 5, 0), ship.position());
        ticks(10);
        assertEquals(List.of(0), reached);
        assertEquals(0, completions);
    }

    @Test
    void loopingWrapsBackToTheFirstWaypointTest() {
        player.start(PATH, 5.0f, true);
        ticks(12);
        assertTrue(player.isRunning());
        assertEquals(0, player.currentIndex());

        //Back from (0,10,0) to (10,0,0) is not a whole number of steps, run well past it
        ticks(40);
        assertTrue(reached.size() > 3);
        assertEquals(List.of(0, 1, 2, 0), reached.subList(0, 4));
        assertEquals(0, completions);
    }

    @Test
    void startIsRefusedWhileRunningOrWithoutPathTest() {
        assertFalse(player.start(Collections.emptyList(), 5.0f, false));
        assertFalse(player.start(PATH, 0.0f, false));
        assertFalse(player.isRunning());

        assertTrue(player.start(PATH, 5.0f, false));
        assertFalse(player.start(List.of(new Vector3f(-5, 0, 0)), 5.0f, false));
        ticks(12);
        assertEquals(new Vector3f(0, 10, 0), ship.position());
    }

    @Test
    void cameraFreeLookIsSuspendedDuringTheRunTest() {
        CameraRig camera = new CameraRig();
        WaypointTransitionPlayer flyer = new WaypointTransitionPlayer(camera).withCamera(camera, true);

        assertTrue(flyer.start(List.of(new Vector3f(0, 0, -10)), 5.0f, false));
        assertFalse(camera.isFreeLookEnabled());
        float yawBefore = camera.yaw();
        camera.freeLook(100, 0);
        assertEquals(yawBefore, camera.yaw());

        for (int i = 0; i < 4; i++) flyer.tick(0.5f);
        assertFalse(flyer.isRunning());
        assertTrue(camera.isFreeLookEnabled());
    }

    @Test
    void stopRestoresFreeLookTest() {
        CameraRig camera = new CameraRig();
        WaypointTransitionPlayer flyer = new WaypointTransitionPlayer(camera).withCamera(camera, false);
        flyer.start(PATH, 5.0f, false);
        flyer.stop();
        assertTrue(camera.isFreeLookEnabled());
    }
}
