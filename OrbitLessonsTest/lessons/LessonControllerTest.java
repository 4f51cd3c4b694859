package lessons;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.joml.Vector3f;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LessonControllerTest {
    private static final float EPS = 1.0e-4f;

    private final ScriptedPointer pointer = new ScriptedPointer();
    private final Body sun = new Body("Sun", "Sun", 3.0f);

    private static final class Recorder implements LessonListener {
        final List<Integer> units = new ArrayList<>();
        final List<Boolean> ranges = new ArrayList<>();
        int grabsStarted, grabsEnded, completions;

        @Override
        public void onGrabStarted(LessonController lesson) {
            grabsStarted++;
        }

        @Override
        public void onGrabEnded(LessonController lesson, boolean completed) {
            grabsEnded++;
        }

        @Override
        public void onUnitAdvanced(LessonController lesson, int unit) {
            units.add(unit);
        }

        @Override
        public void onLessonCompleted(LessonController lesson) {
            completions++;
        }

        @Override
        public void onTargetRange(LessonController lesson, boolean inRange) {
            ranges.add(inRange);
        }
    }

    private static PickProvider alwaysHits(Body body) {
        return p -> Optional.of(new Pick(body, body.tag(), 1.0f));
    }

    private LessonController controller(LessonSettings settings, Body body, Pivot pivot, Recorder rec) {
        LessonController c = new LessonController(settings, body, pivot, body == null ? null : alwaysHits(body));
        c.addListener(rec);
        c.activate();
        return c;
    }

    private void tick(LessonController c, float dt) {
        c.tick(pointer, dt);
        pointer.endTick();
    }

    //Press, one move of dx, release
    private void drag(LessonController c, float dx, float dy) {
        pointer.press(0, 0);
        tick(c, 0.1f);
        pointer.moveBy(dx, dy);
        tick(c, 0.1f);
        pointer.release();
        tick(c, 0.1f);
    }

    @Test
    void radialProgressSurvivesReleaseTest() {
        Body earth = new Body("Earth", "Earth", 1.0f).at(10, 0, 0);
        Recorder rec = new Recorder();
        LessonController c = controller(LessonSettings.of("orbit", MotionKind.RADIAL_ORBIT)
            .withSensitivity(1.0f).withProgress(360.0f, 90.0f), earth, sun, rec);

        drag(c, 10, 0);
        assertEquals(10.0f, c.accumulatedDegrees());
        assertEquals(LessonPhase.ACTIVE, c.phase());
        assertTrue(c.isEnabled());
        assertEquals(10.0f * (float)Math.cos(Math.toRadians(10)), earth.position().x(), EPS);
        assertEquals(10.0f * (float)Math.sin(Math.toRadians(10)), earth.position().z(), EPS);

        //Grabbing again continues from where it was let go
        drag(c, 5, 0);
        assertEquals(15.0f, c.accumulatedDegrees());

        //Dragging backwards is ignored
        drag(c, -20, 0);
        assertEquals(15.0f, c.accumulatedDegrees());
        assertEquals(3, rec.grabsEnded);
        assertEquals(0, rec.completions);
    }

    @Test
    void radialCompletionSnapsBackToStartTest() {
        Body earth = new Body("Earth", "Earth", 1.0f).at(10, 0, 0);
        Recorder rec = new Recorder();
        LessonController c = controller(LessonSettings.of("orbit", MotionKind.RADIAL_ORBIT)
            .withSensitivity(1.0f).withProgress(360.0f, 90.0f), earth, sun, rec);

        drag(c, 100, 0);
        drag(c, 400, 0);

        assertEquals(360.0f, c.accumulatedDegrees());
        assertEquals(LessonPhase.COMPLETED, c.phase());
        assertFalse(c.isEnabled());
        assertFalse(c.session().isDragging());
        assertEquals(List.of(1, 2, 3, 4), rec.units);
        assertEquals(1, rec.completions);
        //The completing drag was dropped, not released
        assertEquals(1, rec.grabsEnded);
        assertEquals(10.0f, earth.position().x(), EPS);
        assertEquals(0.0f, earth.position().z(), EPS);

        assertFalse(c.activate());
        drag(c, 50, 0);
        assertEquals(1, rec.completions);
    }

    @Test
    void radialOrbitKeepsBodyHeightTest() {
        Body earth = new Body("Earth", "Earth", 1.0f).at(10, 2, 0);
        LessonController c = controller(LessonSettings.of("orbit", MotionKind.RADIAL_ORBIT)
            .withSensitivity(1.0f), earth, sun, new Recorder());
        drag(c, 90, 0);
        assertEquals(2.0f, earth.position().y(), EPS);
        assertEquals(10.0f, earth.position().z(), EPS);

        Body flat = new Body("Moon", "Moon", 1.0f).at(10, 2, 0);
        LessonSettings settings = LessonSettings.of("flat", MotionKind.RADIAL_ORBIT).withSensitivity(1.0f);
        assertTrue(settings.apply("preserveHeight", "false"));
        LessonController f = controller(settings, flat, sun, new Recorder());
        drag(f, 90, 0);
        assertEquals(0.0f, flat.position().y(), EPS);
    }

    @Test
    void spinTurnsAboutLocalUpAndCompletesAfterFullTurnTest() {
        Body earth = new Body("Earth", "Earth", 1.0f);
        Recorder rec = new Recorder();
        LessonController c = controller(LessonSettings.of("spin", MotionKind.AXIS_SPIN)
            .withSensitivity(1.0f).withUnits(24, "Hour"), earth, null, rec);

        drag(c, 90, 0);
        Vector3f x = earth.orientation().transform(new Vector3f(1, 0, 0));
        assertEquals(0.0f, x.x, EPS);
        assertEquals(-1.0f, x.z, EPS);
        assertEquals(6, c.currentUnit());

        drag(c, 90, 0);
        drag(c, 90, 0);
        drag(c, 90, 0);
        assertEquals(LessonPhase.COMPLETED, c.phase());
        assertEquals(24, rec.units.size());
        x = earth.orientation().transform(new Vector3f(1, 0, 0));
        assertEquals(1.0f, x.x, EPS);
        assertEquals(0.0f, x.z, EPS);
    }

    @Test
    void spinCountsDragInEitherDirectionTest() {
        Body earth = new Body("Earth", "Earth", 1.0f);
        LessonController c = controller(LessonSettings.of("spin", MotionKind.AXIS_SPIN)
            .withSensitivity(1.0f), earth, null, new Recorder());

        drag(c, -90, 0);
        assertEquals(90.0f, c.accumulatedDegrees());
        Vector3f x = earth.orientation().transform(new Vector3f(1, 0, 0));
        assertEquals(1.0f, x.z, EPS);
    }

    private LessonController tiltLesson(Body earth, Recorder rec, boolean mirrored) {
        return controller(LessonSettings.of("tilt", MotionKind.TILT_TO_TARGET)
            .withSensitivity(1.0f).withTiltTarget(20.0f, 2.0f, 3.0f).withMirroredTarget(mirrored), earth, null, rec);
    }

    @Test
    void tiltCompletesAfterHoldingInRangeTest() {
        Body earth = new Body("Earth", "Earth", 1.0f);
        Recorder rec = new Recorder();
        LessonController c = tiltLesson(earth, rec, true);

        pointer.press(0, 0);
        tick(c, 0.5f);
        pointer.moveTo(20, 0);
        tick(c, 0.5f);
        assertTrue(c.isInTargetRange());
        assertEquals(0.0f, c.holdTimer());

        for (int i = 0; i < 4; i++) tick(c, 0.5f);
        assertEquals(2.0f, c.holdTimer());

        //Leaving the band resets the clock
        pointer.moveTo(25, 0);
        tick(c, 0.5f);
        assertFalse(c.isInTargetRange());
        assertEquals(0.0f, c.holdTimer());

        pointer.moveTo(20, 0);
        tick(c, 0.5f);
        for (int i = 0; i < 5; i++) tick(c, 0.5f);
        assertEquals(2.5f, c.holdTimer());
        assertEquals(LessonPhase.ACTIVE, c.phase());

        tick(c, 0.5f);
        assertEquals(LessonPhase.COMPLETED, c.phase());
        assertEquals(1.0f, c.progress());
        assertEquals(1, rec.completions);
        assertEquals(List.of(true, false, true), rec.ranges);
        assertEquals(20.0f, c.netTilt(), EPS);
    }

    @Test
    void tiltReleaseResetsHoldButKeepsTiltTest() {
        Body earth = new Body("Earth", "Earth", 1.0f);
        Recorder rec = new Recorder();
        LessonController c = tiltLesson(earth, rec, true);

        pointer.press(0, 0);
        tick(c, 0.5f);
        pointer.moveTo(20, 0);
        tick(c, 0.5f);
        tick(c, 0.5f);
        tick(c, 0.5f);
        pointer.release();
        tick(c, 0.5f);

        assertEquals(0.0f, c.holdTimer());
        assertFalse(c.isInTargetRange());
        assertEquals(20.0f, c.netTilt(), EPS);

        //Grabbing again starts the clock over from zero
        pointer.press(20, 0);
        tick(c, 0.5f);
        assertTrue(c.isInTargetRange());
        for (int i = 0; i < 5; i++) tick(c, 0.5f);
        assertEquals(LessonPhase.ACTIVE, c.phase());
        tick(c, 0.5f);
        assertEquals(LessonPhase.COMPLETED, c.phase());
    }

    @Test
    void tiltAcceptsMirroredTargetOnlyWhenAllowedTest() {
        LessonController mirrored = tiltLesson(new Body("Earth", "Earth", 1.0f), new Recorder(), true);
        pointer.press(0, 0);
        tick(mirrored, 0.5f);
        pointer.moveTo(-20, 0);
        tick(mirrored, 0.5f);
        assertTrue(mirrored.isInTargetRange());
        pointer.release();
        tick(mirrored, 0.5f);

        LessonController strict = tiltLesson(new Body("Earth", "Earth", 1.0f), new Recorder(), false);
        pointer.press(0, 0);
        tick(strict, 0.5f);
        pointer.moveTo(-20, 0);
        tick(strict, 0.5f);
        assertFalse(strict.isInTargetRange());
    }

    @Test
    void missingReferenceDisablesLessonTest() {
        Body earth = new Body("Earth", "Earth", 1.0f).at(10, 0, 0);
        LessonController noPivot = new LessonController(LessonSettings.of("orbit", MotionKind.RADIAL_ORBIT), earth, null, alwaysHits(earth));
        assertTrue(noPivot.isSelfDisabled());
        assertFalse(noPivot.activate());
        assertNull(noPivot.orbit());

        LessonController noBody = new LessonController(LessonSettings.of("spin", MotionKind.AXIS_SPIN), null, null, null);
        assertTrue(noBody.isSelfDisabled());
        assertFalse(noBody.activate());
        noBody.tick(pointer, 0.1f);
        assertEquals(0.0f, noBody.accumulatedDegrees());
    }

    @Test
    void sunArcClampsElevationAndDrivesLightTest() {
        Body skySun = new Body("Sky Sun", "SkySun", 1.0f).at(0, 0, 10);
        Body observer = new Body("Earth", "Earth", 1.0f);
        LessonSettings settings = LessonSettings.of("arc", MotionKind.SPHERICAL_ORBIT)
            .withSensitivity(1.0f).withVerticalSensitivity(0.1f).withProgress(180.0f, 15.0f)
            .withElevationRange(10.0f, 80.0f);
        LessonController c = controller(settings, skySun, observer, new Recorder());

        assertEquals((float)Math.toRadians(10.0), c.orbit().elevation(), EPS);
        assertEquals(SkyLight.NIGHT_INTENSITY, c.skyLight().intensity(), EPS);

        //Dragging up raises the sun, no higher than the limit
        drag(c, 0, -1000);
        assertEquals((float)Math.toRadians(80.0), c.orbit().elevation(), EPS);
        assertEquals(10.0f * (float)Math.sin(Math.toRadians(80.0)), skySun.position().y(), EPS);
        assertTrue(c.skyLight().intensity() > 0.9f);
        assertEquals(0.0f, c.accumulatedDegrees());

        drag(c, 0, 2000);
        assertEquals((float)Math.toRadians(10.0), c.orbit().elevation(), EPS);
        assertTrue(c.skyLight().intensity() < 0.25f);

        drag(c, 90, 0);
        assertEquals(90.0f, c.accumulatedDegrees());
        assertEquals(10.0f * (float)Math.cos(Math.toRadians(10.0)), skySun.position().x(), EPS);
        assertEquals(0.0f, skySun.position().z(), EPS);
        assertEquals(10.0f, skySun.position().distance(observer.position()), EPS);
    }

    @Test
    void autoOrbitRunsWithoutInputAndCountsDaysTest() {
        Body earth = new Body("Earth", "Earth", 1.0f);
        Body moon = new Body("Moon", "Moon", 0.3f).at(3, 0, 0);
        Recorder rec = new Recorder();
        LessonController c = new LessonController(LessonSettings.of("month", MotionKind.AUTO_ORBIT)
            .withAngularSpeed(30.0f).withUnits(28, "Day"), moon, earth, null);
        c.addListener(rec);

        //Nothing moves before the lesson is active
        tick(c, 1.0f);
        assertEquals(0.0f, c.accumulatedDegrees());

        c.activate();
        assertFalse(c.session().isEnabled());
        for (int i = 0; i < 11; i++) tick(c, 1.0f);
        assertEquals(330.0f, c.accumulatedDegrees());
        assertEquals(LessonPhase.ACTIVE, c.phase());

        tick(c, 1.0f);
        assertEquals(LessonPhase.COMPLETED, c.phase());
        assertEquals(28, rec.units.size());
        assertEquals(1, rec.completions);
        assertEquals(3.0f, moon.position().x(), EPS);
        assertEquals(0.0f, moon.position().z(), EPS);
    }

    @Test
    void reinitializeStartsTheLessonOverTest() {
        Body earth = new Body("Earth", "Earth", 1.0f).at(10, 0, 0);
        LessonController c = controller(LessonSettings.of("orbit", MotionKind.RADIAL_ORBIT)
            .withSensitivity(1.0f), earth, sun, new Recorder());
        drag(c, 400, 0);
        assertEquals(LessonPhase.COMPLETED, c.phase());

        assertTrue(c.reinitialize());
        assertEquals(LessonPhase.INACTIVE, c.phase());
        assertEquals(0.0f, c.accumulatedDegrees());
        assertTrue(c.activate());
        drag(c, 30, 0);
        assertEquals(30.0f, c.accumulatedDegrees());
    }
}
