package lessons;

import java.awt.event.KeyEvent;
import java.awt.event.KeyListener;
import java.io.IOException;
import java.lang.Math;
import java.nio.FloatBuffer;
import java.nio.file.Paths;
import javax.swing.JFrame;
import javax.swing.SwingUtilities;
import static com.jogamp.opengl.GL2.*;
import com.jogamp.common.nio.Buffers;
import com.jogamp.opengl.GL2;
import com.jogamp.opengl.GLAutoDrawable;
import com.jogamp.opengl.GLCapabilities;
import com.jogamp.opengl.GLEventListener;
import com.jogamp.opengl.GLProfile;
import com.jogamp.opengl.awt.GLJPanel;
import com.jogamp.opengl.glu.GLU;
import com.jogamp.opengl.glu.GLUquadric;
import com.jogamp.opengl.util.Animator;
import org.joml.Matrix4f;
import org.joml.Vector3fc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

//Desktop window for the lessons: Space starts, N skips a stage, X cancels a camera transition
public class OrbitLessons extends JFrame implements GLEventListener, KeyListener {
    private static final Logger log = LoggerFactory.getLogger(OrbitLessons.class);

    private final GLJPanel myPanel;
    private final Animator animator;
    private final AwtPointer pointer = new AwtPointer();
    private final LessonSimulation simulation;
    private final RaySpherePicker picker;

    private final GLU glu = new GLU();
    private GLUquadric quadric;
    private final FloatBuffer vals = Buffers.newDirectFloatBuffer(16);
    private final Matrix4f pMat = new Matrix4f();
    private final Matrix4f vMat = new Matrix4f();
    private final Matrix4f mMat = new Matrix4f();
    private float aspect = 1.0f;
    private long lastFrame;

    public OrbitLessons(SimulationConfig config) {
        LessonScene scene = LessonScene.standard();
        picker = new RaySpherePicker(scene, 1000, 1000);
        simulation = LessonSimulation.create(config, scene, picker);
        TitleUpdater title = new TitleUpdater();
        simulation.sequencer().addListener(title);
        for (LessonController c : simulation.controllers()) c.addListener(title);

        setTitle("Orbit Lessons - press Space to begin");
        setSize(1000, 1000);
        myPanel = new GLJPanel(new GLCapabilities(GLProfile.get(GLProfile.GL2)));
        myPanel.addGLEventListener(this);
        myPanel.addKeyListener(this);
        myPanel.addMouseListener(pointer);
        myPanel.addMouseMotionListener(pointer);
        myPanel.setFocusable(true);
        this.add(myPanel);
        this.setVisible(true);
        this.setDefaultCloseOperation(JFrame.EXIT_ON_CLOSE);
        myPanel.requestFocus();
        lastFrame = System.nanoTime();
        animator = new Animator(myPanel);
        animator.start();
    }

    public void init(GLAutoDrawable drawable) {
        GL2 gl = drawable.getGL().getGL2();
        gl.glEnable(GL_DEPTH_TEST);
        quadric = glu.gluNewQuadric();
    }

    public void display(GLAutoDrawable drawable) {
        long now = System.nanoTime();
        //Clamp so a stalled frame does not jump a lesson forward
        float dt = Math.min((now - lastFrame) / 1.0e9f, 0.1f);
        lastFrame = now;
        simulation.tick(pointer.sample(), dt);

        GL2 gl = drawable.getGL().getGL2();
        Vector3fc sky = skyColor();
        gl.glClearColor(sky.x(), sky.y(), sky.z(), 1.0f);
        gl.glClear(GL_COLOR_BUFFER_BIT | GL_DEPTH_BUFFER_BIT);

        pMat.identity().setPerspective((float)Math.toRadians(60.0f), aspect, 0.1f, 5000.0f);
        gl.glMatrixMode(GL_PROJECTION);
        gl.glLoadMatrixf(pMat.get(vals));

        simulation.scene().camera().viewMatrix(vMat);
        gl.glMatrixMode(GL_MODELVIEW);
        for (Body b : simulation.scene().bodies()) {
            if (b.size() <= 0.0f) continue;
            mMat.set(vMat).translate(b.position()).rotate(b.orientation());
            gl.glLoadMatrixf(mMat.get(vals));
            color(gl, b);
            glu.gluSphere(quadric, b.size(), 24, 16);
        }
    }

    //Sky lesson's light while it has one, plain night otherwise
    private Vector3fc skyColor() {
        LessonController current = simulation.sequencer().current();
        if (current != null && current.kind() == MotionKind.SPHERICAL_ORBIT) {
            return current.skyLight().color();
        }
        return SkyLight.NIGHT_COLOR;
    }

    private void color(GL2 gl, Body b) {
        switch (b.tag()) {
            case "Sun":
            case "SkySun":
                gl.glColor3f(1.0f, 0.85f, 0.2f);
                break;
            case "Earth":
                gl.glColor3f(0.2f, 0.45f, 0.9f);
                break;
            default:
                gl.glColor3f(0.8f, 0.8f, 0.8f);
                break;
        }
    }

    //Runs on the AWT thread; the simulation picks the command up on its next tick
    public void keyPressed(KeyEvent e) {
        int keyCode = e.getKeyCode();
        //Space --> Start the First Lesson
        if (keyCode == KeyEvent.VK_SPACE) {
            simulation.request(LessonSimulation.Command.START);

        //N --> Skip to the Next Stage
        } else if (keyCode == KeyEvent.VK_N) {
            simulation.request(LessonSimulation.Command.SKIP_STAGE);

        //X --> Cancel the Camera Transition
        } else if (keyCode == KeyEvent.VK_X) {
            simulation.request(LessonSimulation.Command.CANCEL_TRANSITION);
        }
    }

    public void keyReleased(KeyEvent e) {}
    public void keyTyped(KeyEvent e) {}

    public void dispose(GLAutoDrawable drawable) {
        if (quadric != null) glu.gluDeleteQuadric(quadric);
    }

    public void reshape(GLAutoDrawable drawable, int x, int y, int width, int height) {
        aspect = (float)width / (float)Math.max(1, height);
        picker.resize(width, height);
    }

    //Window title shows the lesson in play and how far along it is
    private final class TitleUpdater implements SequencerListener, LessonListener {
        @Override
        public void onPhaseEntered(int index, LessonController lesson) {
            show(lesson.id() + " - drag the " + lesson.body().name());
        }

        @Override
        public void onUnitAdvanced(LessonController lesson, int unit) {
            String label = "Phase".equals(lesson.settings().unitLabel())
                ? MoonPhase.forUnit(unit).label()
                : lesson.settings().unitLabel() + " " + unit;
            show(lesson.id() + " - " + label);
        }

        @Override
        public void onTargetRange(LessonController lesson, boolean inRange) {
            show(lesson.id() + (inRange ? " - hold it there" : " - keep tilting"));
        }

        @Override
        public void onTransitionStarted(int fromIndex) {
            show("Travelling... (X to skip)");
        }

        @Override
        public void onLocked() {
            show("All lessons complete");
        }

        private void show(String status) {
            SwingUtilities.invokeLater(() -> setTitle("Orbit Lessons - " + status));
        }
    }

    public static void main(String[] args) {
        SimulationConfig config;
        try {
            config = args.length > 0 ? SimulationConfig.load(Paths.get(args[0])) : SimulationConfig.load();
        } catch (IOException e) {
            log.error("Cannot read configuration {}", args[0], e);
            System.exit(1);
            return;
        }
        new OrbitLessons(config);
    }
}
