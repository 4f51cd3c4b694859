package lessons;

//Nearest body under the pointer plus its role tag
public final class Pick {
    private final Body body;
    private final String tag;
    private final float distance;

    public Pick(Body body, String tag, float distance) {
        this.body = body;
        this.tag = tag;
        this.distance = distance;
    }

    public Body body() {
        return body;
    }

    public String tag() {
        return tag;
    }

    public float distance() {
        return distance;
    }
}
