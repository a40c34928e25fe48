package works.scenegen.graph;

public record Vec2(float x, float y) {
	public static final Vec2 ZERO = new Vec2(0f, 0f);
	public static final Vec2 ONE = new Vec2(1f, 1f);
	public static final Vec2 HALF = new Vec2(0.5f, 0.5f);
}
