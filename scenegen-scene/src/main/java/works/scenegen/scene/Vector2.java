package works.scenegen.scene;

public record Vector2(float x, float y) {
	public static final Vector2 ZERO = new Vector2(0f, 0f);
	public static final Vector2 ONE = new Vector2(1f, 1f);
	public static final Vector2 HALF = new Vector2(0.5f, 0.5f);
}
