package works.scenegen.scene;

/**
 * Linear RGBA color with components nominally in {@code [0, 1]}.
 */
public record Color(float r, float g, float b, float a) {
	public static final Color WHITE = new Color(1f, 1f, 1f, 1f);
	public static final Color BLACK = new Color(0f, 0f, 0f, 1f);
	public static final Color CLEAR = new Color(0f, 0f, 0f, 0f);
}
