package works.scenegen.graph;

public record Rgba(float r, float g, float b, float a) {
	public static final Rgba CLEAR = new Rgba(0f, 0f, 0f, 0f);
}
