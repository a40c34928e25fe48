package works.scenegen.scene;

public record Vector3(float x, float y, float z) {
	public static final Vector3 ZERO = new Vector3(0f, 0f, 0f);
	public static final Vector3 ONE = new Vector3(1f, 1f, 1f);
}
