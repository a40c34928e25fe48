package works.scenegen.scene;

/**
 * A rotation, stored as its four quaternion components
 * so that a value survives being written out and read back exactly.
 */
public record Quaternion(float x, float y, float z, float w) {
	public static final Quaternion IDENTITY = new Quaternion(0f, 0f, 0f, 1f);

	/**
	 * Rotation by the given Euler angles, in degrees,
	 * applied about the z axis first, then x, then y.
	 */
	public static Quaternion euler(float x, float y, float z) {
		double hx = Math.toRadians(x) / 2;
		double hy = Math.toRadians(y) / 2;
		double hz = Math.toRadians(z) / 2;
		double cx = Math.cos(hx), sx = Math.sin(hx);
		double cy = Math.cos(hy), sy = Math.sin(hy);
		double cz = Math.cos(hz), sz = Math.sin(hz);
		return new Quaternion(
			(float) (sx * cy * cz + cx * sy * sz),
			(float) (cx * sy * cz - sx * cy * sz),
			(float) (cx * cy * sz - sx * sy * cz),
			(float) (cx * cy * cz + sx * sy * sz)
		);
	}
}
