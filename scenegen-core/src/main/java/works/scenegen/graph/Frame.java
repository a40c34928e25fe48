package works.scenegen.graph;

import static java.util.Objects.requireNonNull;

/**
 * The spatial frame of a {@link GraphNode}, relative to its parent.
 * <p>
 * Each component has an implicit default (see {@link SpatialFrame#DEFAULT}
 * and {@link RectFrame#DEFAULT}), and generated code only sets
 * the components that differ from it.
 */
public sealed interface Frame {
	Quat rotation();
	Vec3 scale();

	record SpatialFrame(Vec3 position, Quat rotation, Vec3 scale) implements Frame {
		public static final SpatialFrame DEFAULT = new SpatialFrame(Vec3.ZERO, Quat.IDENTITY, Vec3.ONE);

		public SpatialFrame {
			requireNonNull(position);
			requireNonNull(rotation);
			requireNonNull(scale);
		}
	}

	/**
	 * A frame for nodes laid out in user-interface space.
	 * The {@code position} is the node's local position, kept apart from its anchored position.
	 */
	record RectFrame(
		Vec2 anchorMin,
		Vec2 anchorMax,
		Vec2 pivot,
		Vec2 anchoredPosition,
		Vec2 sizeDelta,
		Vec3 position,
		Quat rotation,
		Vec3 scale
	) implements Frame {
		public static final RectFrame DEFAULT = new RectFrame(Vec2.ZERO, Vec2.ONE, Vec2.HALF, Vec2.ZERO, Vec2.ZERO, Vec3.ZERO, Quat.IDENTITY, Vec3.ONE);

		public RectFrame {
			requireNonNull(anchorMin);
			requireNonNull(anchorMax);
			requireNonNull(pivot);
			requireNonNull(anchoredPosition);
			requireNonNull(sizeDelta);
			requireNonNull(position);
			requireNonNull(rotation);
			requireNonNull(scale);
		}
	}
}
