package works.scenegen.scene;

import static java.util.Objects.requireNonNull;

/**
 * The spatial frame of a {@link SceneNode}, relative to its parent.
 * Every node has exactly one.
 */
public class Transform {
	private final SceneNode node;
	private Vector3 localPosition = Vector3.ZERO;
	private Quaternion localRotation = Quaternion.IDENTITY;
	private Vector3 localScale = Vector3.ONE;

	Transform(SceneNode node) {
		this.node = node;
	}

	public SceneNode node() {
		return node;
	}

	public Vector3 localPosition() {
		return localPosition;
	}

	public void setLocalPosition(Vector3 localPosition) {
		this.localPosition = requireNonNull(localPosition);
	}

	public Quaternion localRotation() {
		return localRotation;
	}

	public void setLocalRotation(Quaternion localRotation) {
		this.localRotation = requireNonNull(localRotation);
	}

	public Vector3 localScale() {
		return localScale;
	}

	public void setLocalScale(Vector3 localScale) {
		this.localScale = requireNonNull(localScale);
	}

	void copyFrom(Transform other) {
		localPosition = other.localPosition;
		localRotation = other.localRotation;
		localScale = other.localScale;
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "(" + node.name() + ")";
	}
}
