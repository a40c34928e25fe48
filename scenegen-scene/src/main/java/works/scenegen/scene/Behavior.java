package works.scenegen.scene;

/**
 * Base class for everything that can be attached to a {@link SceneNode}.
 * <p>
 * Subclasses need an accessible no-argument constructor,
 * since {@link SceneNode#addBehavior} creates the instance.
 * Their state lives in public instance fields, which is what
 * code generators and inspectors are expected to read and write.
 * A behavior belongs to one node for its whole lifetime.
 */
public abstract class Behavior {
	private SceneNode node;

	public final SceneNode node() {
		if (node == null) {
			throw new IllegalStateException(getClass().getSimpleName() + " is not attached to a node");
		}
		return node;
	}

	/**
	 * Called once, right after this behavior is attached.
	 */
	protected void onAttach() { }

	/**
	 * Called once, when the owning node is destroyed.
	 */
	protected void onDetach() { }

	final void attachTo(SceneNode owner) {
		if (node != null) {
			throw new IllegalStateException(getClass().getSimpleName() + " is already attached to \"" + node.name() + "\"");
		}
		node = owner;
		onAttach();
	}

	final void detach() {
		onDetach();
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "@" + (node == null ? "<detached>" : node.name());
	}
}
