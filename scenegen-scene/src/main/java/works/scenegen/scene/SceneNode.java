package works.scenegen.scene;

import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;

/**
 * One vertex of a scene: a named node with a {@link Transform},
 * a parent (unless it's a root), ordered children,
 * and ordered {@link Behavior}s.
 * <p>
 * Nodes are compared by identity. Two nodes with the same name
 * and the same contents are still different nodes.
 */
public final class SceneNode {
	@NotNull private final String name;
	private Transform transform;
	private SceneNode parent;
	private final List<SceneNode> children = new ArrayList<>();
	private final List<Behavior> behaviors = new ArrayList<>();
	private boolean destroyed = false;

	public SceneNode(String name) {
		this.name = requireNonNull(name);
		this.transform = new Transform(this);
	}

	public String name() {
		return name;
	}

	public Transform transform() {
		return transform;
	}

	/**
	 * Switches this node to a {@link RectTransform}, keeping its local frame.
	 * Has no effect if the node already has one.
	 *
	 * @return this node's {@link RectTransform}
	 */
	public RectTransform useRectTransform() {
		if (transform instanceof RectTransform rt) {
			return rt;
		}
		RectTransform result = new RectTransform(this);
		result.copyFrom(transform);
		transform = result;
		return result;
	}

	/**
	 * @throws IllegalStateException if this node has an ordinary {@link Transform}
	 */
	public RectTransform rectTransform() {
		if (transform instanceof RectTransform rt) {
			return rt;
		}
		throw new IllegalStateException("Node \"" + name + "\" has no RectTransform");
	}

	public @Nullable SceneNode parent() {
		return parent;
	}

	public List<SceneNode> children() {
		return unmodifiableList(children);
	}

	/**
	 * Moves this node under {@code newParent}, as its last child,
	 * keeping the node's local frame unchanged.
	 * A null {@code newParent} makes this node a root.
	 */
	public void setParent(@Nullable SceneNode newParent) {
		for (SceneNode ancestor = newParent; ancestor != null; ancestor = ancestor.parent) {
			if (ancestor == this) {
				throw new IllegalArgumentException("Node \"" + name + "\" cannot be its own ancestor");
			}
		}
		if (parent != null) {
			parent.children.remove(this);
		}
		parent = newParent;
		if (newParent != null) {
			newParent.children.add(this);
		}
	}

	/**
	 * Creates a new {@code type} using its no-argument constructor and attaches it to this node.
	 *
	 * @throws IllegalArgumentException if {@code type} can't be instantiated
	 */
	public <T extends Behavior> T addBehavior(Class<T> type) {
		checkNotDestroyed();
		T result;
		try {
			var constructor = type.getDeclaredConstructor();
			constructor.setAccessible(true);
			result = constructor.newInstance();
		} catch (InvocationTargetException e) {
			throw new IllegalArgumentException("Constructor of " + type.getSimpleName() + " failed", e.getCause());
		} catch (ReflectiveOperationException | RuntimeException e) {
			throw new IllegalArgumentException("Unable to instantiate " + type.getName(), e);
		}
		behaviors.add(result);
		result.attachTo(this);
		return result;
	}

	/**
	 * @return the first attached behavior that is an instance of {@code type}, or null if none
	 */
	public <T extends Behavior> @Nullable T behavior(Class<T> type) {
		for (Behavior b : behaviors) {
			if (type.isInstance(b)) {
				return type.cast(b);
			}
		}
		return null;
	}

	/**
	 * @return the behavior at {@code index} among the attached behaviors whose class is exactly {@code type},
	 * in attachment order, or null if there are not that many
	 */
	public <T extends Behavior> @Nullable T behavior(Class<T> type, int index) {
		if (index < 0) {
			throw new IllegalArgumentException("Negative index " + index);
		}
		int remaining = index;
		for (Behavior b : behaviors) {
			if (b.getClass() == type) {
				if (remaining == 0) {
					return type.cast(b);
				}
				remaining--;
			}
		}
		return null;
	}

	public List<Behavior> behaviors() {
		return unmodifiableList(behaviors);
	}

	/**
	 * @param path child names separated by {@code /}
	 * @return the first descendant matching the path, or null if none
	 */
	public @Nullable SceneNode find(String path) {
		SceneNode current = this;
		for (String segment : path.split("/")) {
			SceneNode next = null;
			for (SceneNode child : current.children) {
				if (child.name.equals(segment)) {
					next = child;
					break;
				}
			}
			if (next == null) {
				return null;
			}
			current = next;
		}
		return current;
	}

	/**
	 * Detaches this node from its parent, then destroys its children,
	 * then detaches its behaviors in reverse order of attachment.
	 */
	public void destroy() {
		if (destroyed) {
			return;
		}
		destroyed = true;
		setParent(null);
		for (SceneNode child : List.copyOf(children)) {
			child.destroy();
		}
		for (int i = behaviors.size() - 1; i >= 0; i--) {
			behaviors.get(i).detach();
		}
	}

	public boolean isDestroyed() {
		return destroyed;
	}

	private void checkNotDestroyed() {
		if (destroyed) {
			throw new IllegalStateException("Node \"" + name + "\" has been destroyed");
		}
	}

	@Override
	public String toString() {
		return "SceneNode(" + name + ")";
	}
}
