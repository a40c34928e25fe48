package works.scenegen.graph;

import java.util.List;

/**
 * A freshly constructed behavior holding its type's default field values.
 * <p>
 * Constructing one may touch the host graph, so a template must be
 * {@link #close closed} as soon as the comparison that needs it is done.
 */
public interface DefaultTemplate extends AutoCloseable {
	/**
	 * @return the same fields {@link SceneReflector#fields} would report for this instance
	 */
	List<ReflectedField> fields();

	/**
	 * Releases the template and anything created for it. Must not throw.
	 */
	@Override
	void close();
}
