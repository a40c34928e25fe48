package works.scenegen.graph;

import java.util.List;
import works.scenegen.exceptions.TemplateInstantiationException;

/**
 * The one thing a host graph must implement to be turned into source code:
 * reflective access to its behaviors.
 */
public interface SceneReflector {
	/**
	 * @return the fields of {@code behavior} in declaration order
	 */
	List<ReflectedField> fields(GraphBehavior behavior);

	/**
	 * Builds a default-initialized instance of the same type as {@code exemplar}.
	 * Callers must close the result.
	 */
	DefaultTemplate defaultTemplate(GraphBehavior exemplar) throws TemplateInstantiationException;

	/**
	 * Both arguments have the same {@link ValueKind}.
	 */
	default boolean structurallyEqual(FieldValue actual, FieldValue template) {
		return actual.equals(template);
	}
}
