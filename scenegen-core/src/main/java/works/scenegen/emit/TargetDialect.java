package works.scenegen.emit;

import works.scenegen.graph.TypeName;

/**
 * How operations on the host scene API are spelled in generated code.
 * <p>
 * Arguments are Java expressions, already formatted;
 * every method returns an expression.
 * Type arguments are spelled as returned by {@link works.scenegen.codegen.ImportSet#use}.
 */
public interface TargetDialect {
	TypeName nodeType();
	TypeName rectFrameType();
	TypeName anchorContainerType();
	TypeName nodeDirectoryType();

	TypeName vector2Type();
	TypeName vector3Type();
	TypeName rotationType();
	TypeName colorType();

	String newNode(String nodeType, String name);

	String setParent(String node, String parent);

	/**
	 * @return the ordinary frame of {@code node}
	 */
	String frameOf(String node);

	/**
	 * @return an expression that converts the frame of {@code node} to a rect frame, and evaluates to it
	 */
	String useRectFrame(String node);

	/**
	 * @return the rect frame of {@code node}, which already has one
	 */
	String rectFrameOf(String node);

	String setFrameProperty(String frame, FrameProperty property, String value);

	String addBehavior(String node, String behaviorType);

	/**
	 * @return the behavior at {@code index} among those attached to {@code node}
	 * whose type is exactly {@code behaviorType}, in attachment order
	 */
	String behaviorOf(String node, String behaviorType, int index);

	/**
	 * @return the node at {@code path} in {@code anchors}, or null
	 */
	String findAnchored(String anchors, String path);

	String newDirectory(String directoryType, String root);

	String register(String directory, String path, String node);

	default String field(String owner, String fieldName) {
		return owner + "." + fieldName;
	}
}
