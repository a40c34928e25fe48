package works.scenegen.reflect;

import works.scenegen.emit.FrameProperty;
import works.scenegen.emit.TargetDialect;
import works.scenegen.graph.TypeName;
import works.scenegen.scene.AnchorContainer;
import works.scenegen.scene.Color;
import works.scenegen.scene.NodeDirectory;
import works.scenegen.scene.Quaternion;
import works.scenegen.scene.RectTransform;
import works.scenegen.scene.SceneNode;
import works.scenegen.scene.Vector2;
import works.scenegen.scene.Vector3;

/**
 * Spells generated code against the {@code works.scenegen.scene} API.
 */
public final class SceneTargetDialect implements TargetDialect {
	public static final SceneTargetDialect INSTANCE = new SceneTargetDialect();

	private static final TypeName NODE = TypeName.of(SceneNode.class);
	private static final TypeName RECT_TRANSFORM = TypeName.of(RectTransform.class);
	private static final TypeName ANCHOR_CONTAINER = TypeName.of(AnchorContainer.class);
	private static final TypeName NODE_DIRECTORY = TypeName.of(NodeDirectory.class);
	private static final TypeName VECTOR2 = TypeName.of(Vector2.class);
	private static final TypeName VECTOR3 = TypeName.of(Vector3.class);
	private static final TypeName QUATERNION = TypeName.of(Quaternion.class);
	private static final TypeName COLOR = TypeName.of(Color.class);

	private SceneTargetDialect() { }

	@Override public TypeName nodeType() { return NODE; }
	@Override public TypeName rectFrameType() { return RECT_TRANSFORM; }
	@Override public TypeName anchorContainerType() { return ANCHOR_CONTAINER; }
	@Override public TypeName nodeDirectoryType() { return NODE_DIRECTORY; }
	@Override public TypeName vector2Type() { return VECTOR2; }
	@Override public TypeName vector3Type() { return VECTOR3; }
	@Override public TypeName rotationType() { return QUATERNION; }
	@Override public TypeName colorType() { return COLOR; }

	@Override
	public String newNode(String nodeType, String name) {
		return "new " + nodeType + "(" + name + ")";
	}

	@Override
	public String setParent(String node, String parent) {
		return node + ".setParent(" + parent + ")";
	}

	@Override
	public String frameOf(String node) {
		return node + ".transform()";
	}

	@Override
	public String useRectFrame(String node) {
		return node + ".useRectTransform()";
	}

	@Override
	public String rectFrameOf(String node) {
		return node + ".rectTransform()";
	}

	@Override
	public String setFrameProperty(String frame, FrameProperty property, String value) {
		String setter = switch (property) {
			case POSITION -> "setLocalPosition";
			case ROTATION -> "setLocalRotation";
			case SCALE -> "setLocalScale";
			case ANCHOR_MIN -> "setAnchorMin";
			case ANCHOR_MAX -> "setAnchorMax";
			case PIVOT -> "setPivot";
			case ANCHORED_POSITION -> "setAnchoredPosition";
			case SIZE_DELTA -> "setSizeDelta";
		};
		return frame + "." + setter + "(" + value + ")";
	}

	@Override
	public String addBehavior(String node, String behaviorType) {
		return node + ".addBehavior(" + behaviorType + ".class)";
	}

	@Override
	public String behaviorOf(String node, String behaviorType, int index) {
		return node + ".behavior(" + behaviorType + ".class, " + index + ")";
	}

	@Override
	public String findAnchored(String anchors, String path) {
		return anchors + ".find(" + path + ")";
	}

	@Override
	public String newDirectory(String directoryType, String root) {
		return "new " + directoryType + "(" + root + ")";
	}

	@Override
	public String register(String directory, String path, String node) {
		return directory + ".register(" + path + ", " + node + ")";
	}
}
