package works.scenegen.reflect;

import java.io.File;
import java.lang.reflect.Method;
import java.net.URISyntaxException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import javax.tools.DiagnosticCollector;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import works.scenegen.GeneratedSource;
import works.scenegen.GeneratorSettings;
import works.scenegen.graph.FieldValue;
import works.scenegen.graph.GraphBehavior;
import works.scenegen.graph.GraphNode;
import works.scenegen.graph.ReferenceValue.BehaviorReference;
import works.scenegen.graph.ReferenceValue.FrameReference;
import works.scenegen.graph.ReferenceValue.NodeReference;
import works.scenegen.graph.ReflectedField;
import works.scenegen.reflect.fixtures.Card;
import works.scenegen.reflect.fixtures.Deck;
import works.scenegen.reflect.fixtures.ScoredCard;
import works.scenegen.reflect.fixtures.Suit;
import works.scenegen.scene.AnchorContainer;
import works.scenegen.scene.Behavior;
import works.scenegen.scene.Color;
import works.scenegen.scene.NodeDirectory;
import works.scenegen.scene.Quaternion;
import works.scenegen.scene.RectTransform;
import works.scenegen.scene.SceneNode;
import works.scenegen.scene.Vector2;
import works.scenegen.scene.Vector3;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Generates factories, compiles them, runs them, and compares what they build with the original scene.
 */
class SceneGeneratorsTest {
	static final String PACKAGE = "gen";

	@TempDir Path tempDir;
	SceneGenerators generators;
	Predicate<Class<? extends Behavior>> allFixtures = SceneGenerators.inPackage("works.scenegen.reflect.fixtures");

	@BeforeEach
	void setup() {
		generators = new SceneGenerators(GeneratorSettings.builder()
			.packageName(PACKAGE)
			.clock(Clock.fixed(Instant.parse("2024-05-01T12:30:00Z"), ZoneOffset.UTC))
			.build());
	}

	@Test
	void singleRoot_rebuildsEquivalentScene() throws Exception {
		SceneNode hand = new SceneNode("Hand");
		hand.transform().setLocalPosition(new Vector3(1f, 0f, 0f));
		hand.transform().setLocalRotation(Quaternion.euler(0f, 90f, 0f));
		hand.transform().setLocalScale(new Vector3(2f, 2f, 2f));
		Card handCard = hand.addBehavior(Card.class);
		handCard.cost = 3;
		handCard.weight = 0.25f;
		handCard.title = "Ace \"high\"\n\tlow";
		handCard.suit = Suit.SPADES;
		handCard.offset = new Vector3(0f, -10f, 0.5f);
		handCard.tint = new Color(0.25f, 0.5f, 1f, 1f);
		handCard.faceUp = true;

		SceneNode slot = new SceneNode("Slot");
		slot.setParent(hand);
		Card slotCard = slot.addBehavior(Card.class);
		Deck deck = slot.addBehavior(Deck.class);
		slotCard.next = handCard;

		SceneNode label = new SceneNode("Label");
		label.setParent(hand);
		RectTransform rect = label.useRectTransform();
		rect.setAnchorMin(new Vector2(0.5f, 0f));
		rect.setAnchorMax(new Vector2(0.5f, 0f));
		rect.setAnchoredPosition(new Vector2(0f, -10f));
		rect.setSizeDelta(new Vector2(100f, 20f));

		handCard.next = slotCard;
		handCard.target = label;
		handCard.mount = label.transform();
		handCard.partner = deck;

		Predicate<Class<? extends Behavior>> notDecks = allFixtures.and(type -> type != Deck.class);
		GeneratedSource source = generators.singleRoot("HandLayout", "Scenes/Hand.scene", hand, true, notDecks, List.of());
		assertTrue(source.text().startsWith("// AUTO-GENERATED CODE - DO NOT EDIT\n// Generated from: Scenes/Hand.scene\n"));
		assertEquals(1, count(source.text(), "addBehavior(Deck.class)"));

		try (URLClassLoader loader = compile(source)) {
			Method create = loader.loadClass(PACKAGE + ".HandLayout").getMethod("create", List.class, AnchorContainer.class);
			List<SceneNode> created = new ArrayList<>();
			Card rebuilt = (Card) create.invoke(null, created, null);

			assertEquals(3, created.size());
			assertSame(rebuilt.node(), created.get(0));
			assertEquals(describe(hand), describe(rebuilt.node()));
			assertSame(rebuilt, rebuilt.next.next);
			assertSame(rebuilt.node().find("Label").transform(), rebuilt.mount);
		}
	}

	@Test
	void singleRoot_keepsSiblingOrderAndRectPosition() throws Exception {
		SceneNode hand = new SceneNode("Hand");
		SceneNode first = new SceneNode("First");
		first.setParent(hand);
		SceneNode second = new SceneNode("Second");
		second.setParent(hand);
		second.useRectTransform().setLocalPosition(new Vector3(5f, 0f, 0f));
		hand.addBehavior(Card.class).target = second;

		GeneratedSource source = generators.singleRoot("OrderedHand", "hand", hand, true, allFixtures, List.of());

		try (URLClassLoader loader = compile(source)) {
			Method create = loader.loadClass(PACKAGE + ".OrderedHand").getMethod("create", List.class, AnchorContainer.class);
			Card rebuilt = (Card) create.invoke(null, new ArrayList<SceneNode>(), null);
			SceneNode rebuiltHand = rebuilt.node();

			assertEquals(List.of("First", "Second"), rebuiltHand.children().stream().map(SceneNode::name).toList());
			assertSame(rebuiltHand.find("Second"), rebuilt.target);
			assertEquals(new Vector3(5f, 0f, 0f), rebuilt.target.transform().localPosition());
			assertEquals(describe(hand), describe(rebuiltHand));
		}
	}

	@Test
	void anchors_resolvedThroughDirectory() throws Exception {
		SceneNode canvas = new SceneNode("Canvas");
		SceneNode dialog = new SceneNode("Dialog");
		dialog.setParent(canvas);
		SceneNode ok = new SceneNode("Ok");
		ok.setParent(dialog);
		ok.addBehavior(Card.class).cost = 9;

		SceneNode hand = new SceneNode("Hand");
		Card handCard = hand.addBehavior(Card.class);
		handCard.next = ok.behavior(Card.class);
		handCard.target = dialog;

		GeneratedSource handSource = generators.singleRoot("AnchoredHand", "hand", hand, false, allFixtures, List.of(canvas));
		GeneratedSource canvasSource = generators.directory("CanvasObjects", "canvas", canvas, allFixtures);
		assertFalse(handSource.text().contains("new SceneNode(\"Ok\")"));

		try (URLClassLoader loader = compile(handSource, canvasSource)) {
			Method createDirectory = loader.loadClass(PACKAGE + ".CanvasObjects").getMethod("create", List.class);
			Method createHand = loader.loadClass(PACKAGE + ".AnchoredHand").getMethod("create", List.class, AnchorContainer.class);

			List<SceneNode> canvasNodes = new ArrayList<>();
			NodeDirectory directory = (NodeDirectory) createDirectory.invoke(null, canvasNodes);
			assertEquals(3, canvasNodes.size());
			assertEquals(List.of("Dialog", "Dialog/Ok"), List.copyOf(directory.paths()));
			assertEquals(describe(canvas), describe(directory.root()));

			List<SceneNode> handNodes = new ArrayList<>();
			Card anchored = (Card) createHand.invoke(null, handNodes, directory);
			assertEquals(1, handNodes.size());
			SceneNode rebuiltOk = directory.find("Dialog/Ok");
			assertNotNull(rebuiltOk);
			assertSame(rebuiltOk.behavior(Card.class), anchored.next);
			assertEquals(9, anchored.next.cost);
			assertSame(directory.find("Dialog"), anchored.target);

			Card unanchored = (Card) createHand.invoke(null, new ArrayList<SceneNode>(), null);
			assertNull(unanchored.next);
			assertNull(unanchored.target);
		}
	}

	@Test
	void anchors_behaviorFoundAmongSeveralOfTheSameType() throws Exception {
		SceneNode canvas = new SceneNode("Canvas");
		SceneNode ok = new SceneNode("Ok");
		ok.setParent(canvas);
		ok.addBehavior(ScoredCard.class).cost = 1;
		ok.addBehavior(Card.class).cost = 2;
		Card wanted = ok.addBehavior(Card.class);
		wanted.cost = 3;

		SceneNode hand = new SceneNode("Hand");
		hand.addBehavior(Card.class).next = wanted;

		GeneratedSource handSource = generators.singleRoot("PickedHand", "hand", hand, false, allFixtures, List.of(canvas));
		GeneratedSource canvasSource = generators.directory("PickedCanvas", "canvas", canvas, allFixtures);

		try (URLClassLoader loader = compile(handSource, canvasSource)) {
			NodeDirectory directory = (NodeDirectory) loader.loadClass(PACKAGE + ".PickedCanvas")
				.getMethod("create", List.class)
				.invoke(null, new ArrayList<SceneNode>());
			Card picked = (Card) loader.loadClass(PACKAGE + ".PickedHand")
				.getMethod("create", List.class, AnchorContainer.class)
				.invoke(null, new ArrayList<SceneNode>(), directory);
			assertEquals(Card.class, picked.next.getClass());
			assertEquals(3, picked.next.cost);
			assertSame(directory.find("Ok"), picked.next.node());
		}
	}

	@Test
	void rootList_returnsOneHandlePerRoot() throws Exception {
		List<SceneNode> roots = new ArrayList<>();
		for (int i = 1; i <= 2; i++) {
			SceneNode root = new SceneNode("Seat " + i);
			root.addBehavior(Card.class).cost = i;
			roots.add(root);
		}

		GeneratedSource source = generators.rootList("Seats", "seats", roots, Card.class, allFixtures, List.of());

		try (URLClassLoader loader = compile(source)) {
			Method create = loader.loadClass(PACKAGE + ".Seats").getMethod("create", List.class, AnchorContainer.class);
			List<SceneNode> created = new ArrayList<>();
			@SuppressWarnings("unchecked")
			List<Card> cards = (List<Card>) create.invoke(null, created, null);
			assertEquals(2, cards.size());
			assertEquals(1, cards.get(0).cost);
			assertEquals(2, cards.get(1).cost);
			assertEquals("Seat 2", cards.get(1).node().name());
			assertEquals(2, created.size());
		}
	}

	@Test
	void inPackage_includesSubpackages() {
		assertTrue(SceneGenerators.inPackage("works.scenegen.reflect.fixtures").test(Card.class));
		assertTrue(SceneGenerators.inPackage("works.scenegen.reflect").test(Card.class));
		assertFalse(SceneGenerators.inPackage("works.scenegen.reflect.fix").test(Card.class));
	}

	private URLClassLoader compile(GeneratedSource... sources) throws Exception {
		JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
		assumeTrue(compiler != null, "Needs a JDK");
		Path sourceRoot = tempDir.resolve("src");
		Path classes = tempDir.resolve("classes");
		List<Path> files = new ArrayList<>();
		for (GeneratedSource source : sources) {
			files.add(source.writeTo(sourceRoot));
		}
		String classpath = location(SceneNode.class) + File.pathSeparator + location(Card.class);
		DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
		try (StandardJavaFileManager fileManager = compiler.getStandardFileManager(diagnostics, null, UTF_8)) {
			List<String> options = List.of("-classpath", classpath, "-d", classes.toString(), "-proc:none");
			Boolean success = compiler.getTask(null, fileManager, diagnostics, options, null, fileManager.getJavaFileObjectsFromPaths(files)).call();
			assertTrue(success, () -> "Generated code doesn't compile: " + diagnostics.getDiagnostics());
		}
		return new URLClassLoader(new URL[]{ classes.toUri().toURL() }, getClass().getClassLoader());
	}

	private static String location(Class<?> type) throws URISyntaxException {
		return Path.of(type.getProtectionDomain().getCodeSource().getLocation().toURI()).toString();
	}

	private static int count(String text, String substring) {
		int result = 0;
		for (int i = text.indexOf(substring); i >= 0; i = text.indexOf(substring, i + 1)) {
			result++;
		}
		return result;
	}

	/**
	 * Names, frames, and field values of the whole subtree, with references
	 * described by what they point at.
	 */
	private static String describe(SceneNode root) {
		ReflectiveSceneGraph graph = new ReflectiveSceneGraph();
		StringBuilder sb = new StringBuilder();
		describe(graph, graph.node(root), "", sb);
		return sb.toString();
	}

	private static void describe(ReflectiveSceneGraph graph, GraphNode node, String indent, StringBuilder sb) {
		sb.append(indent).append(node.name()).append(' ').append(node.frame()).append('\n');
		for (GraphBehavior behavior : node.behaviors()) {
			sb.append(indent).append("- ").append(behavior.type().simpleName()).append('\n');
			for (ReflectedField field : graph.fields(behavior)) {
				sb.append(indent).append("  ").append(field.path()).append(" = ").append(describe(field.value())).append('\n');
			}
		}
		for (GraphNode child : node.children()) {
			describe(graph, child, indent + "\t", sb);
		}
	}

	private static String describe(FieldValue value) {
		if (value instanceof NodeReference r) {
			return "node " + r.node().name();
		} else if (value instanceof BehaviorReference r) {
			return r.behavior().type().simpleName() + " on " + r.behavior().node().name();
		} else if (value instanceof FrameReference r) {
			return "frame of " + r.node().name();
		} else {
			return value.toString();
		}
	}
}
