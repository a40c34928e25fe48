package works.scenegen;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import works.scenegen.codegen.ImportSet;
import works.scenegen.codegen.JavaLiterals;
import works.scenegen.codegen.NameAllocator;
import works.scenegen.codegen.SourceBuilder;
import works.scenegen.diff.DefaultValueDiffer;
import works.scenegen.emit.EmittedNode;
import works.scenegen.emit.GraphEmitter;
import works.scenegen.emit.MethodScope;
import works.scenegen.emit.TargetDialect;
import works.scenegen.graph.GraphBehavior;
import works.scenegen.graph.GraphNode;
import works.scenegen.graph.SceneReflector;
import works.scenegen.graph.TypeName;
import works.scenegen.logging.MdcKeys;
import works.scenegen.refs.AnchorResolver;
import works.scenegen.refs.ReferenceClassifier;

import static java.util.Objects.requireNonNull;

/**
 * Turns a scene graph into the source of a Java class whose factory method rebuilds it.
 * <p>
 * Holds no state between calls to {@link #generate}, so one instance can serve many requests,
 * though not concurrently on the same graph.
 */
public final class SceneCodeGenerator {
	private final SceneReflector reflector;
	private final TargetDialect dialect;
	private final GeneratorSettings settings;

	public SceneCodeGenerator(SceneReflector reflector, TargetDialect dialect, GeneratorSettings settings) {
		this.reflector = requireNonNull(reflector);
		this.dialect = requireNonNull(dialect);
		settings.validate();
		this.settings = settings;
	}

	public GeneratedSource generate(GenerationRequest request) {
		String oldMDC = MDC.get(MdcKeys.OUTPUT);
		MDC.put(MdcKeys.OUTPUT, request.className());
		try {
			return generateImpl(request);
		} finally {
			if (oldMDC == null) {
				MDC.remove(MdcKeys.OUTPUT);
			} else {
				MDC.put(MdcKeys.OUTPUT, oldMDC);
			}
		}
	}

	private GeneratedSource generateImpl(GenerationRequest request) {
		String packageName = settings.packageName();
		String className = request.className();
		ImportSet imports = new ImportSet(packageName, className);
		NameAllocator names = new NameAllocator();
		names.reserve(CREATED_NODES, ANCHORS, RESULT, className);

		EntryPoint entryPoint = request.entryPoint();
		boolean isDirectory = entryPoint instanceof EntryPoint.AnchorDirectory;
		SourceBuilder body = new SourceBuilder(2);
		MethodScope scope = new MethodScope(names, imports, body, CREATED_NODES, isDirectory ? null : ANCHORS);
		GraphEmitter emitter = new GraphEmitter(
			dialect,
			new DefaultValueDiffer(reflector, settings.reservedFieldNames(), settings.reservedFieldPrefix(), settings.emptyStringPolicy()),
			new ReferenceClassifier(new AnchorResolver(request.anchorBoundaries())),
			request.supported(),
			settings.followReferencesOf(),
			scope);

		String returnType;
		String nodeList = imports.use(LIST) + "<" + imports.use(dialect.nodeType()) + ">";
		String parameters;
		if (entryPoint instanceof EntryPoint.SingleRoot single) {
			String handle = emitter.emitNode(single.root(), single.root().name(), true);
			if (single.includeDescendants()) {
				emitter.emitDescendants(single.root());
			}
			emitter.linkParents();
			returnType = primaryType(imports, requireNonNull(emitter.emitted(single.root())));
			body.blankLine();
			body.returns(handle);
			parameters = nodeList + " " + CREATED_NODES + ", " + imports.use(dialect.anchorContainerType()) + " " + ANCHORS;
		} else if (entryPoint instanceof EntryPoint.RootList list) {
			String elementType = imports.use(list.elementType());
			returnType = imports.use(LIST) + "<" + elementType + ">";
			body.declare(returnType, RESULT, "new " + imports.use(ARRAY_LIST) + "<>()");
			for (GraphNode root : list.roots()) {
				emitter.emitNode(root, root.name(), true);
				String handle = handleOfType(requireNonNull(emitter.emitted(root)), list.elementType());
				if (handle == null) {
					LOGGER.warn("Root \"{}\" has no {}; leaving it out of the result", root.name(), list.elementType().simpleName());
				} else {
					body.call(RESULT + ".add(" + handle + ")");
				}
			}
			emitter.linkParents();
			body.blankLine();
			body.returns(RESULT);
			parameters = nodeList + " " + CREATED_NODES + ", " + imports.use(dialect.anchorContainerType()) + " " + ANCHORS;
		} else if (entryPoint instanceof EntryPoint.AnchorDirectory directory) {
			returnType = imports.use(dialect.nodeDirectoryType());
			emitDirectory(emitter, body, names, directory.boundary(), returnType);
			parameters = nodeList + " " + CREATED_NODES;
		} else {
			throw new AssertionError("Unexpected entry point: " + entryPoint);
		}

		SourceBuilder file = new SourceBuilder();
		file.comment("AUTO-GENERATED CODE - DO NOT EDIT");
		file.comment("Generated from: " + request.sourceName().replaceAll("[\\r\\n]+", " "));
		file.comment("Generated at: " + TIMESTAMP.format(LocalDateTime.now(settings.clock())));
		file.blankLine();
		if (!packageName.isEmpty()) {
			file.line("package " + packageName + ";");
			file.blankLine();
		}
		List<String> importNames = imports.imports();
		for (String name : importNames) {
			file.line("import " + name + ";");
		}
		if (!importNames.isEmpty()) {
			file.blankLine();
		}
		file.openBlock("public final class " + className);
		file.line("private " + className + "() { }");
		file.blankLine();
		file.openBlock("public static " + returnType + " create(" + parameters + ")");
		file.include(body);
		file.closeBlock();
		file.closeBlock();

		LOGGER.info("Generated {} from {} with {} nodes", className, request.sourceName(), emitter.emittedCount());
		return new GeneratedSource(packageName, className, file.toString());
	}

	/**
	 * Builds the boundary and everything below it, then registers each descendant by path.
	 * When two descendants share a path, only the first is registered.
	 */
	private void emitDirectory(GraphEmitter emitter, SourceBuilder body, NameAllocator names, GraphNode boundary, String directoryType) {
		emitter.emitNode(boundary, boundary.name(), true);
		emitter.emitDescendants(boundary);
		emitter.linkParents();
		EmittedNode root = requireNonNull(emitter.emitted(boundary));
		String directoryVar = names.allocate("directory");
		body.blankLine();
		body.declare(directoryType, directoryVar, dialect.newDirectory(directoryType, root.nodeVar()));
		AnchorResolver paths = new AnchorResolver(List.of(boundary));
		Set<String> registered = new HashSet<>();
		registerDescendants(emitter, body, paths, registered, directoryVar, boundary);
		body.blankLine();
		body.returns(directoryVar);
	}

	private void registerDescendants(GraphEmitter emitter, SourceBuilder body, AnchorResolver paths, Set<String> registered, String directoryVar, GraphNode parent) {
		for (GraphNode child : parent.children()) {
			String path = requireNonNull(paths.pathOf(child));
			if (registered.add(path)) {
				EmittedNode emitted = requireNonNull(emitter.emitted(child));
				body.call(dialect.register(directoryVar, JavaLiterals.of(path), emitted.nodeVar()));
			} else {
				LOGGER.warn("Duplicate path \"{}\"; only the first node is registered", path);
			}
			registerDescendants(emitter, body, paths, registered, directoryVar, child);
		}
	}

	private String primaryType(ImportSet imports, EmittedNode root) {
		GraphBehavior primary = root.primary();
		return imports.use(primary == null ? dialect.nodeType() : primary.type());
	}

	private @Nullable String handleOfType(EmittedNode emitted, TypeName type) {
		String var = emitted.behaviorVarOfType(type);
		if (var == null && type.equals(dialect.nodeType())) {
			return emitted.nodeVar();
		}
		return var;
	}

	static final String CREATED_NODES = "createdNodes";
	static final String ANCHORS = "anchors";
	static final String RESULT = "result";

	private static final TypeName LIST = new TypeName("java.util", "List");
	private static final TypeName ARRAY_LIST = new TypeName("java.util", "ArrayList");
	private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

	private static final Logger LOGGER = LoggerFactory.getLogger(SceneCodeGenerator.class);
}
