package works.scenegen.emit;

import org.jetbrains.annotations.Nullable;
import works.scenegen.codegen.ImportSet;
import works.scenegen.codegen.NameAllocator;
import works.scenegen.codegen.SourceBuilder;

import static java.util.Objects.requireNonNull;

/**
 * The generated method a {@link GraphEmitter} writes its statements into.
 *
 * @param createdNodes the name of the list parameter that collects every constructed node
 * @param anchors the name of the anchor container parameter, or null if the method has none
 */
public record MethodScope(
	NameAllocator names,
	ImportSet imports,
	SourceBuilder out,
	String createdNodes,
	@Nullable String anchors
) {
	public MethodScope {
		requireNonNull(names);
		requireNonNull(imports);
		requireNonNull(out);
		requireNonNull(createdNodes);
	}
}
