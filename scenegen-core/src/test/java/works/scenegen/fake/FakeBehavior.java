package works.scenegen.fake;

import java.util.ArrayList;
import java.util.List;
import works.scenegen.graph.FieldValue;
import works.scenegen.graph.GraphBehavior;
import works.scenegen.graph.ReflectedField;
import works.scenegen.graph.TypeName;

public final class FakeBehavior implements GraphBehavior {
	private final FakeNode node;
	private final TypeName type;
	private final List<ReflectedField> fields = new ArrayList<>();

	FakeBehavior(FakeNode node, TypeName type) {
		this.node = node;
		this.type = type;
	}

	public FakeBehavior set(String name, FieldValue value) {
		fields.add(ReflectedField.topLevel(name, value));
		return this;
	}

	public FakeBehavior setNested(String path, FieldValue value) {
		fields.add(new ReflectedField(path.substring(path.lastIndexOf('.') + 1), path, value));
		return this;
	}

	public List<ReflectedField> fields() {
		return fields;
	}

	@Override
	public FakeNode node() {
		return node;
	}

	@Override
	public TypeName type() {
		return type;
	}

	@Override
	public String toString() {
		return "FakeBehavior(" + type.simpleName() + "@" + node.name() + ")";
	}
}
