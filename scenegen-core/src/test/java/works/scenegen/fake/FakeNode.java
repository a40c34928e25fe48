package works.scenegen.fake;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import works.scenegen.graph.Frame;
import works.scenegen.graph.Frame.SpatialFrame;
import works.scenegen.graph.GraphNode;
import works.scenegen.graph.TypeName;

public final class FakeNode implements GraphNode {
	private final String name;
	private FakeNode parent;
	private final List<FakeNode> children = new ArrayList<>();
	private final List<FakeBehavior> behaviors = new ArrayList<>();
	private Frame frame = SpatialFrame.DEFAULT;

	public FakeNode(String name) {
		this.name = name;
	}

	public FakeNode child(String childName) {
		FakeNode result = new FakeNode(childName);
		result.parent = this;
		children.add(result);
		return result;
	}

	public FakeBehavior add(TypeName type) {
		FakeBehavior result = new FakeBehavior(this, type);
		behaviors.add(result);
		return result;
	}

	public FakeNode frame(Frame frame) {
		this.frame = frame;
		return this;
	}

	@Override
	public String name() {
		return name;
	}

	@Override
	public @Nullable FakeNode parent() {
		return parent;
	}

	@Override
	public List<FakeNode> children() {
		return children;
	}

	@Override
	public Frame frame() {
		return frame;
	}

	@Override
	public List<FakeBehavior> behaviors() {
		return behaviors;
	}

	@Override
	public String toString() {
		return "FakeNode(" + name + ")";
	}
}
