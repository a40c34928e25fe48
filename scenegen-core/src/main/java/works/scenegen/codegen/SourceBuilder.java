package works.scenegen.codegen;

/**
 * Accumulates lines of Java source with tab indentation.
 * <p>
 * Text is only ever appended, so callers emit statements in their final order.
 */
public final class SourceBuilder {
	private final StringBuilder text = new StringBuilder();
	private int depth;

	public SourceBuilder() {
		this(0);
	}

	public SourceBuilder(int initialDepth) {
		if (initialDepth < 0) {
			throw new IllegalArgumentException("Negative depth: " + initialDepth);
		}
		this.depth = initialDepth;
	}

	public int depth() {
		return depth;
	}

	public SourceBuilder line(String line) {
		if (line.isEmpty()) {
			return blankLine();
		}
		text.append("\t".repeat(depth)).append(line).append('\n');
		return this;
	}

	public SourceBuilder blankLine() {
		text.append('\n');
		return this;
	}

	/**
	 * Emits {@code header {} and indents what follows.
	 */
	public SourceBuilder openBlock(String header) {
		line(header + " {");
		depth++;
		return this;
	}

	/**
	 * Emits a closing brace one level out. At depth zero, the brace stays at depth zero.
	 */
	public SourceBuilder closeBlock() {
		if (depth > 0) {
			depth--;
		}
		return line("}");
	}

	public SourceBuilder declare(String type, String name, String initializer) {
		return line(type + " " + name + " = " + initializer + ";");
	}

	public SourceBuilder assign(String target, String value) {
		return line(target + " = " + value + ";");
	}

	public SourceBuilder call(String expression) {
		return line(expression + ";");
	}

	public SourceBuilder returns(String expression) {
		return line("return " + expression + ";");
	}

	public SourceBuilder comment(String comment) {
		return line("// " + comment);
	}

	/**
	 * Appends everything {@code other} has accumulated, as-is.
	 * {@code other} carries its own indentation.
	 */
	public SourceBuilder include(SourceBuilder other) {
		text.append(other.text);
		return this;
	}

	public boolean isEmpty() {
		return text.length() == 0;
	}

	@Override
	public String toString() {
		return text.toString();
	}
}
