package works.scenegen.reflect.fixtures;

public record Insets(float left, float right) { }
