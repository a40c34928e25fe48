package works.scenegen.reflect.fixtures;

public interface Clickable {
	void click();
}
