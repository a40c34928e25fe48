package works.scenegen.reflect.fixtures;

public class ScoredCard extends Card {
	public long score;
	public double multiplier = 1.0;
}
