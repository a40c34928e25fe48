package works.scenegen.reflect;

import java.lang.reflect.Field;
import java.util.List;
import org.junit.jupiter.api.Test;
import works.scenegen.reflect.fixtures.Card;
import works.scenegen.reflect.fixtures.ScoredCard;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ReflectionHelpersTest {

	@SuppressWarnings("unused")
	static class FieldsOutOfOrder {
		int zeta;
		String alpha;
		static long middle;
		Object beta;
	}

	@Test
	void getDeclaredFieldsInOrder_correctOrder() throws NoSuchFieldException {
		List<Field> actual = ReflectionHelpers.getDeclaredFieldsInOrder(FieldsOutOfOrder.class);
		List<Field> expected = List.of(
			FieldsOutOfOrder.class.getDeclaredField("zeta"),
			FieldsOutOfOrder.class.getDeclaredField("alpha"),
			FieldsOutOfOrder.class.getDeclaredField("middle"),
			FieldsOutOfOrder.class.getDeclaredField("beta")
		);
		assertEquals(expected, actual);
	}

	@Test
	void getDeclaredFieldsInOrder_worksWithRecords() throws NoSuchFieldException {
		record Span(float end, float start) { }
		List<Field> actual = ReflectionHelpers.getDeclaredFieldsInOrder(Span.class);
		assertEquals(List.of("end", "start"), names(actual));
		assertEquals(Span.class.getDeclaredField("end"), actual.get(0));
	}

	@Test
	void getDeclaredFieldsInOrder_ignoresInheritedFields() {
		List<Field> actual = ReflectionHelpers.getDeclaredFieldsInOrder(ScoredCard.class);
		assertEquals(List.of("score", "multiplier"), names(actual));
	}

	@Test
	void getDeclaredFieldsInOrder_includesNonPublicFields() {
		List<String> actual = names(ReflectionHelpers.getDeclaredFieldsInOrder(Card.class));
		assertEquals(List.of("instances", "cachedScore", "hidden"), actual.subList(actual.size() - 3, actual.size()));
	}

	@Test
	void getDeclaredFieldsInOrder_noClassFile_fallsBack() {
		Runnable lambda = () -> { };
		assertEquals(List.of(), ReflectionHelpers.getDeclaredFieldsInOrder(lambda.getClass()));
	}

	private static List<String> names(List<Field> fields) {
		return fields.stream().map(Field::getName).toList();
	}
}
