package works.scenegen.codegen;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NameAllocatorTest {

	@ParameterizedTest
	@CsvSource(delimiter = '|', value = {
		"Card!        | card",
		"my_card      | myCard",
		"Play Button  | playButton",
		"hello-world  | helloWorld",
		"_hidden      | hidden",
		"HPBar        | hPBar",
		"2D View      | n2DView",
		"a__b         | aB",
	})
	void sanitize_producesCamelCase(String input, String expected) {
		assertEquals(expected, NameAllocator.sanitize(input));
	}

	@Test
	void sanitize_nothingLeft_placeholder() {
		assertEquals("item", NameAllocator.sanitize(""));
		assertEquals("item", NameAllocator.sanitize("!!! ___"));
	}

	@Test
	void allocate_collision_appendsSuffix() {
		NameAllocator names = new NameAllocator();
		assertEquals("card", names.allocate("Card"));
		assertEquals("card1", names.allocate("card"));
		assertEquals("card2", names.allocate("Card!"));
		assertEquals("card11", names.allocate("card1"));
	}

	@Test
	void allocate_keyword_getsSuffix() {
		NameAllocator names = new NameAllocator();
		assertEquals("class1", names.allocate("class"));
		assertEquals("null1", names.allocate("Null"));
	}

	@Test
	void reserve_preventsAllocation() {
		NameAllocator names = new NameAllocator();
		names.reserve("createdNodes", "anchors");
		assertTrue(names.isUsed("anchors"));
		assertEquals("anchors1", names.allocate("anchors"));
		assertFalse(names.isUsed("result"));
	}

	@Test
	void allocate_separateAllocators_independent() {
		assertEquals("card", new NameAllocator().allocate("card"));
		assertEquals("card", new NameAllocator().allocate("card"));
	}
}
