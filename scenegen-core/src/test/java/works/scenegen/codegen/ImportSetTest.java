package works.scenegen.codegen;

import java.util.List;
import org.junit.jupiter.api.Test;
import works.scenegen.graph.TypeName;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ImportSetTest {

	@Test
	void use_importsOtherPackages() {
		ImportSet imports = new ImportSet("game.generated", "Layout");
		assertEquals("Card", imports.use(new TypeName("game.cards", "Card")));
		assertEquals("Card", imports.use(new TypeName("game.cards", "Card")));
		assertEquals("String", imports.use(new TypeName("java.lang", "String")));
		assertEquals("Helper", imports.use(new TypeName("game.generated", "Helper")));
		assertEquals(List.of("game.cards.Card"), imports.imports());
	}

	@Test
	void use_clash_fallsBackToQualifiedName() {
		ImportSet imports = new ImportSet("game.generated", "Layout");
		assertEquals("Card", imports.use(new TypeName("game.cards", "Card")));
		assertEquals("other.Card", imports.use(new TypeName("other", "Card")));
		assertEquals("ui.Layout", imports.use(new TypeName("ui", "Layout")));
		assertEquals(List.of("game.cards.Card"), imports.imports());
	}

	@Test
	void use_nestedType_importsOutermost() {
		ImportSet imports = new ImportSet("", "Layout");
		assertEquals("Card.Suit", imports.use(new TypeName("game.cards", "Card.Suit")));
		assertEquals("Card", imports.use(new TypeName("game.cards", "Card")));
		assertEquals("Thing", imports.use(new TypeName("", "Thing")));
		assertEquals(List.of("game.cards.Card"), imports.imports());
	}
}
