package codemorph.ast.c;

import codemorph.ast.SourcePosition;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CAssignmentTest {
	private static final SourcePosition AT = new SourcePosition(1, 1);

	private static CIdentifier id(String name) {
		return new CIdentifier(name, AT);
	}

	@Test
	void acceptsIdentifierAndSubscriptTargets() {
		CAssignment plain = new CAssignment("=", id("x"), new CNumberLiteral("1", AT), AT);
		CAssignment element = new CAssignment("+=", new CArraySubscript(id("a"), id("i"), AT), id("x"), AT);

		assertFalse(plain.isCompound());
		assertEquals("", plain.arithmeticOp());
		assertTrue(element.isCompound());
		assertEquals("+", element.arithmeticOp());
	}

	@Test
	void rejectsTargetsThatAreNotLValues() {
		CExpr value = id("x");

		assertThrows(IllegalArgumentException.class,
				() -> new CAssignment("=", new CNumberLiteral("5", AT), value, AT));
		assertThrows(IllegalArgumentException.class,
				() -> new CAssignment("=", new CBinaryExpr("+", id("a"), id("b"), AT), value, AT));
		assertThrows(IllegalArgumentException.class,
				() -> new CAssignment("=", new CFunctionCall("f", List.of(), AT), value, AT));
		assertThrows(IllegalArgumentException.class, () -> new CAssignment("=", null, value, AT));
	}

	@Test
	void numberLiteralKnowsWhetherItIsFloat() {
		assertTrue(new CNumberLiteral("3.14", AT).isFloat());
		assertTrue(new CNumberLiteral("1e5", AT).isFloat());
		assertFalse(new CNumberLiteral("42", AT).isFloat());
	}
}
