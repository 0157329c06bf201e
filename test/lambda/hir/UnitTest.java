package lambda.hir;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class UnitTest {

	@Test
	void variables_shareInternedSymbols() {
		Unit unit = new Unit("symbols");
		Variable a = unit.makeVariable("x");
		Variable b = unit.makeVariable("x");
		Variable c = unit.makeVariable("y");
		assertNotSame(a, b);
		assertSame(a.getSymbol(), b.getSymbol());
		assertNotSame(a.getSymbol(), c.getSymbol());
		assertEquals("x", a.getName());
		assertSame(a.getSymbol(), unit.getSymbolTable().lookup("x"));
		assertEquals(2, unit.getSymbolTable().size());
	}

	@Test
	void units_canShareSymbolTable() {
		SymbolTable table = new SymbolTable();
		Variable a = new Unit("one", table).makeVariable("f");
		Variable b = new Unit("two", table).makeVariable("f");
		assertSame(a.getSymbol(), b.getSymbol());
		assertNotSame(a.getSymbol(), new Unit("three").makeVariable("f").getSymbol());
	}

	@Test
	void factories_stampLocation() {
		Unit unit = new Unit("located.lc");
		Location loc = Location.of("located.lc", 2, 5);
		Variable x = unit.makeVariable("x", loc);
		Evaluation eval = unit.makeEvaluation(x, Location.of("located.lc", 2, 1));
		assertEquals(loc, x.getLocation());
		assertEquals(2, eval.getLocation().getLine());
		assertEquals(1, eval.getLocation().getColumn());
		assertEquals("located.lc", eval.getLocation().getFile());
	}

	@Test
	void factories_leaveUnknownLocationSettable() {
		Unit unit = new Unit(null);
		Program program = unit.makeProgram(Location.UNKNOWN);
		program.setLocation(Location.of(null, 1, 1));
		assertEquals("1:1", program.getLocation().toString());
		assertThrows(IllegalArgumentException.class, () -> unit.makeProgram(null));
	}

	@Test
	void factories_produceExpectedKinds() {
		Unit unit = new Unit("kinds");
		Variable v = unit.makeVariable("v");
		assertEquals(NodeKind.VARIABLE, v.getKind());
		Abstraction abs = unit.makeAbstraction(v, unit.makeVariable("w"));
		assertEquals(NodeKind.ABSTRACTION, abs.getKind());
		Application app = unit.makeApplication(abs, unit.makeVariable("u"));
		assertEquals(NodeKind.APPLICATION, app.getKind());
		Definition def = unit.makeDefinition(unit.makeVariable("d"), app);
		assertEquals(NodeKind.DEFINITION, def.getKind());
		Evaluation eval = unit.makeEvaluation(unit.makeVariable("e"));
		assertEquals(NodeKind.EVALUATION, eval.getKind());
		assertEquals(NodeKind.PROGRAM, unit.makeProgram().getKind());
	}

	@Test
	void symbolTable_rejectsEmptyNames() {
		SymbolTable table = new SymbolTable();
		assertThrows(IllegalArgumentException.class, () -> table.intern(""));
		assertThrows(IllegalArgumentException.class, () -> table.intern(null));
		assertNull(table.lookup("missing"));
		assertThrows(IllegalArgumentException.class, () -> new Unit("bad", null));
	}

	@Test
	void location_valueSemantics() {
		assertEquals(Location.of("f", 1, 2), Location.of("f", 1, 2));
		assertEquals(Location.of("f", 1, 2).hashCode(), Location.of("f", 1, 2).hashCode());
		assertEquals("f:1:2", Location.of("f", 1, 2).toString());
		assertEquals("<unknown>", Location.UNKNOWN.toString());
		assertThrows(IllegalArgumentException.class, () -> Location.of("f", 0, 1));
		assertThrows(IllegalArgumentException.class, () -> Location.of("f", 1, -3));
	}

	@Test
	void toString_namesNode() {
		Unit unit = new Unit("names");
		Variable x = unit.makeVariable("x");
		assertEquals("x", x.toString());
		Evaluation eval = unit.makeEvaluation(x, Location.of("names", 4, 2));
		assertEquals("Evaluation at names:4:2", eval.toString());
		assertEquals("Program", unit.makeProgram().toString());
	}
}
