package lambda.hir;

import java.util.ArrayList;
import java.util.List;

/**
 * Tree fixtures shared by the tests.
 */
final class Trees {
	private Trees() {}

	/**
	 * {@code (\x. x) x} evaluated in a one-statement program.
	 */
	static Program identityApplied(Unit unit) {
		Program program = unit.makeProgram();
		program.addStatement(unit.makeEvaluation(
			unit.makeApplication(
				unit.makeAbstraction(unit.makeVariable("x"), unit.makeVariable("x")),
				unit.makeVariable("x"))));
		return program;
	}

	/**
	 * One fresh, parentless node of every kind.
	 */
	static List<Node> oneOfEachKind(Unit unit) {
		List<Node> nodes = new ArrayList<>();
		nodes.add(unit.makeProgram());
		nodes.add(unit.makeVariable("v"));
		nodes.add(unit.makeAbstraction(unit.makeVariable("a"), unit.makeVariable("b")));
		nodes.add(unit.makeApplication(unit.makeVariable("f"), unit.makeVariable("y")));
		nodes.add(unit.makeDefinition(unit.makeVariable("id"),
			unit.makeAbstraction(unit.makeVariable("z"), unit.makeVariable("z"))));
		nodes.add(unit.makeEvaluation(unit.makeVariable("e")));
		return nodes;
	}
}
