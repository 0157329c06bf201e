package lambda.hir;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IRToolsTest {
	static final List<Class<? extends Node>> TARGETS = List.of(
		Node.class,
		Term.class,
		Statement.class,
		Program.class,
		Variable.class,
		Abstraction.class,
		Application.class,
		Definition.class,
		Evaluation.class,
		AbstractNode.class,
		BinaryNode.class,
		MultiNode.class,
		ApplicationNode.class,
		VariableNode.class);

	Unit unit;

	@BeforeEach
	void setUp() {
		unit = new Unit("tools");
	}

	@Test
	void as_presentExactlyWhenNodeIsTarget() {
		for (Node node : Trees.oneOfEachKind(unit)) {
			for (Class<? extends Node> target : TARGETS) {
				boolean expected = target.isInstance(node);
				if (target.isInterface()) {
					assertEquals(expected, node.getKind().conformsTo(target), node.getKind() + " conforms to " + target.getSimpleName());
				}
				assertEquals(expected, IRTools.is(target, node), node.getKind() + " is " + target.getSimpleName());
				Node narrowed = IRTools.as(target, node);
				if (expected) {
					assertSame(node, narrowed);
				} else {
					assertNull(narrowed);
				}
			}
		}
	}

	@Test
	void as_onApplication() {
		Application app = unit.makeApplication(unit.makeVariable("f"), unit.makeVariable("a"));
		assertNull(IRTools.as(Variable.class, app));
		assertFalse(IRTools.is(Variable.class, app));
		Term term = IRTools.as(Term.class, app);
		assertSame(app, term);
		assertFalse(IRTools.is(Statement.class, app));
	}

	@Test
	void as_onImplementationAndShapeClasses() {
		Application app = unit.makeApplication(unit.makeVariable("f"), unit.makeVariable("a"));
		assertSame(app, IRTools.as(ApplicationNode.class, app));
		assertTrue(IRTools.is(BinaryNode.class, app));
		assertTrue(IRTools.is(AbstractNode.class, app));
		assertFalse(IRTools.is(UnaryNode.class, app));
		assertNull(IRTools.as(AbstractionNode.class, app));
		assertSame(app.getFunction(), IRTools.as(NullaryNode.class, app.getFunction()));
	}

	@Test
	void as_ofNullIsAbsent() {
		assertNull(IRTools.as(Term.class, null));
		assertFalse(IRTools.is(Term.class, null));
	}

	@Test
	void kinds_matchCategories() {
		assertTrue(NodeKind.VARIABLE.isTerm());
		assertTrue(NodeKind.ABSTRACTION.isTerm());
		assertTrue(NodeKind.APPLICATION.isTerm());
		assertTrue(NodeKind.DEFINITION.isStatement());
		assertTrue(NodeKind.EVALUATION.isStatement());
		assertFalse(NodeKind.PROGRAM.isTerm());
		assertFalse(NodeKind.PROGRAM.isStatement());
		for (NodeKind kind : NodeKind.values()) {
			assertFalse(kind.isTerm() && kind.isStatement(), kind.name());
		}
	}

	@Test
	void eachNode_reportsItsOwnKind() {
		List<Node> nodes = Trees.oneOfEachKind(unit);
		assertEquals(NodeKind.values().length, nodes.size());
		for (int i = 0; i < nodes.size(); i++) {
			assertEquals(NodeKind.values()[i], nodes.get(i).getKind());
			assertTrue(nodes.get(i).getKind().getType().isInstance(nodes.get(i)));
		}
	}

	@Test
	void getAncestorOfType_findsClosest() {
		Program program = Trees.identityApplied(unit);
		Evaluation eval = (Evaluation) program.getStatements().get(0);
		Application app = (Application) eval.getTerm();
		Abstraction abs = (Abstraction) app.getFunction();
		Variable bound = abs.getVariable();

		assertSame(abs, IRTools.getAncestorOfType(bound, Term.class));
		assertSame(eval, IRTools.getAncestorOfType(bound, Statement.class));
		assertSame(program, IRTools.getAncestorOfType(bound, Program.class));
		assertNull(IRTools.getAncestorOfType(bound, Definition.class));
		assertNull(IRTools.getAncestorOfType(program, Node.class));
	}

	@Test
	void isAncestorOf_isProper() {
		Program program = Trees.identityApplied(unit);
		Evaluation eval = (Evaluation) program.getStatements().get(0);
		Node leaf = ((Application) eval.getTerm()).getArgument();
		assertTrue(IRTools.isAncestorOf(program, leaf));
		assertTrue(IRTools.isAncestorOf(eval, leaf));
		assertFalse(IRTools.isAncestorOf(leaf, leaf));
		assertFalse(IRTools.isAncestorOf(leaf, program));
		assertSame(program, IRTools.getRoot(leaf));
		assertSame(program, IRTools.getRoot(program));
	}

	@Test
	void countKinds_ofScenarioTree() {
		Map<NodeKind, Integer> counts = IRTools.countKinds(Trees.identityApplied(unit));
		assertEquals(Map.of(
			NodeKind.PROGRAM, 1,
			NodeKind.EVALUATION, 1,
			NodeKind.APPLICATION, 1,
			NodeKind.ABSTRACTION, 1,
			NodeKind.VARIABLE, 3), counts);
	}
}
