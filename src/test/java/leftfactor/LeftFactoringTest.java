package leftfactor;

import java.nio.file.Paths;
import java.util.*;

import org.junit.jupiter.api.Test;

import leftfactor.grammar.Grammar;
import leftfactor.grammar.GrammarReader;
import leftfactor.grammar.NonTerminal;
import leftfactor.prefix.FactoringPlan;

import static leftfactor.GrammarFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class LeftFactoringTest {

	private Grammar exprGrammar() throws Exception {
		return new GrammarReader().read(Paths.get(getClass().getResource("/grammars/expr.grammar").toURI()));
	}

	@Test
	public void testPlan(){
		FactoringPlan plan = LeftFactoring.plan(fromChars("ab", "abc", "abd", "x"));
		assertEquals("ab=abc,abd,ab ; x=x", render(plan));
	}

	@Test
	public void testPlanRejectsEpsilonProductions(){
		NonTerminal nonTerminal = fromChars("ab", "");
		assertThrows(InvalidAlternativeException.class, () -> LeftFactoring.plan(nonTerminal));
	}

	@Test
	public void testPlanAll() throws Exception {
		Grammar grammar = exprGrammar();
		Map<NonTerminal, FactoringPlan> plans = LeftFactoring.planAll(grammar);
		assertEquals(grammar.getNonTerminals(), new ArrayList<>(plans.keySet()));
		assertEquals("term -> [term, term PLUS expr, term MINUS expr] (epsilon)",
				plans.get(grammar.getNonTerminal("expr")).toString());
		assertEquals("factor -> [factor, factor STAR term] (epsilon)",
				plans.get(grammar.getNonTerminal("term")).toString());
		assertEquals("ID -> [ID, ID LPAREN args RPAREN] (epsilon)\nLPAREN expr RPAREN -> [LPAREN expr RPAREN]",
				plans.get(grammar.getNonTerminal("factor")).toString());
	}

	@Test
	public void testPlanAllIgnoresEpsilonProductions() throws Exception {
		Grammar grammar = exprGrammar();
		FactoringPlan args = LeftFactoring.planAll(grammar).get(grammar.getNonTerminal("args"));
		assertEquals(2, args.alternativeCount());
		assertEquals("expr -> [expr, expr COMMA args] (epsilon)", args.toString());
	}

	@Test
	public void testPlanAllSkipsEpsilonOnlyNonTerminals(){
		Grammar grammar = new GrammarReader().read("S = a E | a\nE = ε\n");
		Map<NonTerminal, FactoringPlan> plans = LeftFactoring.planAll(grammar);
		assertEquals(Collections.singleton(grammar.getNonTerminal("S")), plans.keySet());
	}

	@Test
	public void testParallelPlanningGivesTheSameResult() throws Exception {
		Grammar grammar = exprGrammar();
		Map<NonTerminal, FactoringPlan> sequential = LeftFactoring.planAll(grammar);
		String old = Config.get("parallelPlanning");
		try {
			Config.set("parallelPlanning", "yes");
			Map<NonTerminal, FactoringPlan> parallel = LeftFactoring.planAll(grammar);
			assertEquals(new ArrayList<>(sequential.keySet()), new ArrayList<>(parallel.keySet()));
			for (NonTerminal nonTerminal : sequential.keySet()){
				assertEquals(render(sequential.get(nonTerminal)), render(parallel.get(nonTerminal)));
			}
		} finally {
			Config.set("parallelPlanning", old);
		}
	}
}
