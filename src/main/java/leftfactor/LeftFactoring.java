package leftfactor;

import java.util.*;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import leftfactor.grammar.Grammar;
import leftfactor.grammar.NonTerminal;
import leftfactor.grammar.Production;
import leftfactor.prefix.FactoringPlan;
import leftfactor.prefix.PrefixTree;

/**
 * Entry point for computing the factoring plans of non terminals.
 */
public class LeftFactoring {

	private static final Logger LOG = Logger.getLogger(LeftFactoring.class.getName());

	/**
	 * Calculates the factoring plan for the productions of the passed non terminal.
	 *
	 * @throws InvalidAlternativeException if the non terminal has an epsilon production
	 */
	public static FactoringPlan plan(NonTerminal nonTerminal){
		return PrefixTree.build(nonTerminal).calculateFactoringPlan();
	}

	/**
	 * Calculates the factoring plans for all non terminals of the grammar that have non epsilon productions.
	 * Epsilon productions are ignored, they don't share a prefix with anything.
	 *
	 * @return plans in the order of the non terminals in the grammar
	 */
	public static Map<NonTerminal, FactoringPlan> planAll(Grammar grammar){
		List<NonTerminal> nonTerminals = new ArrayList<>();
		for (NonTerminal nonTerminal : grammar.getNonTerminals()){
			if (!nonEpsilonProductions(nonTerminal).isEmpty()){
				nonTerminals.add(nonTerminal);
			}
		}
		Stream<NonTerminal> stream = Config.parallelPlanning() ? nonTerminals.parallelStream() : nonTerminals.stream();
		List<FactoringPlan> plans = stream
				.map(nonTerminal -> new PrefixTree(nonEpsilonProductions(nonTerminal)).calculateFactoringPlan())
				.collect(Collectors.toList());
		Map<NonTerminal, FactoringPlan> result = new LinkedHashMap<>();
		for (int i = 0; i < nonTerminals.size(); i++){
			result.put(nonTerminals.get(i), plans.get(i));
		}
		LOG.fine(() -> String.format("Planned %d non terminals, %d need factoring", result.size(),
				result.values().stream().filter(FactoringPlan::needsFactoring).count()));
		return result;
	}

	private static List<Production> nonEpsilonProductions(NonTerminal nonTerminal){
		List<Production> productions = new ArrayList<>();
		for (Production production : nonTerminal.getProductions()){
			if (production.isEpsilonProduction()){
				LOG.finer(() -> "Ignoring epsilon production " + production);
			} else {
				productions.add(production);
			}
		}
		return productions;
	}
}
