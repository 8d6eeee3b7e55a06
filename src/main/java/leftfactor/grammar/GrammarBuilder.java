package leftfactor.grammar;

import java.util.*;

import leftfactor.LeftFactorException;

/**
 * Allows the simple creation of grammars.
 *
 * Names declared via {@link #terminals(String...)} are terminals, all other names are non terminals.
 */
public class GrammarBuilder {

	private final Set<String> terminalNames = new LinkedHashSet<>();
	private final Set<String> usedNonTerminals = new LinkedHashSet<>();
	private final Set<String> usedTerminals = new LinkedHashSet<>();
	private final List<String[]> productions = new ArrayList<>();

	/**
	 * Declares the passed names as terminals.
	 *
	 * @return self
	 */
	public GrammarBuilder terminals(String... names){
		for (String name : names){
			if (usedNonTerminals.contains(name)){
				throw new LeftFactorException(String.format("'%s' is already used as a non terminal", name));
			}
			terminalNames.add(name);
		}
		return this;
	}

	public boolean isTerminal(String name){
		return terminalNames.contains(name);
	}

	/**
	 * Adds a new production (and the used terminals and non terminals).
	 *
	 * The entries of the right hand side are names of terminals and non terminals,
	 * "" is equivalent to ε and an empty right hand side is an epsilon production.
	 *
	 * @param left name of the defining non terminal on the left hand side of the production
	 * @param right right hand side of the production
	 * @return self
	 */
	public GrammarBuilder add(String left, String... right){
		if (left == null || left.isEmpty()){
			throw new LeftFactorException("The left hand side of a production needs a name");
		}
		if (isTerminal(left)){
			throw new LeftFactorException(String.format("Ambiguity while building the grammar: '%s' is the name of a terminal and therefore " +
					"can't be used as a non terminal name", left));
		}
		usedNonTerminals.add(left);
		List<String> prod = new ArrayList<>(right.length + 1);
		prod.add(left);
		for (String name : right){
			if (name.isEmpty()){
				continue;
			}
			if (isTerminal(name)){
				usedTerminals.add(name);
			} else {
				usedNonTerminals.add(name);
			}
			prod.add(name);
		}
		productions.add(prod.toArray(new String[0]));
		return this;
	}

	/**
	 * Adds a production for each passed right hand side.
	 *
	 * @return self
	 */
	public GrammarBuilder alternatives(String left, String[]... rights){
		for (String[] right : rights){
			add(left, right);
		}
		return this;
	}

	public Grammar toGrammar(String startNonTerminal) {
		if (!usedNonTerminals.contains(startNonTerminal)){
			throw new LeftFactorException(String.format("Unknown start non terminal '%s'", startNonTerminal));
		}
		Map<String, NonTerminal> nonTerminals = new LinkedHashMap<>();
		Map<String, Terminal> terminals = new LinkedHashMap<>();
		List<Production> productions = new ArrayList<>();
		int id = 0;
		for (String usedTerminal : usedTerminals) {
			terminals.put(usedTerminal, new Terminal(id++, usedTerminal));
		}
		id = 0;
		for (String nonTerminal : usedNonTerminals) {
			nonTerminals.put(nonTerminal, new NonTerminal(id++, nonTerminal));
		}
		id = 0;
		for (String[] prod : this.productions) {
			NonTerminal left = nonTerminals.get(prod[0]);
			List<Symbol> right = new ArrayList<>();
			for (int i = 1; i < prod.length; i++) {
				if (terminals.containsKey(prod[i])) {
					right.add(terminals.get(prod[i]));
				} else {
					right.add(nonTerminals.get(prod[i]));
				}
			}
			Production production = new Production(id++, left, right);
			left.addProduction(production);
			productions.add(production);
		}
		return new Grammar(new ArrayList<>(nonTerminals.values()), new ArrayList<>(terminals.values()),
				nonTerminals.get(startNonTerminal), productions);
	}
}
