package leftfactor.grammar;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Joiner;

import leftfactor.LeftFactorException;

/**
 * Grammar consisting of terminals, non terminals and productions.
 *
 * Use the {@link GrammarBuilder} or the {@link GrammarReader} to build a grammar instance properly.
 */
public class Grammar implements Serializable {

	/**
	 * Non terminals in the grammar, in the order of their first use
	 */
	private final List<NonTerminal> nonTerminals;

	private final List<Terminal> terminals;

	private final List<Production> productions;

	private final NonTerminal start;

	/**
	 * Create a new Grammar object
	 *
	 * @param nonTerminals used non terminals
	 * @param terminals used terminals
	 * @param start start non terminal
	 * @param productions productions, each one is already registered at its left non terminal
	 */
	public Grammar(List<NonTerminal> nonTerminals, List<Terminal> terminals, NonTerminal start,
	               List<Production> productions) {
		this.nonTerminals = Collections.unmodifiableList(nonTerminals);
		this.terminals = Collections.unmodifiableList(terminals);
		this.productions = Collections.unmodifiableList(productions);
		this.start = start;
	}

	public NonTerminal getStart(){
		return start;
	}

	public List<NonTerminal> getNonTerminals(){
		return nonTerminals;
	}

	public List<Terminal> getTerminals(){
		return terminals;
	}

	public List<Production> getProductions(){
		return productions;
	}

	public boolean hasNonTerminal(String name){
		for (NonTerminal nonTerminal : nonTerminals){
			if (nonTerminal.name.equals(name)){
				return true;
			}
		}
		return false;
	}

	/**
	 * @throws LeftFactorException if there is no such non terminal
	 */
	public NonTerminal getNonTerminal(String name){
		for (NonTerminal nonTerminal : nonTerminals){
			if (nonTerminal.name.equals(name)){
				return nonTerminal;
			}
		}
		throw new LeftFactorException("No such non terminal " + name);
	}

	public String longDescription(){
		return "Start non terminal: " + start + "\n" +
				"NonTerminals: " + nonTerminals + "\n" +
				"Terminals: " + terminals + "\n" +
				"Productions: \n" + Joiner.on("\n").join(productions);
	}

	@Override
	public String toString() {
		return longDescription();
	}
}
