package leftfactor.grammar;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * A grammar production with a left and a right hand side, one alternative of its left non terminal.
 */
public class Production implements Serializable {

	/**
	 * Id of the production
	 */
	public final int id;
	/**
	 * Left hand side of the production (the associated non terminal)
	 */
	public final NonTerminal left;
	/**
	 * Right hand side of the production, empty for an epsilon production
	 */
	public final ImmutableList<Symbol> right;

	/**
	 * Non terminals used in the right hand side
	 */
	public final List<NonTerminal> nonTerminals;

	/**
	 * Terminals used in the right hand side
	 */
	public final List<Terminal> terminals;

	public Production(int id, NonTerminal left, List<Symbol> right) {
		this.id = id;
		this.left = left;
		this.right = ImmutableList.copyOf(right);
		List<NonTerminal> nonTerminals = new ArrayList<>();
		List<Terminal> terminals = new ArrayList<>();
		for (Symbol symbol : this.right) {
			if (symbol instanceof NonTerminal){
				nonTerminals.add((NonTerminal)symbol);
			} else if (symbol instanceof Terminal){
				terminals.add((Terminal) symbol);
			}
		}
		this.nonTerminals = Collections.unmodifiableList(nonTerminals);
		this.terminals = Collections.unmodifiableList(terminals);
	}

	public String formatRightSide(){
		if (isEpsilonProduction()){
			return "ε";
		}
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < right.size(); i++) {
			builder.append(right.get(i));
			if (i < right.size() - 1) {
				builder.append(" ");
			}
		}
		return builder.toString();
	}

	/**
	 * Concatenation of the names of the right hand side symbols
	 */
	public String signature(){
		StringBuilder builder = new StringBuilder();
		for (Symbol symbol : right) {
			builder.append(symbol.name);
		}
		return builder.toString();
	}

	@Override
	public String toString() {
		return id + " " + (left == null ? "?" : left.toString()) + " → " + formatRightSide();
	}

	public boolean isEpsilonProduction(){
		return right.isEmpty();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Production && ((Production)obj).id == id;
	}

	@Override
	public int hashCode() {
		return id;
	}

	/**
	 * Size of the right hand side.
	 */
	public int rightSize(){
		return right.size();
	}
}
