package leftfactor.grammar;

import java.io.Serializable;

/**
 * Base class for terminal symbols and non terminal symbols.
 *
 * Prefix trees only look at the name of a symbol: two symbols with the same name are the same
 * element of an alternative.
 */
public abstract class Symbol implements Serializable, Comparable<Symbol> {

	public final int id;

	/**
	 * Name of the symbol, used to build signatures and prefixes
	 */
	public final String name;

	protected Symbol(int id, String name) {
		this.id = id;
		this.name = name;
	}

	@Override
	public int hashCode() {
		if (this instanceof NonTerminal){
			return id + 1;
		}
		return -id - 1;
	}

	@Override
	public boolean equals(Object obj) {
		return obj != null && obj.hashCode() == this.hashCode() && (obj.getClass() == this.getClass());
	}

	@Override
	public String toString() {
		return name;
	}

	@Override
	public int compareTo(Symbol o) {
		return Integer.compare(hashCode(), o.hashCode());
	}
}
