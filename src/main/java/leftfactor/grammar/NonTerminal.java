package leftfactor.grammar;

import java.io.Serializable;
import java.util.*;

/**
 * A non terminal symbol with associated productions (its alternatives).
 */
public class NonTerminal extends Symbol implements Serializable {

	/**
	 * List of productions that have this non terminal on their left side, in declaration order.
	 */
	private final List<Production> productions = new ArrayList<>();

	public NonTerminal(int id, String name) {
		super(id, name);
	}

	public List<Production> getProductions(){
		return Collections.unmodifiableList(productions);
	}

	public boolean hasProductions(){
		return !productions.isEmpty();
	}

	public void addProduction(Production production) {
		productions.add(production);
	}

	public boolean hasEpsilonProduction(){
		for (Production production : productions) {
			if (production.isEpsilonProduction()){
				return true;
			}
		}
		return false;
	}

	@Override
	public int compareTo(Symbol o) {
		if (!(o instanceof NonTerminal)){
			return super.compareTo(o);
		}
		return name.compareTo(o.name);
	}
}
