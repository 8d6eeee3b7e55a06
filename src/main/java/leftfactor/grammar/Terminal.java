package leftfactor.grammar;

import java.io.Serializable;

/**
 * A terminal symbol
 */
public class Terminal extends Symbol implements Serializable {

	public Terminal(int id, String name) {
		super(id, name);
	}

	@Override
	public int compareTo(Symbol o) {
		if (!(o instanceof Terminal)){
			return super.compareTo(o);
		}
		return Integer.compare(id, o.id);
	}
}
