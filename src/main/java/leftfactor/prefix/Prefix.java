package leftfactor.prefix;

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import leftfactor.grammar.Production;
import leftfactor.grammar.Symbol;

/**
 * A sequence of leading element names, the key of a group in the factoring table.
 *
 * Prefixes compare by their element names, not by their concatenated signature,
 * so "ab c" and "a bc" are different prefixes.
 */
public final class Prefix {

	public static final Prefix EMPTY = new Prefix(ImmutableList.of());

	private final ImmutableList<String> names;

	private Prefix(ImmutableList<String> names) {
		this.names = names;
	}

	public static Prefix of(String... names){
		return new Prefix(ImmutableList.copyOf(names));
	}

	public static Prefix of(List<String> names){
		return new Prefix(ImmutableList.copyOf(names));
	}

	/**
	 * The whole right hand side of the passed alternative
	 */
	public static Prefix of(Production alternative){
		ImmutableList.Builder<String> builder = ImmutableList.builder();
		for (Symbol symbol : alternative.right){
			builder.add(symbol.name);
		}
		return new Prefix(builder.build());
	}

	/**
	 * The key under which a freshly inserted alternative is filed: its elements without the last one,
	 * or the single element itself for an alternative of length one.
	 */
	public static Prefix groupKeyOf(Production alternative){
		Prefix full = of(alternative);
		return full.length() == 1 ? full : full.dropLast();
	}

	public List<String> names(){
		return names;
	}

	public int length(){
		return names.size();
	}

	public boolean isEmpty(){
		return names.isEmpty();
	}

	/**
	 * This prefix without its last element, one symbol shorter.
	 */
	public Prefix dropLast(){
		if (names.isEmpty()){
			return this;
		}
		return new Prefix(names.subList(0, names.size() - 1));
	}

	/**
	 * Is this prefix exactly the right hand side of the passed alternative?
	 */
	public boolean matches(Production alternative){
		if (alternative.right.size() != names.size()){
			return false;
		}
		return isPrefixOf(alternative);
	}

	public boolean isPrefixOf(Production alternative){
		if (alternative.right.size() < names.size()){
			return false;
		}
		for (int i = 0; i < names.size(); i++){
			if (!alternative.right.get(i).name.equals(names.get(i))){
				return false;
			}
		}
		return true;
	}

	/**
	 * Concatenation of the element names
	 */
	public String signature(){
		return String.join("", names);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Prefix && ((Prefix) obj).names.equals(names);
	}

	@Override
	public int hashCode() {
		return names.hashCode();
	}

	@Override
	public String toString() {
		return Joiner.on(" ").join(names);
	}
}
