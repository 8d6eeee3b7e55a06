package leftfactor.prefix;

import java.util.*;

import com.google.common.collect.ImmutableList;

import leftfactor.AmbiguousSignatureException;
import leftfactor.grammar.Production;

/**
 * Result of the prefix analysis of one non terminal: the alternatives grouped by the longest prefix they share.
 *
 * A group with more than one alternative can be rewritten into its prefix followed by a new non terminal
 * that covers the remainders.
 */
public class FactoringPlan implements Iterable<FactoringPlan.Group> {

	/**
	 * Alternatives sharing a prefix
	 */
	public static class Group {

		public final Prefix prefix;

		public final ImmutableList<Production> alternatives;

		Group(Prefix prefix, List<Production> alternatives) {
			this.prefix = prefix;
			this.alternatives = ImmutableList.copyOf(alternatives);
		}

		/**
		 * Number of leading symbols shared by the alternatives
		 */
		public int sharedLength(){
			return prefix.length();
		}

		public boolean needsFactoring(){
			return alternatives.size() > 1;
		}

		/**
		 * Is one of several alternatives exactly the shared prefix (an ε remainder after factoring)?
		 */
		public boolean hasEpsilonBranch(){
			if (!needsFactoring()){
				return false;
			}
			for (Production alt : alternatives){
				if (prefix.matches(alt)){
					return true;
				}
			}
			return false;
		}

		@Override
		public String toString() {
			StringBuilder builder = new StringBuilder();
			builder.append(prefix).append(" -> [");
			for (int i = 0; i < alternatives.size(); i++){
				if (i != 0){
					builder.append(", ");
				}
				builder.append(alternatives.get(i).formatRightSide());
			}
			builder.append("]");
			if (hasEpsilonBranch()){
				builder.append(" (epsilon)");
			}
			return builder.toString();
		}
	}

	private final ImmutableList<Group> groups;

	FactoringPlan(Map<Prefix, List<Production>> table) {
		ImmutableList.Builder<Group> builder = ImmutableList.builder();
		table.forEach((prefix, alts) -> builder.add(new Group(prefix, alts)));
		this.groups = builder.build();
	}

	public List<Group> getGroups(){
		return groups;
	}

	/**
	 * @param signature concatenated names of the prefix
	 * @return the first group with this signature, if there is one
	 */
	public Optional<Group> getGroup(String signature){
		for (Group group : groups){
			if (group.prefix.signature().equals(signature)){
				return Optional.of(group);
			}
		}
		return Optional.empty();
	}

	public Optional<Group> getGroup(Prefix prefix){
		for (Group group : groups){
			if (group.prefix.equals(prefix)){
				return Optional.of(group);
			}
		}
		return Optional.empty();
	}

	/**
	 * The plan as a map from the prefix signature to the alternatives of the group, in plan order
	 *
	 * @throws AmbiguousSignatureException if two groups have the same signature
	 */
	public Map<String, List<Production>> asMap(){
		Map<String, List<Production>> map = new LinkedHashMap<>();
		Map<String, Prefix> prefixes = new HashMap<>();
		for (Group group : groups){
			String signature = group.prefix.signature();
			if (prefixes.containsKey(signature)){
				throw new AmbiguousSignatureException(signature, prefixes.get(signature).toString(), group.prefix.toString());
			}
			prefixes.put(signature, group.prefix);
			map.put(signature, group.alternatives);
		}
		return Collections.unmodifiableMap(map);
	}

	public int size(){
		return groups.size();
	}

	public int alternativeCount(){
		int count = 0;
		for (Group group : groups){
			count += group.alternatives.size();
		}
		return count;
	}

	public boolean needsFactoring(){
		for (Group group : groups){
			if (group.needsFactoring()){
				return true;
			}
		}
		return false;
	}

	@Override
	public Iterator<Group> iterator() {
		return groups.iterator();
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < groups.size(); i++){
			if (i != 0){
				builder.append("\n");
			}
			builder.append(groups.get(i));
		}
		return builder.toString();
	}
}
