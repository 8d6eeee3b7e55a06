package leftfactor.prefix;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.collect.ImmutableList;

import leftfactor.Config;
import leftfactor.InvalidAlternativeException;
import leftfactor.InvariantViolationError;
import leftfactor.grammar.NonTerminal;
import leftfactor.grammar.Production;

/**
 * Prefix forest to implement longest prefix matching for left factoring.
 *
 * Pass it the alternatives of a non terminal: each alternative is inserted along the path of its leading
 * symbols (without its last one) and filed in the factoring table under the same prefix. Calling
 * {@link #calculateFactoringPlan()} then merges over-narrow groups into their parents and moves leftovers
 * (alternatives that are exactly the prefix of another group) into that group.
 *
 * Instances aren't thread safe, use one tree per non terminal.
 */
public class PrefixTree {

	private static final Logger LOG = Logger.getLogger(PrefixTree.class.getName());

	/**
	 * Roots by the name of the first symbol
	 */
	private final Map<String, PrefixNode> roots = new LinkedHashMap<>();

	/**
	 * Table of factored out alternatives: prefix → alternatives sharing it
	 */
	private final Map<Prefix, List<Production>> factoredTable = new LinkedHashMap<>();

	private final ImmutableList<Production> alternatives;

	/**
	 * Alternatives inserted so far
	 */
	private final List<Production> inserted = new ArrayList<>();

	private FactoringPlan factoringPlan;

	/**
	 * Creates the prefix tree for the productions of the passed non terminal
	 *
	 * @throws InvalidAlternativeException if one of the productions is an epsilon production
	 */
	public PrefixTree(NonTerminal nonTerminal) {
		this(nonTerminal.getProductions());
	}

	/**
	 * Creates the prefix tree for the passed alternatives
	 *
	 * @throws InvalidAlternativeException if one of the alternatives has no elements
	 */
	public PrefixTree(List<Production> alternatives) {
		this.alternatives = ImmutableList.copyOf(alternatives);
		createTree();
	}

	public static PrefixTree build(NonTerminal nonTerminal){
		return new PrefixTree(nonTerminal);
	}

	private void createTree(){
		for (Production alt : alternatives){
			if (alt.isEpsilonProduction()){
				throw new InvalidAlternativeException(alt, "an alternative needs at least one element");
			}
			String head = alt.right.get(0).name;
			PrefixNode node = roots.computeIfAbsent(head, name -> new PrefixNode(name, 0, null));
			createChain(node, alt);
		}
		if (LOG.isLoggable(Level.FINE)){
			LOG.fine(String.format("Created prefix tree with %d roots for %d alternatives, table: %s",
					roots.size(), alternatives.size(), factoredTable));
		}
	}

	/**
	 * Walks down (and creates) the chain of nodes for the inner symbols of the alternative and stores
	 * the alternative at the end of the chain. The last symbol never gets a node.
	 */
	private void createChain(PrefixNode startNode, Production alt){
		PrefixNode node = startNode;
		for (int i = 1; i < alt.right.size() - 1; i++){
			String label = alt.right.get(i).name;
			PrefixNode child = node.getChildNamed(label);
			if (child == null){
				child = node.addChild(label);
			}
			node = child;
		}
		node.alts.add(alt);
		factoredTable.computeIfAbsent(Prefix.groupKeyOf(alt), k -> new ArrayList<>()).add(alt);
		inserted.add(alt);
		checkInvariants(true);
	}

	/**
	 * Returns the groups of alternatives that can be factored out.
	 *
	 * The first call contracts the tree and reconciles the leftovers, later calls return the same plan.
	 */
	public FactoringPlan calculateFactoringPlan(){
		if (factoringPlan != null){
			return factoringPlan;
		}
		createConstellations();
		addLeftovers();
		settleSingletons();
		factoringPlan = new FactoringPlan(factoredTable);
		return factoringPlan;
	}

	/**
	 * Reduces the number of groups by moving the single alternative of a node to its parent,
	 * i.e. for "a b c | a x" the alternative "a b c" is moved from the node "a b" to the node "a".
	 * Chains of single alternative nodes collapse one level per node, children first.
	 */
	void createConstellations(){
		for (PrefixNode root : roots.values()){
			for (PrefixNode node : postOrder(root)){
				if (node.isRoot() || node.alts.size() != 1){
					continue;
				}
				promote(node);
			}
		}
	}

	private void promote(PrefixNode node){
		Production alt = node.alts.get(0);
		Prefix childKey = node.path();
		Prefix parentKey = childKey.dropLast();
		List<Production> childGroup = factoredTable.get(childKey);
		if (childGroup == null || !removeIdentical(childGroup, alt)){
			throw new InvariantViolationError(String.format("Alternative %s of node '%s' isn't filed under '%s'",
					alt, childKey, childKey));
		}
		if (!childGroup.isEmpty()){
			throw new InvariantViolationError(String.format("Group '%s' holds %s besides the promoted %s",
					childKey, childGroup, alt));
		}
		node.parent.alts.add(alt);
		node.alts.clear();
		factoredTable.computeIfAbsent(parentKey, k -> new ArrayList<>()).add(alt);
		factoredTable.remove(childKey);
		LOG.finer(() -> String.format("Moved %s from '%s' to '%s'", alt, childKey, parentKey));
		checkInvariants(true);
	}

	/**
	 * Get the leftovers, those who have an exact match with another prefix,
	 * i.e. for "a b | a b c | a b d" the alternative "a b" is filed under "a" and the other two under "a b",
	 * so "a b" is moved to the group "a b" (where it becomes the epsilon branch of the new non terminal).
	 *
	 * Shorter keys are processed first, so every move is a single step.
	 */
	void addLeftovers(){
		List<Prefix> keys = new ArrayList<>(factoredTable.keySet());
		keys.sort(Comparator.comparingInt(Prefix::length));
		for (Prefix key : keys){
			Prefix leftoverKey = key.dropLast();
			if (leftoverKey.isEmpty()){
				continue;
			}
			List<Production> leftovers = factoredTable.get(leftoverKey);
			if (leftovers == null){
				continue;
			}
			List<Production> group = factoredTable.get(key);
			if (group == null){
				throw new InvariantViolationError(String.format("Group '%s' vanished before it was processed", key));
			}
			Iterator<Production> iterator = leftovers.iterator();
			while (iterator.hasNext()){
				Production alt = iterator.next();
				if (key.matches(alt)){
					iterator.remove();
					group.add(alt);
					LOG.finer(() -> String.format("Moved leftover %s from '%s' to '%s'", alt, leftoverKey, key));
				}
			}
			if (leftovers.isEmpty()){
				factoredTable.remove(leftoverKey);
			}
			checkInvariants(false);
		}
	}

	/**
	 * A group with a single alternative doesn't share anything: it's keyed by the whole alternative.
	 * If a group with that key already exists, the alternative is a leftover of it and joins it.
	 */
	void settleSingletons(){
		Map<Prefix, List<Production>> settled = new LinkedHashMap<>();
		List<Production> joining = new ArrayList<>();
		for (Map.Entry<Prefix, List<Production>> entry : factoredTable.entrySet()){
			Prefix key = entry.getKey();
			List<Production> group = entry.getValue();
			if (group.size() == 1){
				Prefix full = Prefix.of(group.get(0));
				if (!full.equals(key)){
					List<Production> target = factoredTable.get(full);
					if (target != null && target.size() > 1){
						joining.add(group.get(0));
						continue;
					}
					key = full;
				}
			}
			settled.computeIfAbsent(key, k -> new ArrayList<>()).addAll(group);
		}
		for (Production alt : joining){
			settled.get(Prefix.of(alt)).add(alt);
			LOG.finer(() -> String.format("Leftover %s joins the group '%s'", alt, Prefix.of(alt)));
		}
		factoredTable.clear();
		factoredTable.putAll(settled);
		checkInvariants(false);
	}

	/**
	 * @return the root for the passed first symbol, if there is one
	 */
	public Optional<PrefixNode> root(String name){
		return Optional.ofNullable(roots.get(name));
	}

	public Collection<PrefixNode> getRoots(){
		return Collections.unmodifiableCollection(roots.values());
	}

	/**
	 * Gets the alternatives stored at the nodes with the passed label, searching the subtree of the
	 * passed node. The search doesn't descend below a matching node.
	 *
	 * @return alternatives, empty if no node matches
	 */
	public List<Production> alternativesUnder(PrefixNode startNode, String label){
		if (startNode.label.equals(label)){
			return startNode.getAlts();
		}
		List<Production> alts = new ArrayList<>();
		for (PrefixNode child : startNode.getChildren()){
			alts.addAll(alternativesUnder(child, label));
		}
		return alts;
	}

	/**
	 * Current state of the factoring table
	 */
	public Map<Prefix, List<Production>> getFactoringTable(){
		Map<Prefix, List<Production>> copy = new LinkedHashMap<>();
		factoredTable.forEach((key, group) -> copy.put(key, Collections.unmodifiableList(new ArrayList<>(group))));
		return Collections.unmodifiableMap(copy);
	}

	public List<Production> getAlternatives(){
		return alternatives;
	}

	/**
	 * Nodes of the subtree, children before their parents and siblings in insertion order.
	 */
	static List<PrefixNode> postOrder(PrefixNode root){
		Deque<PrefixNode> stack = new ArrayDeque<>();
		LinkedList<PrefixNode> order = new LinkedList<>();
		stack.push(root);
		while (!stack.isEmpty()){
			PrefixNode node = stack.pop();
			order.addFirst(node);
			for (PrefixNode child : node.getChildren()){
				stack.push(child);
			}
		}
		return order;
	}

	private static boolean removeIdentical(List<Production> alts, Production alt){
		Iterator<Production> iterator = alts.iterator();
		while (iterator.hasNext()){
			if (iterator.next() == alt){
				iterator.remove();
				return true;
			}
		}
		return false;
	}

	/**
	 * Checks that each inserted alternative is in exactly one group of the table (and, if the tree is
	 * still in sync with the table, at exactly one node, that is filed under the path of the node).
	 */
	private void checkInvariants(boolean withTree){
		if (!Config.checkInvariants()){
			return;
		}
		List<Production> filed = new ArrayList<>();
		for (Map.Entry<Prefix, List<Production>> entry : factoredTable.entrySet()){
			if (entry.getKey().isEmpty() || entry.getValue().isEmpty()){
				throw new InvariantViolationError(String.format("Empty key or group in the factoring table: '%s' → %s",
						entry.getKey(), entry.getValue()));
			}
			filed.addAll(entry.getValue());
		}
		if (!sameAlternatives(inserted, filed)){
			throw new InvariantViolationError(String.format("The factoring table %s doesn't hold each of %s exactly once",
					factoredTable, inserted));
		}
		if (!withTree){
			return;
		}
		List<Production> stored = new ArrayList<>();
		for (PrefixNode root : roots.values()){
			for (PrefixNode node : postOrder(root)){
				for (PrefixNode child : node.getChildren()){
					if (child.parent != node || child.depth != node.depth + 1){
						throw new InvariantViolationError(String.format("Broken link between '%s' and its child '%s'",
								node.path(), child.label));
					}
				}
				if (node.alts.isEmpty()){
					continue;
				}
				List<Production> group = factoredTable.get(node.path());
				if (group == null || !sameAlternatives(group, node.alts)){
					throw new InvariantViolationError(String.format("Node '%s' holds %s, but its group is %s",
							node.path(), node.alts, group));
				}
				stored.addAll(node.alts);
			}
		}
		if (!sameAlternatives(inserted, stored)){
			throw new InvariantViolationError(String.format("The tree doesn't hold each of %s exactly once", inserted));
		}
	}

	/**
	 * Do both lists contain the same alternative objects, the same number of times?
	 */
	private static boolean sameAlternatives(List<Production> first, List<Production> second){
		if (first.size() != second.size()){
			return false;
		}
		Map<Production, Integer> counts = new IdentityHashMap<>();
		for (Production alt : first){
			counts.merge(alt, 1, Integer::sum);
		}
		for (Production alt : second){
			int count = counts.getOrDefault(alt, 0);
			if (count == 0){
				return false;
			}
			counts.put(alt, count - 1);
		}
		return true;
	}
}
