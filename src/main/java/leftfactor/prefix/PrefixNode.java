package leftfactor.prefix;

import java.util.*;

import leftfactor.InvariantViolationError;
import leftfactor.grammar.Production;

/**
 * Node of a prefix tree: all alternatives that agree on the leading symbols from the root up to this node.
 */
public class PrefixNode {

	/**
	 * Name of the grammar element this node represents
	 */
	public final String label;

	/**
	 * Number of descents from the root, 0 for a root
	 */
	public final int depth;

	/**
	 * Owning node, null for roots. The tree owns its nodes via the child direction only.
	 */
	public final PrefixNode parent;

	/**
	 * Children by label, in the order of their first occurrence
	 */
	private final Map<String, PrefixNode> children = new LinkedHashMap<>();

	/**
	 * Alternatives whose shared prefix ends at this node
	 */
	final List<Production> alts = new ArrayList<>();

	PrefixNode(String label, int depth, PrefixNode parent) {
		this.label = label;
		this.depth = depth;
		this.parent = parent;
	}

	/**
	 * @return the child with the passed label or null if there is none
	 */
	public PrefixNode getChildNamed(String label){
		return children.get(label);
	}

	PrefixNode addChild(String label){
		if (children.containsKey(label)){
			throw new InvariantViolationError(String.format("Node '%s' already has a child labeled '%s'", path(), label));
		}
		PrefixNode child = new PrefixNode(label, depth + 1, this);
		children.put(label, child);
		return child;
	}

	public Collection<PrefixNode> getChildren(){
		return Collections.unmodifiableCollection(children.values());
	}

	public List<Production> getAlts(){
		return Collections.unmodifiableList(alts);
	}

	public boolean isRoot(){
		return parent == null;
	}

	/**
	 * Labels from the root down to this node
	 */
	public Prefix path(){
		Deque<String> labels = new ArrayDeque<>();
		for (PrefixNode node = this; node != null; node = node.parent){
			labels.addFirst(node.label);
		}
		return Prefix.of(new ArrayList<>(labels));
	}

	@Override
	public String toString() {
		return String.format("Prefix: \"%s\" Children: %s Alts: %s", label, children.keySet(), alts);
	}
}
