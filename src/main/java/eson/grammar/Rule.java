package eson.grammar;

import java.util.*;

/**
 * Base class of terminal and non terminal rules.
 */
public abstract class Rule {

	/**
	 * Name of the rule, unique in its grammar
	 */
	public final String name;

	/**
	 * Synthesized attributes
	 */
	protected final List<String> sAttr;

	/**
	 * Inherited attributes
	 */
	protected final List<String> iAttr;

	protected Rule(String name, List<String> sAttr, List<String> iAttr) {
		this.name = Objects.requireNonNull(name);
		this.sAttr = Collections.unmodifiableList(new ArrayList<>(sAttr));
		this.iAttr = Collections.unmodifiableList(new ArrayList<>(iAttr));
	}

	public List<String> getSAttr(){
		return sAttr;
	}

	public List<String> getIAttr(){
		return iAttr;
	}

	public abstract boolean isTerminal();

	/**
	 * Name of the tree nodes created for this rule
	 */
	public String nodeName(){
		return name;
	}

	/**
	 * Copy of this rule with other attribute lists and actions.
	 */
	abstract Rule withAttributes(List<String> sAttr, List<String> iAttr, SemanticActions actions);

	@Override
	public String toString() {
		return name;
	}
}
