package eson.grammar;

import java.util.*;

/**
 * A non terminal rule with its production.
 */
public class NonTerminal extends Rule {

	/**
	 * Separates the kind tag of anonymous non terminals from their number
	 */
	public static final String ANONYMOUS_SEPARATOR = "#";

	public final Production production;

	public NonTerminal(String name, Production production) {
		this(name, production, Collections.emptyList(), Collections.emptyList());
	}

	private NonTerminal(String name, Production production, List<String> sAttr, List<String> iAttr) {
		super(name, sAttr, iAttr);
		this.production = production;
	}

	@Override
	public boolean isTerminal() {
		return false;
	}

	/**
	 * Anonymous non terminals are created for groups inside other productions
	 */
	public boolean isAnonymous(){
		return name.contains(ANONYMOUS_SEPARATOR);
	}

	/**
	 * Anonymous non terminals produce nodes named after their production kind.
	 */
	@Override
	public String nodeName() {
		return isAnonymous() ? production.kind.tag() : name;
	}

	@Override
	NonTerminal withAttributes(List<String> sAttr, List<String> iAttr, SemanticActions actions) {
		return new NonTerminal(name, production, sAttr, iAttr);
	}

	@Override
	public String toString() {
		return name + " := " + production;
	}
}
