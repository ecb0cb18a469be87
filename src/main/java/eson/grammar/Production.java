package eson.grammar;

import java.util.*;

/**
 * Right hand side of a non terminal: references to other rules, combined in one of four ways.
 */
public class Production {

	public enum Kind {
		CONCATENATION,
		ALTERNATION,
		OPTION,
		REPETITION;

		/**
		 * Name of the tree nodes of anonymous rules of this kind
		 */
		public String tag(){
			return name().toLowerCase();
		}
	}

	public final Kind kind;

	/**
	 * Names of the referenced rules, in order
	 */
	public final List<String> right;

	public Production(Kind kind, List<String> right) {
		this.kind = Objects.requireNonNull(kind);
		this.right = Collections.unmodifiableList(new ArrayList<>(right));
		if (right.isEmpty()){
			throw new GrammarError("A production needs at least one rule on its right hand side");
		}
		if ((kind == Kind.OPTION || kind == Kind.REPETITION) && right.size() != 1){
			throw new GrammarError(String.format("A %s production has exactly one rule on its right hand side, got %s",
					kind.tag(), right));
		}
	}

	public String formatRightSide(){
		switch (kind) {
			case ALTERNATION:
				return String.join(" | ", right);
			case OPTION:
				return "[" + right.get(0) + "]";
			case REPETITION:
				return "{" + right.get(0) + "}";
			default:
				return String.join(" ", right);
		}
	}

	@Override
	public String toString() {
		return formatRightSide();
	}
}
