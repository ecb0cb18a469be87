package eson.grammar;

import java.util.*;

/**
 * Declares an attribute and the rules that carry it.
 */
public class AttributeDeclaration {

	public enum Type {
		/**
		 * Synthesized attribute, computed from the lexeme of a terminal
		 */
		S_ATTR,
		/**
		 * Inherited attribute, passed down from a non terminal to its children
		 */
		I_ATTR
	}

	/**
	 * Target that selects every applicable rule
	 */
	public static final String ALL = "All";

	public final String attr;

	public final Type type;

	/**
	 * Names of the rules that carry the attribute, or {@link #ALL}
	 */
	public final List<String> terms;

	public AttributeDeclaration(String attr, Type type, List<String> terms) {
		this.attr = Objects.requireNonNull(attr);
		this.type = Objects.requireNonNull(type);
		this.terms = Collections.unmodifiableList(new ArrayList<>(terms));
	}

	public static AttributeDeclaration sAttr(String attr, String... terms){
		return new AttributeDeclaration(attr, Type.S_ATTR, Arrays.asList(terms));
	}

	public static AttributeDeclaration iAttr(String attr, String... terms){
		return new AttributeDeclaration(attr, Type.I_ATTR, Arrays.asList(terms));
	}

	public boolean targetsAll(){
		return terms.contains(ALL);
	}

	@Override
	public String toString() {
		return String.format("%s %s %s", type.name().toLowerCase(), attr, terms);
	}
}
