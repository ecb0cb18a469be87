package eson.grammar;

import java.util.*;

/**
 * Allows the simple creation of grammars.
 *
 * Strings are rule names. Groups inside a production ({@link #or(String...)}, {@link #opt(String)},
 * {@link #star(String)}) become anonymous non terminals, their names are returned and can be used
 * like any other rule name.
 */
public class GrammarBuilder {

	private final Map<String, Rule> rules = new LinkedHashMap<>();

	private final Set<String> specialForms = new LinkedHashSet<>();

	private SemanticActions actions = new SemanticActions();

	/**
	 * For each production kind the last number of an anonymous non terminal KIND#NUMBER.
	 */
	private final Map<Production.Kind, Integer> currentNumForKind = new EnumMap<>(Production.Kind.class);

	public GrammarBuilder literal(String name, String literal){
		return add(Terminal.literal(name, literal));
	}

	public GrammarBuilder pattern(String name, String regex){
		return add(Terminal.pattern(name, regex));
	}

	public GrammarBuilder add(String name, Production.Kind kind, String... right){
		return add(new NonTerminal(name, new Production(kind, Arrays.asList(right))));
	}

	public GrammarBuilder seq(String name, String... right){
		return add(name, Production.Kind.CONCATENATION, right);
	}

	public GrammarBuilder alt(String name, String... right){
		return add(name, Production.Kind.ALTERNATION, right);
	}

	public GrammarBuilder repeat(String name, String right){
		return add(name, Production.Kind.REPETITION, right);
	}

	/**
	 * Adds a rule as it is, e.g. a terminal of another grammar
	 */
	public GrammarBuilder add(Rule rule){
		if (rules.containsKey(rule.name)){
			throw new GrammarError("Rule " + rule.name + " is already defined");
		}
		rules.put(rule.name, rule);
		return this;
	}

	/**
	 * Creates a new anonymous non terminal name for the passed kind.
	 */
	private String createNewNonTerminal(Production.Kind kind){
		int newNumber = currentNumForKind.getOrDefault(kind, -1) + 1;
		currentNumForKind.put(kind, newNumber);
		return kind.tag() + NonTerminal.ANONYMOUS_SEPARATOR + newNumber;
	}

	private String anonymous(Production.Kind kind, String... right){
		String name = createNewNonTerminal(kind);
		add(name, kind, right);
		return name;
	}

	/**
	 * Creates a rule that matches the first of the passed rules that can start at the current token.
	 *
	 * @return name of the new rule
	 */
	public String or(String... right){
		return anonymous(Production.Kind.ALTERNATION, right);
	}

	/**
	 * Creates a rule that matches the passed rule zero or one time.
	 *
	 * @return name of the new rule
	 */
	public String opt(String right){
		return anonymous(Production.Kind.OPTION, right);
	}

	/**
	 * Creates a rule that matches the passed rule many or zero times.
	 *
	 * @return name of the new rule
	 */
	public String star(String right){
		return anonymous(Production.Kind.REPETITION, right);
	}

	public GrammarBuilder specialForms(String... names){
		specialForms.addAll(Arrays.asList(names));
		return this;
	}

	public GrammarBuilder actions(SemanticActions actions){
		this.actions = actions;
		return this;
	}

	public Grammar build(String start){
		return new Grammar(rules, start, specialForms, actions);
	}
}
