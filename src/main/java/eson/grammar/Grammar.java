package eson.grammar;

import java.util.*;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import eson.lexer.Token;
import eson.lexer.TokenSeq;

/**
 * Grammar consisting of terminal and non terminal rules, addressed by name, together with the
 * semantic capabilities (attribute actions and token hooks) of its attribute grammar.
 *
 * Use the {@link GrammarBuilder} to build a grammar instance properly and
 * {@link #assignAttributeGrammar(List, List)} to turn it into an attribute grammar.
 */
public class Grammar {

	private static final Logger LOG = Logger.getLogger("eson.grammar");

	private final Map<String, Rule> rules;

	private final String start;

	private final Set<String> specialForms;

	private final SemanticActions actions;

	private Set<String> nullableRules;

	private Map<String, Set<String>> firstSets;

	/**
	 * Create a new grammar
	 *
	 * @param rules rules by name
	 * @param start name of the start non terminal
	 * @param specialForms names of the known special forms
	 * @param actions semantic capabilities
	 * @throws GrammarError if a production references an unknown rule or the start rule is missing
	 */
	public Grammar(Map<String, Rule> rules, String start, Set<String> specialForms, SemanticActions actions) {
		this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
		this.start = start;
		this.specialForms = Collections.unmodifiableSet(new LinkedHashSet<>(specialForms));
		this.actions = actions;
		validate();
	}

	private void validate(){
		if (!rules.containsKey(start) || rules.get(start).isTerminal()){
			throw new GrammarError(String.format("Start rule %s isn't a non terminal of the grammar", start));
		}
		for (NonTerminal nonTerminal : productions()){
			for (String ref : nonTerminal.production.right){
				if (!rules.containsKey(ref)){
					throw new GrammarError(String.format("Rule %s references the unknown rule %s", nonTerminal.name, ref));
				}
			}
		}
	}

	/**
	 * Returns the rule with the passed name.
	 *
	 * @throws GrammarError if there is no such rule
	 */
	public Rule getRule(String name){
		Rule rule = rules.get(name);
		if (rule == null){
			throw new GrammarError("Unknown rule " + name);
		}
		return rule;
	}

	public Terminal getTerminal(String name){
		Rule rule = getRule(name);
		if (!rule.isTerminal()){
			throw new GrammarError(name + " isn't a terminal");
		}
		return (Terminal)rule;
	}

	public boolean hasRule(String name){
		return rules.containsKey(name);
	}

	public NonTerminal getStart(){
		return (NonTerminal)rules.get(start);
	}

	public Collection<Rule> getRules(){
		return rules.values();
	}

	/**
	 * Names of all terminals
	 */
	public List<String> terminals(){
		return rules.values().stream().filter(Rule::isTerminal).map(r -> r.name).collect(Collectors.toList());
	}

	/**
	 * All non terminals, each with its production
	 */
	public List<NonTerminal> productions(){
		return rules.values().stream().filter(r -> !r.isTerminal()).map(r -> (NonTerminal)r).collect(Collectors.toList());
	}

	public Set<String> getSpecialForms(){
		return specialForms;
	}

	public SemanticActions getActions(){
		return actions;
	}

	/**
	 * Is there a custom action for the attribute of the rule?
	 */
	public boolean hasAction(String rule, String attr){
		return actions.provides(rule, attr);
	}

	/**
	 * Creates the environment for a new compilation.
	 */
	public Environment envInit(){
		return actions.envInit();
	}

	/**
	 * Runs the token hooks for a token that is about to be appended to the sequence.
	 */
	public void evalSAttributes(Environment env, Token token, TokenSeq seq){
		for (TokenHook hook : actions.hooks()){
			hook.evaluate(env, token, seq);
		}
	}

	/**
	 * Creates an attribute grammar out of this grammar: a grammar with the same rules and
	 * productions, the attribute lists updated per declaration and the passed action modules merged
	 * into its semantic capabilities.
	 *
	 * Synthesized attributes are added to the named terminals ({@code All}: every terminal),
	 * inherited attributes to the named non terminals ({@code All}: every non terminal).
	 *
	 * @param actionModules semantic capabilities, merged after the capabilities of this grammar
	 * @param declarations attribute declarations
	 * @return new grammar
	 * @throws GrammarError if a declaration targets an unknown rule or an inherited attribute targets
	 * a terminal
	 */
	public Grammar assignAttributeGrammar(List<SemanticActions> actionModules, List<AttributeDeclaration> declarations){
		Map<String, LinkedHashSet<String>> sAttrs = new HashMap<>();
		Map<String, LinkedHashSet<String>> iAttrs = new HashMap<>();
		for (Rule rule : rules.values()){
			sAttrs.put(rule.name, new LinkedHashSet<>(rule.getSAttr()));
			iAttrs.put(rule.name, new LinkedHashSet<>(rule.getIAttr()));
		}
		for (AttributeDeclaration declaration : declarations){
			for (Rule rule : targets(declaration)){
				if (declaration.type == AttributeDeclaration.Type.S_ATTR){
					if (rule.isTerminal()){
						sAttrs.get(rule.name).add(declaration.attr);
					} else {
						LOG.fine(String.format("Ignoring synthesized attribute %s on non terminal %s", declaration.attr, rule.name));
					}
				} else {
					if (rule.isTerminal()){
						throw new GrammarError(String.format("Terminal %s can't carry the inherited attribute %s",
								rule.name, declaration.attr));
					}
					iAttrs.get(rule.name).add(declaration.attr);
				}
			}
		}
		List<SemanticActions> modules = new ArrayList<>();
		modules.add(actions);
		modules.addAll(actionModules);
		SemanticActions merged = SemanticActions.merge(modules);
		for (String rule : merged.rules()){
			if (!rules.containsKey(rule)){
				throw new GrammarError(String.format("Semantic action for the unknown rule %s", rule));
			}
		}
		Map<String, Rule> newRules = new LinkedHashMap<>();
		for (Rule rule : rules.values()){
			newRules.put(rule.name, rule.withAttributes(new ArrayList<>(sAttrs.get(rule.name)),
					new ArrayList<>(iAttrs.get(rule.name)), merged));
		}
		return new Grammar(newRules, start, specialForms, merged);
	}

	private List<Rule> targets(AttributeDeclaration declaration){
		if (declaration.targetsAll()){
			boolean terminals = declaration.type == AttributeDeclaration.Type.S_ATTR;
			return rules.values().stream().filter(r -> r.isTerminal() == terminals).collect(Collectors.toList());
		}
		List<Rule> ret = new ArrayList<>();
		for (String term : declaration.terms){
			if (!rules.containsKey(term)){
				throw new GrammarError(String.format("Attribute %s targets the unknown rule %s", declaration.attr, term));
			}
			ret.add(rules.get(term));
		}
		return ret;
	}

	/**
	 * Calculate the rules that can match without consuming a token.
	 */
	public Set<String> calculateNullable(){
		if (nullableRules != null){
			return nullableRules;
		}
		Set<String> nullable = new HashSet<>();
		boolean somethingChanged;
		do {
			somethingChanged = false;
			for (NonTerminal nonTerminal : productions()){
				if (!nullable.contains(nonTerminal.name) && isNullable(nonTerminal.production, nullable)){
					nullable.add(nonTerminal.name);
					somethingChanged = true;
				}
			}
		} while (somethingChanged);
		nullableRules = Collections.unmodifiableSet(nullable);
		return nullableRules;
	}

	private boolean isNullable(Production production, Set<String> nullable){
		switch (production.kind) {
			case OPTION:
			case REPETITION:
				return true;
			case ALTERNATION:
				return production.right.stream().anyMatch(nullable::contains);
			default:
				return production.right.stream().allMatch(nullable::contains);
		}
	}

	public boolean isNullable(String rule){
		return calculateNullable().contains(rule);
	}

	/**
	 * Calculates for every rule the names of the terminals that can start it.
	 *
	 * The sets of the non terminals start with their leading symbols (every symbol of an
	 * alternation, the symbols of a concatenation up to the first non nullable one) and are
	 * extended with the sets of the contained non terminals until nothing changes.
	 */
	public Map<String, Set<String>> calculateFirstSets(){
		if (firstSets != null){
			return firstSets;
		}
		Set<String> nullable = calculateNullable();
		Map<String, Set<String>> leading = new HashMap<>();
		for (NonTerminal nonTerminal : productions()){
			Set<String> leadingSymbols = new LinkedHashSet<>();
			Production production = nonTerminal.production;
			for (String sym : production.right){
				leadingSymbols.add(sym);
				if (production.kind == Production.Kind.CONCATENATION && !nullable.contains(sym)){
					break;
				}
			}
			leading.put(nonTerminal.name, leadingSymbols);
		}
		boolean firstChanged;
		do {
			firstChanged = false;
			for (Set<String> symbols : leading.values()){
				Set<String> newSymbols = new HashSet<>();
				for (String symbol : symbols){
					if (leading.containsKey(symbol)){
						newSymbols.addAll(leading.get(symbol));
					}
				}
				firstChanged = symbols.addAll(newSymbols) || firstChanged;
			}
		} while (firstChanged);
		Map<String, Set<String>> sets = new HashMap<>();
		for (Rule rule : rules.values()){
			if (rule.isTerminal()){
				sets.put(rule.name, Collections.singleton(rule.name));
			} else {
				Set<String> first = leading.get(rule.name).stream()
						.filter(s -> rules.get(s).isTerminal())
						.collect(Collectors.toCollection(TreeSet::new));
				sets.put(rule.name, Collections.unmodifiableSet(first));
			}
		}
		firstSets = Collections.unmodifiableMap(sets);
		return firstSets;
	}

	public Set<String> first(String rule){
		getRule(rule);
		return calculateFirstSets().get(rule);
	}

	/**
	 * Can the rule start with the passed token? The end of input (null) only starts nullable rules.
	 */
	public boolean canStart(String rule, Token lookahead){
		if (lookahead == null){
			return isNullable(rule);
		}
		return first(rule).contains(lookahead.name);
	}

	public String longDescription(){
		return "Start rule: " + start + "\n" +
				"Terminals: " + terminals() + "\n" +
				"Productions: \n" + productions().stream().map(NonTerminal::toString).collect(Collectors.joining("\n"));
	}
}
