package eson.grammar;

import java.util.*;
import java.util.function.Supplier;

/**
 * A set of semantic capabilities that is merged into a grammar: attribute actions per rule,
 * token hooks and the factory for the environment of a compilation.
 */
public class SemanticActions {

	private final Map<String, Map<String, SemanticAction>> actions = new LinkedHashMap<>();

	private final List<TokenHook> hooks = new ArrayList<>();

	private Supplier<Environment> environmentFactory = Environment::new;

	/**
	 * Registers the action that computes the attribute of tokens of the passed rule.
	 */
	public SemanticActions on(String rule, String attr, SemanticAction action){
		actions.computeIfAbsent(rule, r -> new LinkedHashMap<>()).put(attr, action);
		return this;
	}

	public SemanticActions hook(TokenHook hook){
		hooks.add(hook);
		return this;
	}

	public SemanticActions environment(Supplier<Environment> environmentFactory){
		this.environmentFactory = environmentFactory;
		return this;
	}

	public Optional<SemanticAction> get(String rule, String attr){
		return Optional.ofNullable(actions.getOrDefault(rule, Collections.emptyMap()).get(attr));
	}

	public boolean provides(String rule, String attr){
		return get(rule, attr).isPresent();
	}

	/**
	 * Names of the rules with at least one action
	 */
	public Set<String> rules(){
		return Collections.unmodifiableSet(actions.keySet());
	}

	public List<TokenHook> hooks(){
		return Collections.unmodifiableList(hooks);
	}

	public Environment envInit(){
		return environmentFactory.get();
	}

	/**
	 * Merges the passed modules, later modules override the actions and the environment factory
	 * of earlier ones, hooks are concatenated.
	 */
	public static SemanticActions merge(List<SemanticActions> modules){
		SemanticActions merged = new SemanticActions();
		for (SemanticActions module : modules){
			module.actions.forEach((rule, attrs) -> attrs.forEach((attr, action) -> merged.on(rule, attr, action)));
			merged.hooks.addAll(module.hooks);
			merged.environmentFactory = module.environmentFactory;
		}
		return merged;
	}
}
