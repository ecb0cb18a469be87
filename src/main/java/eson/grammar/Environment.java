package eson.grammar;

import java.util.*;

/**
 * Named values that are visible to later tokens of a single compilation.
 *
 * Holds the bindings of attribute names to their values and arbitrary state of the
 * token hooks (like the current line).
 */
public class Environment {

	private final Map<String, Object> values = new HashMap<>();

	private final Map<String, Object> bindings = new LinkedHashMap<>();

	public Object get(String name){
		return values.get(name);
	}

	@SuppressWarnings("unchecked")
	public <T> T get(String name, T defaultValue){
		return values.containsKey(name) ? (T)values.get(name) : defaultValue;
	}

	public void put(String name, Object value){
		values.put(name, value);
	}

	public boolean contains(String name){
		return values.containsKey(name);
	}

	public Object remove(String name){
		return values.remove(name);
	}

	/**
	 * Bind a variable, replaces earlier bindings
	 */
	public void bind(String variable, Object value){
		bindings.put(variable, value);
	}

	public boolean isBound(String variable){
		return bindings.containsKey(variable);
	}

	/**
	 * Value last bound to the variable, null if it isn't bound
	 */
	public Object lookup(String variable){
		return bindings.get(variable);
	}

	public Map<String, Object> bindings(){
		return Collections.unmodifiableMap(bindings);
	}

	@Override
	public String toString() {
		return "Environment(values=" + values + ", bindings=" + bindings + ")";
	}
}
