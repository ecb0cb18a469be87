package eson;

import java.io.*;
import java.util.*;
import java.util.logging.*;

/**
 * Global compiler settings, read from a simple {@code key = value} file.
 *
 * The file is named by the system property {@code eson.config} and defaults to {@code eson.ini}
 * in the working directory. Missing files and keys fall back to the defaults below.
 */
public class Config {

	public static final String configFileProperty = "eson.config";

	public static final String defaultConfigFile = "eson.ini";

	private static final Logger LOG = Logger.getLogger("eson");

	private static final Map<String, String> defaults = new HashMap<String, String>(){{
		put("maxNestingDepth", "256");
		put("maxRuleDepth", "4096");
		put("logLevel", "INFO");
	}};

	private static final Map<String, String> config = new HashMap<>(defaults);

	/** Maximum nesting of objects and arrays the tokenizer walks into */
	public static int maxNestingDepth(){
		return intValue("maxNestingDepth");
	}

	/** Maximum recursion depth of the syntax pass, counted in rules */
	public static int maxRuleDepth(){
		return intValue("maxRuleDepth");
	}

	public static Level logLevel(){
		try {
			return Level.parse(config.get("logLevel"));
		} catch (IllegalArgumentException ex){
			LOG.warning(String.format("Invalid log level \"%s\", using %s", config.get("logLevel"), defaults.get("logLevel")));
			return Level.parse(defaults.get("logLevel"));
		}
	}

	private static int intValue(String key){
		String value = config.get(key);
		int ret = 0;
		try {
			ret = Integer.parseInt(value.trim());
		} catch (NumberFormatException ex){
			LOG.log(Level.FINE, "Can't parse config value", ex);
		}
		if (ret > 0){
			return ret;
		}
		LOG.warning(String.format("Invalid value \"%s\" for config key \"%s\", using %s", value, key, defaults.get(key)));
		return Integer.parseInt(defaults.get(key));
	}

	/**
	 * Parses the lines of a config file into the passed map, ignores unknown keys.
	 */
	static void parse(BufferedReader reader, Map<String, String> target) throws IOException {
		String line;
		while ((line = reader.readLine()) != null){
			if (line.trim().startsWith("#") || !line.contains("=")){
				continue;
			}
			String[] parts = line.split("=", 2);
			String key = parts[0].trim();
			if (defaults.containsKey(key)){
				target.put(key, parts[1].trim());
			} else {
				LOG.warning("Unknown config key \"" + key + "\"");
			}
		}
	}

	private static void loadConfig(){
		File file = new File(System.getProperty(configFileProperty, defaultConfigFile));
		if (file.exists()){
			try (BufferedReader reader = new BufferedReader(new FileReader(file))) {
				parse(reader, config);
			} catch (IOException e) {
				LOG.log(Level.WARNING, "Can't read config file " + file, e);
			}
		}
		LOG.setLevel(logLevel());
	}

	static {
		loadConfig();
	}
}
