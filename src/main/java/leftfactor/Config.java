package leftfactor;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Global settings, read from a <code>leftfactor.ini</code> on the class path and
 * (overriding it) from a <code>leftfactor.ini</code> in the working directory.
 *
 * Each line has the form <code>key = value</code>.
 */
public class Config {

	public static final String configFile = "leftfactor.ini";

	private static final Logger LOG = Logger.getLogger(Config.class.getName());

	/**
	 * Parent logger of all loggers in this library, kept here so that the configured level isn't lost
	 */
	private static final Logger PACKAGE_LOG = Logger.getLogger("leftfactor");

	private static final Map<String, String> config = new HashMap<String, String>(){{
		put("checkInvariants", "yes");
		put("parallelPlanning", "no");
		put("logLevel", "INFO");
	}};

	/** Check the prefix tree invariants after each modification? */
	public static boolean checkInvariants(){
		return config.get("checkInvariants").equals("yes");
	}

	/** Build the prefix trees of different non terminals in parallel? */
	public static boolean parallelPlanning(){
		return config.get("parallelPlanning").equals("yes");
	}

	public static Level logLevel(){
		try {
			return Level.parse(config.get("logLevel"));
		} catch (IllegalArgumentException ex){
			LOG.warning(String.format("Unknown log level \"%s\", using INFO", config.get("logLevel")));
			return Level.INFO;
		}
	}

	/**
	 * Override a setting
	 *
	 * @param key known config key
	 * @param value new value
	 * @throws LeftFactorException if the key is unknown
	 */
	public static void set(String key, String value){
		if (!config.containsKey(key)){
			throw new LeftFactorException(String.format("Unknown config key \"%s\"", key));
		}
		config.put(key, value.trim());
		if (key.equals("logLevel")){
			PACKAGE_LOG.setLevel(logLevel());
		}
	}

	public static String get(String key){
		if (!config.containsKey(key)){
			throw new LeftFactorException(String.format("Unknown config key \"%s\"", key));
		}
		return config.get(key);
	}

	static void parse(BufferedReader reader, String source) throws IOException {
		String line;
		while ((line = reader.readLine()) != null){
			if (line.trim().startsWith("#")){
				continue;
			}
			if (line.contains(" = ")){
				String[] parts = line.split(" = ", 2);
				String key = parts[0].trim();
				if (config.containsKey(key)){
					config.put(key, parts[1].trim());
				} else {
					LOG.warning(String.format("Unknown config key \"%s\" in %s", key, source));
				}
			}
		}
	}

	private static void loadConfig(){
		try (InputStream stream = Config.class.getResourceAsStream("/" + configFile)) {
			if (stream != null){
				parse(new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8)), "class path");
			}
		} catch (IOException e) {
			LOG.log(Level.WARNING, "Can't read the " + configFile + " on the class path", e);
		}
		File file = new File(configFile);
		if (file.exists()){
			try (BufferedReader reader = new BufferedReader(new FileReader(file, StandardCharsets.UTF_8))) {
				parse(reader, file.getAbsolutePath());
			} catch (IOException e) {
				LOG.log(Level.WARNING, "Can't read " + file.getAbsolutePath(), e);
			}
		}
		PACKAGE_LOG.setLevel(logLevel());
	}

	static {
		loadConfig();
	}
}
