package com.github.henkexbg.wordlegame;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Game settings. Read from the classpath resource {@value #CONFIG_RESOURCE_LOCATION},
 * where every key can be overridden by a system property of the same name, for
 * example <code>-Dwordle.max.attempts=8</code>.
 *
 * @author Henrik Bjerne
 *
 */
public class GameConfig {

	private static final Logger LOG = LoggerFactory.getLogger(GameConfig.class);

	public static final String CONFIG_RESOURCE_LOCATION = "/wordle.properties";

	public static final String MAX_ATTEMPTS_KEY = "wordle.max.attempts";

	public static final String DICTIONARY_RESOURCE_KEY = "wordle.dictionary.resource";

	public static final String SCORING_KEY = "wordle.scoring";

	public static final String COLOR_KEY = "wordle.color";

	public static final int DEFAULT_MAX_ATTEMPTS = 6;

	public static final String DEFAULT_DICTIONARY_RESOURCE_LOCATION = "/dictionary.txt";

	private final int maxAttempts;

	private final String dictionaryResourceLocation;

	private final ScoringMode scoringMode;

	private final boolean color;

	public GameConfig(int maxAttempts, String dictionaryResourceLocation, ScoringMode scoringMode, boolean color) {
		if (maxAttempts <= 0) {
			throw new IllegalArgumentException(
					String.format("%s must be greater than 0, got %s", MAX_ATTEMPTS_KEY, maxAttempts));
		}
		this.maxAttempts = maxAttempts;
		this.dictionaryResourceLocation = dictionaryResourceLocation;
		this.scoringMode = scoringMode;
		this.color = color;
	}

	public static GameConfig defaults() {
		return new GameConfig(DEFAULT_MAX_ATTEMPTS, DEFAULT_DICTIONARY_RESOURCE_LOCATION, ScoringMode.INDEXED, true);
	}

	/**
	 * Loads the configuration resource, if there is one, and applies system
	 * property overrides.
	 *
	 * @return Configuration
	 */
	public static GameConfig load() {
		Properties properties = new Properties();
		try (InputStream input = GameConfig.class.getResourceAsStream(CONFIG_RESOURCE_LOCATION)) {
			if (input != null) {
				properties.load(input);
			} else {
				LOG.debug("No {} on classpath, using defaults", CONFIG_RESOURCE_LOCATION);
			}
		} catch (IOException e) {
			throw new UncheckedIOException("Could not read " + CONFIG_RESOURCE_LOCATION, e);
		}
		for (String key : new String[] { MAX_ATTEMPTS_KEY, DICTIONARY_RESOURCE_KEY, SCORING_KEY, COLOR_KEY }) {
			String override = System.getProperty(key);
			if (override != null) {
				properties.setProperty(key, override);
			}
		}
		GameConfig config = fromProperties(properties);
		LOG.debug("Loaded {}", config);
		return config;
	}

	/**
	 * @param properties Properties, missing keys get their default value
	 * @return Configuration
	 * @throws IllegalArgumentException If a value can not be parsed
	 */
	public static GameConfig fromProperties(Properties properties) {
		String maxAttemptsValue = properties.getProperty(MAX_ATTEMPTS_KEY, String.valueOf(DEFAULT_MAX_ATTEMPTS));
		int maxAttempts;
		try {
			maxAttempts = Integer.parseInt(maxAttemptsValue.trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(
					String.format("%s is not a number: '%s'", MAX_ATTEMPTS_KEY, maxAttemptsValue), e);
		}
		String dictionary = properties.getProperty(DICTIONARY_RESOURCE_KEY, DEFAULT_DICTIONARY_RESOURCE_LOCATION).trim();
		ScoringMode scoringMode = ScoringMode.parse(properties.getProperty(SCORING_KEY, ScoringMode.INDEXED.name()));
		return new GameConfig(maxAttempts, dictionary, scoringMode, parseBoolean(properties.getProperty(COLOR_KEY, "true")));
	}

	private static boolean parseBoolean(String value) {
		String trimmed = value.trim();
		if ("true".equalsIgnoreCase(trimmed)) {
			return true;
		} else if ("false".equalsIgnoreCase(trimmed)) {
			return false;
		}
		throw new IllegalArgumentException(String.format("%s must be true or false, got '%s'", COLOR_KEY, value));
	}

	public int getMaxAttempts() {
		return maxAttempts;
	}

	public String getDictionaryResourceLocation() {
		return dictionaryResourceLocation;
	}

	public ScoringMode getScoringMode() {
		return scoringMode;
	}

	public boolean isColor() {
		return color;
	}

	@Override
	public String toString() {
		return "GameConfig [maxAttempts=" + maxAttempts + ", dictionaryResourceLocation=" + dictionaryResourceLocation
				+ ", scoringMode=" + scoringMode + ", color=" + color + "]";
	}

}
