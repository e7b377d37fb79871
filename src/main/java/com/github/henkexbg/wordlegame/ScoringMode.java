package com.github.henkexbg.wordlegame;

import java.util.Locale;

/**
 * Selects which {@link GuessEvaluator} a game uses.
 */
public enum ScoringMode {

	/**
	 * {@link IndexedGuessEvaluator}, present letters are not capped by their
	 * number of occurrences
	 */
	INDEXED,

	/**
	 * {@link OccurrenceCountingGuessEvaluator}, standard Wordle scoring
	 */
	OCCURRENCE_COUNTED;

	public GuessEvaluator createEvaluator() {
		switch (this) {
		case OCCURRENCE_COUNTED:
			return new OccurrenceCountingGuessEvaluator();
		case INDEXED:
		default:
			return new IndexedGuessEvaluator();
		}
	}

	/**
	 * @param value Name of the mode, case insensitive
	 * @return The mode
	 * @throws IllegalArgumentException If no mode has that name
	 */
	public static ScoringMode parse(String value) {
		try {
			return valueOf(value.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException(String.format("Unknown scoring mode '%s'", value), e);
		}
	}

}
