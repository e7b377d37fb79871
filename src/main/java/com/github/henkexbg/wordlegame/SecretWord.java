package com.github.henkexbg.wordlegame;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The word the player is trying to guess. Besides the word itself this class
 * holds an index from each letter to the positions where that letter occurs,
 * so that scoring a guess only needs map lookups. Instances are immutable.
 *
 * @author Henrik Bjerne
 *
 */
public final class SecretWord {

	public static final int WORD_LENGTH = 5;

	private final String text;

	/**
	 * Letter to positions in {@link #text}. Derived from the text, never modified
	 * after construction
	 */
	private final Map<Character, Set<Integer>> positionIndex;

	private SecretWord(String text, Map<Character, Set<Integer>> positionIndex) {
		this.text = text;
		this.positionIndex = positionIndex;
	}

	/**
	 * Creates a secret word, building the letter position index in one scan.
	 *
	 * @param raw The word, stored verbatim.
	 * @return Secret word
	 * @throws InvalidWordLengthException If raw is not exactly
	 *                                    {@link #WORD_LENGTH} characters long.
	 */
	public static SecretWord of(String raw) throws InvalidWordLengthException {
		Objects.requireNonNull(raw, "raw");
		if (raw.length() != WORD_LENGTH) {
			throw new InvalidWordLengthException(raw.length());
		}
		Map<Character, Set<Integer>> index = new HashMap<>();
		for (int i = 0; i < raw.length(); i++) {
			index.computeIfAbsent(raw.charAt(i), c -> new HashSet<>()).add(i);
		}
		index.replaceAll((c, positions) -> Collections.unmodifiableSet(positions));
		return new SecretWord(raw, Collections.unmodifiableMap(index));
	}

	/**
	 * @param c        Letter
	 * @param position Zero-based position
	 * @return true if the letter occurs at exactly that position. False for
	 *         letters not in the word at all.
	 */
	public boolean isAtPosition(char c, int position) {
		Set<Integer> positions = positionIndex.get(c);
		return positions != null && positions.contains(position);
	}

	/**
	 * @param c Letter
	 * @return true if the letter occurs anywhere in the word
	 */
	public boolean contains(char c) {
		return positionIndex.containsKey(c);
	}

	/**
	 * @param c Letter
	 * @return Number of times the letter occurs in the word
	 */
	public int occurrences(char c) {
		Set<Integer> positions = positionIndex.get(c);
		return positions == null ? 0 : positions.size();
	}

	/**
	 * Shows the word. Meant for the end of game message only.
	 *
	 * @return The word exactly as it was given
	 */
	public String reveal() {
		return text;
	}

	public Map<Character, Set<Integer>> getPositionIndex() {
		return positionIndex;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof SecretWord)) {
			return false;
		}
		return text.equals(((SecretWord) o).text);
	}

	@Override
	public int hashCode() {
		return text.hashCode();
	}

	// Never print the word itself, this ends up in logs
	@Override
	public String toString() {
		return "SecretWord [length=" + text.length() + ", distinctLetters=" + positionIndex.size() + "]";
	}

}
