package com.github.henkexbg.wordlegame;

/**
 * Thrown when a word does not have exactly {@link SecretWord#WORD_LENGTH}
 * characters. The caller is expected to reject the input and ask for another
 * one.
 *
 * @author Henrik Bjerne
 *
 */
public class InvalidWordLengthException extends Exception {

	private static final long serialVersionUID = 1L;

	private final int actual;

	public InvalidWordLengthException(int actual) {
		super(String.format("Word must be exactly %s characters long, got %s", SecretWord.WORD_LENGTH, actual));
		this.actual = actual;
	}

	public int getActual() {
		return actual;
	}

	public int getExpected() {
		return SecretWord.WORD_LENGTH;
	}

}
