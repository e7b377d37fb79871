package com.github.henkexbg.wordlegame;

/**
 * Scores a guess against the secret word. The result states for each letter
 * whether it was matched, present in another position or absent.
 * Implementations are stateless and deterministic.
 *
 * @author Henrik
 *
 */
public interface GuessEvaluator {

	/**
	 * @param secret The secret word
	 * @param guess  Guess of exactly {@link SecretWord#WORD_LENGTH} characters
	 * @return One result per letter of the guess
	 * @throws IllegalArgumentException If the guess has the wrong length
	 */
	GuessResult evaluate(SecretWord secret, String guess);

	static void checkGuessLength(String guess) {
		if (guess.length() != SecretWord.WORD_LENGTH) {
			throw new IllegalArgumentException(
					String.format("Guess must be %s characters long, got '%s'", SecretWord.WORD_LENGTH, guess));
		}
	}

}
