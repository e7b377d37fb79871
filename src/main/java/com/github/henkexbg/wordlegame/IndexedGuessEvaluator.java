package com.github.henkexbg.wordlegame;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores each position of a guess independently using the letter position
 * index of the {@link SecretWord}. A letter is
 * {@link PositionResultState#PRESENT} whenever it occurs anywhere else in the
 * word, regardless of how many times it has already been matched or marked.
 * With secret "bathe" the guess "kayak" therefore gets both of its 'a's
 * marked, even though the word has only one. Use
 * {@link OccurrenceCountingGuessEvaluator} for standard Wordle scoring.
 *
 * @author Henrik Bjerne
 *
 */
public class IndexedGuessEvaluator implements GuessEvaluator {

	@Override
	public GuessResult evaluate(SecretWord secret, String guess) {
		GuessEvaluator.checkGuessLength(guess);
		if (guess.equals(secret.reveal())) {
			return GuessResult.allMatched(guess);
		}

		List<PositionResult> result = new ArrayList<>(guess.length());
		for (int i = 0; i < guess.length(); i++) {
			char c = guess.charAt(i);
			if (secret.isAtPosition(c, i)) {
				result.add(new PositionResult(PositionResultState.MATCHED, c));
			} else if (secret.contains(c)) {
				result.add(new PositionResult(PositionResultState.PRESENT, c));
			} else {
				result.add(new PositionResult(PositionResultState.ABSENT, c));
			}
		}
		return new GuessResult(result);
	}

}
