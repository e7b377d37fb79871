package com.github.henkexbg.wordlegame;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores guesses the way Wordle does: a letter is never marked
 * {@link PositionResultState#MATCHED} or {@link PositionResultState#PRESENT}
 * more times than it occurs in the secret word. Exact matches use up their
 * occurrences first, the remaining ones are handed out left to right.
 *
 * @author Henrik
 *
 */
public class OccurrenceCountingGuessEvaluator implements GuessEvaluator {

	@Override
	public GuessResult evaluate(SecretWord secret, String guess) {
		GuessEvaluator.checkGuessLength(guess);
		if (guess.equals(secret.reveal())) {
			return GuessResult.allMatched(guess);
		}
		List<PositionResult> result = new ArrayList<>(Arrays.asList(new PositionResult[guess.length()]));

		// Occurrences of each letter not yet used up by a match. Entries are
		// decremented as letters are "used"
		Map<Character, Integer> unusedOccurrences = new HashMap<>();

		// First loop - correct and non-present guesses populated
		for (int i = 0; i < guess.length(); i++) {
			char c = guess.charAt(i);
			unusedOccurrences.putIfAbsent(c, secret.occurrences(c));
			if (secret.isAtPosition(c, i)) {
				result.set(i, new PositionResult(PositionResultState.MATCHED, c));
				unusedOccurrences.merge(c, -1, Integer::sum);
			} else if (!secret.contains(c)) {
				result.set(i, new PositionResult(PositionResultState.ABSENT, c));
			}
		}

		// Second loop - letters in wrong position
		for (int i = 0; i < guess.length(); i++) {
			if (result.get(i) != null) {
				continue;
			}
			char c = guess.charAt(i);
			if (unusedOccurrences.get(c) > 0) {
				result.set(i, new PositionResult(PositionResultState.PRESENT, c));
				unusedOccurrences.merge(c, -1, Integer::sum);
			} else {
				result.set(i, new PositionResult(PositionResultState.ABSENT, c));
			}
		}
		return new GuessResult(result);
	}

}
