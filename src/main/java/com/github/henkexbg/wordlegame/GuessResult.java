package com.github.henkexbg.wordlegame;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The outcome of scoring one guess: one {@link PositionResult} per letter, in
 * the order of the guess. Immutable.
 *
 * @author Henrik Bjerne
 *
 */
public final class GuessResult {

	private final List<PositionResult> positionResults;

	public GuessResult(List<PositionResult> positionResults) {
		this.positionResults = Collections.unmodifiableList(new ArrayList<>(positionResults));
	}

	/**
	 * Result for a guess that is identical to the secret word.
	 *
	 * @param guess The guess
	 * @return A result with every position {@link PositionResultState#MATCHED}
	 */
	public static GuessResult allMatched(String guess) {
		List<PositionResult> result = new ArrayList<>(guess.length());
		for (int i = 0; i < guess.length(); i++) {
			result.add(new PositionResult(PositionResultState.MATCHED, guess.charAt(i)));
		}
		return new GuessResult(result);
	}

	/**
	 * @return true if every position is {@link PositionResultState#MATCHED}
	 */
	public boolean fullMatch() {
		return positionResults.stream()
				.allMatch(e -> PositionResultState.MATCHED.equals(e.getPositionResultState()));
	}

	public List<PositionResult> getPositionResults() {
		return positionResults;
	}

	public List<PositionResultState> getStates() {
		return positionResults.stream().map(PositionResult::getPositionResultState).collect(Collectors.toList());
	}

	public PositionResult get(int position) {
		return positionResults.get(position);
	}

	public int size() {
		return positionResults.size();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof GuessResult)) {
			return false;
		}
		return positionResults.equals(((GuessResult) o).positionResults);
	}

	@Override
	public int hashCode() {
		return positionResults.hashCode();
	}

	@Override
	public String toString() {
		return "GuessResult " + positionResults;
	}

}
