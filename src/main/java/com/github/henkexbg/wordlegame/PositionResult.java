package com.github.henkexbg.wordlegame;

import java.util.Objects;

/**
 * The state of one position in a guess, together with the guessed letter.
 *
 * @author Henrik Bjerne
 *
 */
public final class PositionResult {

	private final PositionResultState positionResultState;

	private final char c;

	public PositionResult(PositionResultState positionResultState, char c) {
		this.positionResultState = Objects.requireNonNull(positionResultState, "positionResultState");
		this.c = c;
	}

	public PositionResultState getPositionResultState() {
		return positionResultState;
	}

	public char getC() {
		return c;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof PositionResult)) {
			return false;
		}
		PositionResult other = (PositionResult) o;
		return c == other.c && positionResultState == other.positionResultState;
	}

	@Override
	public int hashCode() {
		return Objects.hash(positionResultState, c);
	}

	@Override
	public String toString() {
		return "PositionResult [positionResultState=" + positionResultState + ", c=" + c + "]";
	}

}
