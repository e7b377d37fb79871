package com.github.henkexbg.wordlegame;

import java.util.StringJoiner;

/**
 * Turns results into text for the terminal. Matched letters are bold green,
 * present letters bold yellow and absent letters plain. With color switched off
 * only the letters are written.
 *
 * @author Henrik Bjerne
 *
 */
public class ResultPrinter {

	static final String RESET = "\u001B[0m";

	static final String BOLD_GREEN = "\u001B[1;32m";

	static final String BOLD_YELLOW = "\u001B[1;33m";

	static final String GREEN = "\u001B[32m";

	static final String RED = "\u001B[31m";

	private final boolean color;

	public ResultPrinter(boolean color) {
		this.color = color;
	}

	/**
	 * @param guessResult Result of a guess
	 * @return The guessed letters separated by space, styled per result
	 */
	public String format(GuessResult guessResult) {
		StringJoiner joiner = new StringJoiner(" ");
		for (PositionResult positionResult : guessResult.getPositionResults()) {
			joiner.add(colorize(positionResult));
		}
		return joiner.toString();
	}

	/**
	 * @return One placeholder per letter, shown before the first guess
	 */
	public String placeholder() {
		StringJoiner joiner = new StringJoiner(" ");
		for (int i = 0; i < SecretWord.WORD_LENGTH; i++) {
			joiner.add("_");
		}
		return joiner.toString();
	}

	public String won(int attempts) {
		return String.format("%s You needed %s attempts", style(GREEN, "You won!"), attempts);
	}

	public String lost(String secret) {
		return String.format("%s The word was '%s'", style(RED, "You lost :("), secret);
	}

	private String colorize(PositionResult positionResult) {
		String letter = String.valueOf(positionResult.getC());
		switch (positionResult.getPositionResultState()) {
		case MATCHED:
			return style(BOLD_GREEN, letter);
		case PRESENT:
			return style(BOLD_YELLOW, letter);
		default:
			return letter;
		}
	}

	private String style(String ansi, String text) {
		return color ? ansi + text + RESET : text;
	}

}
