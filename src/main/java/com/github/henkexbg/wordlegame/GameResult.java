package com.github.henkexbg.wordlegame;

/**
 * Holds the outcome of one game.
 *
 * @author Henrik
 *
 */
public class GameResult {

	private final boolean won;

	private final int attempts;

	private final String secret;

	public GameResult(boolean won, int attempts, String secret) {
		this.won = won;
		this.attempts = attempts;
		this.secret = secret;
	}

	public boolean isWon() {
		return won;
	}

	/**
	 * @return Number of scored guesses, including the winning one. Rejected input
	 *         is not counted
	 */
	public int getAttempts() {
		return attempts;
	}

	public String getSecret() {
		return secret;
	}

	@Override
	public String toString() {
		return "GameResult [won=" + won + ", attempts=" + attempts + "]";
	}

}
