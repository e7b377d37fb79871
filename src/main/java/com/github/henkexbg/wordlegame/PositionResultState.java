package com.github.henkexbg.wordlegame;

/**
 * Result for one letter of a guess.
 *
 * @author Henrik Bjerne
 *
 */
public enum PositionResultState {

	/**
	 * Right letter in the right position. Green in Wordle.
	 */
	MATCHED,

	/**
	 * Letter exists in the word but in another position. Yellow in Wordle.
	 */
	PRESENT,

	/**
	 * Letter does not exist in the word. Grey in Wordle.
	 */
	ABSENT

}
