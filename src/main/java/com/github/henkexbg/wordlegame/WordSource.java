package com.github.henkexbg.wordlegame;

/**
 * Supplies candidate secret words. Words are expected to be
 * {@link SecretWord#WORD_LENGTH} characters long, anything else is rejected
 * when the {@link SecretWord} is created.
 *
 * @author Henrik
 *
 */
public interface WordSource {

	String nextWord();

}
