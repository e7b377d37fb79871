package com.github.henkexbg.wordlegame;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This class contains the starting point as well as the game loop. A
 * {@link GuessEvaluator} is configured that scores each guess against the
 * secret word. The player has {@link GameConfig#getMaxAttempts()} guesses to
 * find the word.
 *
 * @author Henrik Bjerne
 *
 */
public class WordleGame {

	private static final Logger LOG = LoggerFactory.getLogger(WordleGame.class);

	/**
	 * Number of words drawn from the word source before giving up on finding one
	 * of valid length
	 */
	public static final int MAX_WORD_DRAWS = 10;

	private final GameConfig config;

	private final GuessEvaluator guessEvaluator;

	private final BufferedReader in;

	private final PrintStream out;

	private final ResultPrinter resultPrinter;

	public WordleGame(GameConfig config, GuessEvaluator guessEvaluator, BufferedReader in, PrintStream out,
			ResultPrinter resultPrinter) {
		this.config = config;
		this.guessEvaluator = guessEvaluator;
		this.in = in;
		this.out = out;
		this.resultPrinter = resultPrinter;
	}

	/**
	 * Runs the game loop until either the word is guessed, the number of attempts
	 * reaches the configured maximum or input ends.
	 *
	 * @param secret The word to guess
	 * @return Result of the game
	 */
	public GameResult play(SecretWord secret) {
		out.println(resultPrinter.placeholder());
		int attempts = 0;
		while (attempts < config.getMaxAttempts()) {
			String guess = readGuess();
			if (guess == null) {
				LOG.debug("Input ended after {} attempts", attempts);
				break;
			}
			if (guess.length() != SecretWord.WORD_LENGTH) {
				out.println(String.format("You'll need %s characters to make it work!", SecretWord.WORD_LENGTH));
				continue;
			}
			attempts++;
			GuessResult result = guessEvaluator.evaluate(secret, guess);
			LOG.debug("Attempt {}: {}", attempts, result.getStates());
			if (result.fullMatch()) {
				out.println(resultPrinter.won(attempts));
				return new GameResult(true, attempts, secret.reveal());
			}
			out.println(resultPrinter.format(result));
		}
		out.println(resultPrinter.lost(secret.reveal()));
		return new GameResult(false, attempts, secret.reveal());
	}

	/**
	 * @return Next guess, trailing whitespace removed and lower cased. Null when
	 *         input has ended
	 */
	private String readGuess() {
		try {
			String line = in.readLine();
			if (line == null) {
				return null;
			}
			return line.stripTrailing().toLowerCase(Locale.ROOT);
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to read user input", e);
		}
	}

	/**
	 * Draws words from the word source until one of valid length comes up.
	 *
	 * @param wordSource Word source
	 * @return Secret word
	 * @throws InvalidWordLengthException If no valid word was drawn within
	 *                                    {@link #MAX_WORD_DRAWS} tries
	 */
	static SecretWord drawSecret(WordSource wordSource) throws InvalidWordLengthException {
		InvalidWordLengthException lastException = null;
		for (int i = 0; i < MAX_WORD_DRAWS; i++) {
			try {
				return SecretWord.of(wordSource.nextWord());
			} catch (InvalidWordLengthException e) {
				LOG.warn("Word source returned an invalid word: {}", e.getMessage());
				lastException = e;
			}
		}
		throw lastException;
	}

	public static void main(String[] args) throws Exception {
		GameConfig config = GameConfig.load();
		WordSource wordSource = DictionaryWordSource.fromResource(config.getDictionaryResourceLocation(), new Random());
		WordleGame game = new WordleGame(config, config.getScoringMode().createEvaluator(),
				new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out,
				new ResultPrinter(config.isColor()));

		System.out.println("Welcome to Wordle!");
		GameResult result = game.play(drawSecret(wordSource));
		LOG.info("Game finished: {}", result);
		System.exit(result.isWon() ? 0 : 1);
	}

}
