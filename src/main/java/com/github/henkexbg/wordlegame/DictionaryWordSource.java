package com.github.henkexbg.wordlegame;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Word source backed by a dictionary. File format is assumed to be one word per
 * line. Words of the wrong length or words that contain non-alphabetic
 * characters are discarded. Each call to {@link #nextWord()} picks a random
 * word from the remaining ones.
 *
 * @author Henrik Bjerne
 *
 */
public class DictionaryWordSource implements WordSource {

	private static final Logger LOG = LoggerFactory.getLogger(DictionaryWordSource.class);

	/**
	 * All words loaded from the dictionary. Considered read-only
	 */
	private final List<String> dictionary;

	private final Random random;

	public DictionaryWordSource(List<String> words, Random random) {
		if (words.isEmpty()) {
			throw new IllegalStateException("Dictionary does not contain any words");
		}
		this.dictionary = Collections.unmodifiableList(new ArrayList<>(words));
		this.random = random;
	}

	/**
	 * Loads the dictionary from a classpath resource.
	 *
	 * @param resourceLocation Resource location, for example "/dictionary.txt"
	 * @param random           Random used to pick words
	 * @return Word source
	 * @throws IllegalStateException If the resource is missing or holds no valid
	 *                               words
	 */
	public static DictionaryWordSource fromResource(String resourceLocation, Random random) {
		InputStream dictionaryStream = DictionaryWordSource.class.getResourceAsStream(resourceLocation);
		if (dictionaryStream == null) {
			throw new IllegalStateException(String.format("Dictionary resource %s not found", resourceLocation));
		}
		List<String> words = readWords(dictionaryStream);
		LOG.info("Added {} words to dictionary from {}", words.size(), resourceLocation);
		return new DictionaryWordSource(words, random);
	}

	/**
	 * Reads all valid words from the stream, then closes it.
	 *
	 * @param dictionaryStream Dictionary, UTF-8, one word per line
	 * @return Valid words, lower case
	 */
	static List<String> readWords(InputStream dictionaryStream) {
		List<String> words = new ArrayList<>();
		try (BufferedReader br = new BufferedReader(new InputStreamReader(dictionaryStream, StandardCharsets.UTF_8))) {
			String oneLine;
			while ((oneLine = br.readLine()) != null) {
				String word = oneLine.trim();
				if (word.length() != SecretWord.WORD_LENGTH || !isStringAlphabetic(word)) {
					if (!word.isEmpty()) {
						LOG.debug("Skipping dictionary entry '{}'", word);
					}
					continue;
				}
				words.add(word.toLowerCase(Locale.ROOT));
			}
		} catch (IOException e) {
			throw new UncheckedIOException("Could not read dictionary", e);
		}
		return words;
	}

	/**
	 * Simple helper method that checks that all letters in a string are
	 * alphabetical characters.
	 *
	 * @param s String
	 * @return true if only alphabetic characters.
	 */
	static boolean isStringAlphabetic(String s) {
		for (int i = 0; i < s.length(); i++) {
			if (!Character.isLetter(s.charAt(i))) {
				return false;
			}
		}
		return true;
	}

	@Override
	public String nextWord() {
		return dictionary.get(random.nextInt(dictionary.size()));
	}

	public List<String> getWords() {
		return dictionary;
	}

}
