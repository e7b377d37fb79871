package com.github.henkexbg.wordlegame;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Collections;
import java.util.Random;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DictionaryWordSourceTest {

	@Test
	@DisplayName("blank, wrong length and non-alphabetic lines are skipped")
	void invalidLinesAreSkipped() {
		DictionaryWordSource source = DictionaryWordSource.fromResource("/test-dictionary.txt", new Random(42));

		assertThat(source.getWords()).containsExactly("bathe", "braid", "lemon");
	}

	@Test
	void nextWordComesFromDictionary() {
		DictionaryWordSource source = DictionaryWordSource.fromResource("/test-dictionary.txt", new Random(42));

		for (int i = 0; i < 20; i++) {
			assertThat(source.nextWord()).isIn("bathe", "braid", "lemon");
		}
	}

	@Test
	void nextWordUsesRandom() {
		Random fixed = new Random() {
			private static final long serialVersionUID = 1L;

			@Override
			public int nextInt(int bound) {
				return 1;
			}
		};
		DictionaryWordSource source = DictionaryWordSource.fromResource("/test-dictionary.txt", fixed);

		assertThat(source.nextWord()).isEqualTo("braid");
	}

	@Test
	void missingResource() {
		assertThatThrownBy(() -> DictionaryWordSource.fromResource("/no-such-dictionary.txt", new Random()))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("/no-such-dictionary.txt");
	}

	@Test
	void noValidWords() {
		assertThatThrownBy(() -> DictionaryWordSource.fromResource("/invalid-dictionary.txt", new Random()))
				.isInstanceOf(IllegalStateException.class);
		assertThatThrownBy(() -> new DictionaryWordSource(Collections.emptyList(), new Random()))
				.isInstanceOf(IllegalStateException.class);
	}

	@Test
	@DisplayName("every bundled word can be used as a secret word")
	void bundledDictionary() throws Exception {
		DictionaryWordSource source = DictionaryWordSource.fromResource(
				GameConfig.DEFAULT_DICTIONARY_RESOURCE_LOCATION, new Random());

		assertThat(source.getWords()).hasSizeGreaterThan(100);
		for (String word : source.getWords()) {
			assertThat(SecretWord.of(word).reveal()).isEqualTo(word);
		}
	}

	@Test
	void isStringAlphabetic() {
		assertThat(DictionaryWordSource.isStringAlphabetic("bathe")).isTrue();
		assertThat(DictionaryWordSource.isStringAlphabetic("ab1de")).isFalse();
		assertThat(DictionaryWordSource.isStringAlphabetic("ab de")).isFalse();
	}

}
