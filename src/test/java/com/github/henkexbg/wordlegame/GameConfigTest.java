package com.github.henkexbg.wordlegame;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Properties;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class GameConfigTest {

	@AfterEach
	void clearOverrides() {
		System.clearProperty(GameConfig.MAX_ATTEMPTS_KEY);
		System.clearProperty(GameConfig.SCORING_KEY);
	}

	@Test
	void emptyPropertiesGiveDefaults() {
		GameConfig config = GameConfig.fromProperties(new Properties());

		assertThat(config.getMaxAttempts()).isEqualTo(GameConfig.DEFAULT_MAX_ATTEMPTS);
		assertThat(config.getDictionaryResourceLocation()).isEqualTo("/dictionary.txt");
		assertThat(config.getScoringMode()).isEqualTo(ScoringMode.INDEXED);
		assertThat(config.isColor()).isTrue();
	}

	@Test
	void allKeysAreRead() {
		Properties properties = new Properties();
		properties.setProperty(GameConfig.MAX_ATTEMPTS_KEY, " 8 ");
		properties.setProperty(GameConfig.DICTIONARY_RESOURCE_KEY, "/test-dictionary.txt");
		properties.setProperty(GameConfig.SCORING_KEY, "occurrence_counted");
		properties.setProperty(GameConfig.COLOR_KEY, "FALSE");

		GameConfig config = GameConfig.fromProperties(properties);

		assertThat(config.getMaxAttempts()).isEqualTo(8);
		assertThat(config.getDictionaryResourceLocation()).isEqualTo("/test-dictionary.txt");
		assertThat(config.getScoringMode()).isEqualTo(ScoringMode.OCCURRENCE_COUNTED);
		assertThat(config.getScoringMode().createEvaluator()).isInstanceOf(OccurrenceCountingGuessEvaluator.class);
		assertThat(config.isColor()).isFalse();
	}

	@Test
	void invalidValuesAreRejected() {
		assertThatThrownBy(() -> GameConfig.fromProperties(with(GameConfig.MAX_ATTEMPTS_KEY, "six")))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining(GameConfig.MAX_ATTEMPTS_KEY);
		assertThatThrownBy(() -> GameConfig.fromProperties(with(GameConfig.MAX_ATTEMPTS_KEY, "0")))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> GameConfig.fromProperties(with(GameConfig.SCORING_KEY, "fancy")))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("fancy");
		assertThatThrownBy(() -> GameConfig.fromProperties(with(GameConfig.COLOR_KEY, "maybe")))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining(GameConfig.COLOR_KEY);
	}

	@Test
	void loadReadsBundledProperties() {
		GameConfig config = GameConfig.load();

		assertThat(config.getMaxAttempts()).isEqualTo(6);
		assertThat(config.getScoringMode()).isEqualTo(ScoringMode.INDEXED);
	}

	@Test
	void systemPropertiesOverrideBundledProperties() {
		System.setProperty(GameConfig.MAX_ATTEMPTS_KEY, "3");
		System.setProperty(GameConfig.SCORING_KEY, "OCCURRENCE_COUNTED");

		GameConfig config = GameConfig.load();

		assertThat(config.getMaxAttempts()).isEqualTo(3);
		assertThat(config.getScoringMode()).isEqualTo(ScoringMode.OCCURRENCE_COUNTED);
	}

	private static Properties with(String key, String value) {
		Properties properties = new Properties();
		properties.setProperty(key, value);
		return properties;
	}

}
