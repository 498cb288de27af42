package com.scholary.podcast.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.podcast.narration.HttpSpeechSynthesizer;
import com.scholary.podcast.narration.SimulatedSpeechSynthesizer;
import com.scholary.podcast.narration.SpeechSynthesizer;
import com.scholary.podcast.narration.TtsProperties;
import com.scholary.podcast.selection.ContentScorer;
import com.scholary.podcast.selection.DisabledContentScorer;
import com.scholary.podcast.selection.HttpContentScorer;
import com.scholary.podcast.selection.ScorerProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Chooses the content scorer and speech synthesizer.
 *
 * <p>With {@code podcast.collaborators.mode=http} the vendor APIs configured under
 * {@code scorer.*} and {@code tts.*} are called. With {@code simulation} (the default) no network
 * calls are made: segments are scored by the local heuristic and narration is a generated tone.
 */
@Configuration
public class CollaboratorConfig {

  @Configuration
  @ConditionalOnProperty(name = "podcast.collaborators.mode", havingValue = "http")
  @EnableConfigurationProperties({ScorerProperties.class, TtsProperties.class})
  static class HttpCollaborators {

    @Bean
    @Primary
    ContentScorer contentScorer(ScorerProperties properties, ObjectMapper objectMapper) {
      return new HttpContentScorer(properties, objectMapper);
    }

    @Bean
    SpeechSynthesizer speechSynthesizer(TtsProperties properties, ObjectMapper objectMapper) {
      return new HttpSpeechSynthesizer(properties, objectMapper);
    }
  }

  @Configuration
  @ConditionalOnProperty(
      name = "podcast.collaborators.mode",
      havingValue = "simulation",
      matchIfMissing = true)
  static class SimulatedCollaborators {

    @Bean
    @Primary
    ContentScorer contentScorer() {
      return new DisabledContentScorer();
    }

    @Bean
    SpeechSynthesizer speechSynthesizer() {
      return new SimulatedSpeechSynthesizer();
    }
  }
}
