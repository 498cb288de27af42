package com.scholary.podcast.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.podcast.whisper.TranscriptionService;
import com.scholary.podcast.whisper.WhisperClient;
import com.scholary.podcast.whisper.WhisperProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for the Whisper transcription client. */
@Configuration
@EnableConfigurationProperties(WhisperProperties.class)
public class WhisperConfig {

  @Bean
  public TranscriptionService transcriptionService(
      WhisperProperties properties, ObjectMapper objectMapper) {
    return new WhisperClient(properties, objectMapper);
  }
}
