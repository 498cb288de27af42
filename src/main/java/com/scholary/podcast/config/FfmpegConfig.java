package com.scholary.podcast.config;

import com.scholary.podcast.audio.FfmpegProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for ffmpeg-related beans.
 *
 * <p>Enables the FfmpegProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(FfmpegProperties.class)
public class FfmpegConfig {}
