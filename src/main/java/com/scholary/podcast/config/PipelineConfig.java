package com.scholary.podcast.config;

import com.scholary.podcast.assembly.AssemblyProperties;
import com.scholary.podcast.capture.CaptureProperties;
import com.scholary.podcast.narration.NarrationProperties;
import com.scholary.podcast.pipeline.PipelineProperties;
import com.scholary.podcast.selection.SelectionProperties;
import com.scholary.podcast.storage.StorageProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Enables the {@code podcast.*} properties that tune the pipeline stages. */
@Configuration
@EnableConfigurationProperties({
  PipelineProperties.class,
  SelectionProperties.class,
  NarrationProperties.class,
  AssemblyProperties.class,
  StorageProperties.class,
  CaptureProperties.class
})
public class PipelineConfig {}
