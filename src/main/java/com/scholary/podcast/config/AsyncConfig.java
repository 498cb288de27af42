package com.scholary.podcast.config;

import com.scholary.podcast.narration.NarrationProperties;
import com.scholary.podcast.pipeline.PipelineProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for async task execution.
 *
 * <p>Three bounded pools:
 *
 * <ul>
 *   <li>{@code pipelineExecutor} runs job stages. No task on it waits for a recording to end.
 *   <li>{@code captureExecutor} runs the capture and transcript ingestion tasks of live meetings.
 *       Its tasks live as long as a recording, so it has no queue: a meeting that finds no free
 *       threads is rejected rather than left waiting.
 *   <li>{@code narrationExecutor} runs speech synthesis calls for all jobs; each job caps its own
 *       share.
 * </ul>
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "pipelineExecutor")
  public ThreadPoolTaskExecutor pipelineExecutor(PipelineProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.pipelineThreads());
    executor.setMaxPoolSize(properties.pipelineThreads());
    executor.setQueueCapacity(properties.pipelineQueueSize());
    executor.setThreadNamePrefix("pipeline-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "captureExecutor")
  public ThreadPoolTaskExecutor captureExecutor(PipelineProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.captureThreads());
    executor.setMaxPoolSize(properties.captureThreads());
    executor.setQueueCapacity(0);
    executor.setThreadNamePrefix("capture-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "narrationExecutor")
  public ThreadPoolTaskExecutor narrationExecutor(NarrationProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.poolSize());
    executor.setMaxPoolSize(properties.poolSize());
    executor.setQueueCapacity(properties.queueSize());
    executor.setThreadNamePrefix("narration-");
    executor.initialize();
    return executor;
  }
}
