package com.scholary.podcast.capture;

import org.springframework.stereotype.Component;

/** Records live meetings from the local sound system. */
@Component
public class JavaSoundRecordingSourceFactory implements RecordingSourceFactory {

  private final CaptureProperties properties;

  public JavaSoundRecordingSourceFactory(CaptureProperties properties) {
    this.properties = properties;
  }

  @Override
  public RecordingSource create(String jobId) {
    return new JavaSoundRecordingSource(jobId, properties);
  }
}
