package com.scholary.podcast.capture;

import com.scholary.podcast.audio.AudioFormat;
import java.io.InputStream;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java Sound microphone capture producing canonical PCM.
 *
 * <p>The line is opened directly in the canonical format, so no conversion happens here. A line
 * that closes without {@link #stopCapture()} (device unplugged, mixer reset) ends the stream,
 * which the pipeline treats as a disconnect.
 */
public class JavaSoundRecordingSource implements RecordingSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(JavaSoundRecordingSource.class);

  private final String jobId;
  private final CaptureProperties properties;
  private final AtomicBoolean stopped = new AtomicBoolean();
  private volatile TargetDataLine line;

  public JavaSoundRecordingSource(String jobId, CaptureProperties properties) {
    this.jobId = jobId;
    this.properties = properties;
  }

  @Override
  public InputStream startCapture() {
    if (line != null) {
      throw new IllegalStateException("Capture already started for job " + jobId);
    }
    javax.sound.sampled.AudioFormat format = AudioFormat.toJavaSound();
    int bufferBytes = properties.lineBufferMillis() * AudioFormat.BYTE_RATE / 1000;
    try {
      TargetDataLine opened = openLine(format);
      opened.open(format, bufferBytes - bufferBytes % AudioFormat.BLOCK_ALIGN);
      opened.start();
      line = opened;
    } catch (LineUnavailableException | IllegalArgumentException | SecurityException e) {
      throw new RecordingDisconnectedException(
          "Cannot open capture line: " + e.getMessage(), e);
    }
    LOGGER.info(
        "Capture started: job={}, device='{}'",
        jobId,
        blank(properties.deviceName()) ? "default" : properties.deviceName());
    return new LineInputStream();
  }

  @Override
  public void stopCapture() {
    if (!stopped.compareAndSet(false, true)) {
      return;
    }
    TargetDataLine current = line;
    if (current != null) {
      current.stop();
      current.close();
      LOGGER.info("Capture stopped: job={}", jobId);
    }
  }

  private TargetDataLine openLine(javax.sound.sampled.AudioFormat format)
      throws LineUnavailableException {
    DataLine.Info info = new DataLine.Info(TargetDataLine.class, format);
    if (!blank(properties.deviceName())) {
      for (Mixer.Info mixerInfo : AudioSystem.getMixerInfo()) {
        if (mixerInfo.getName().equalsIgnoreCase(properties.deviceName())) {
          return (TargetDataLine) AudioSystem.getMixer(mixerInfo).getLine(info);
        }
      }
      LOGGER.warn("Capture device '{}' not found, using default", properties.deviceName());
    }
    return (TargetDataLine) AudioSystem.getLine(info);
  }

  private static boolean blank(String value) {
    return value == null || value.isBlank();
  }

  private class LineInputStream extends InputStream {

    @Override
    public int read() {
      throw new UnsupportedOperationException("PCM is read in frames");
    }

    @Override
    public int read(byte[] buffer, int offset, int length) {
      int aligned = length - length % AudioFormat.BLOCK_ALIGN;
      if (aligned == 0) {
        return 0;
      }
      TargetDataLine current = line;
      if (current == null || (!current.isOpen() && current.available() == 0)) {
        return -1;
      }
      int read = current.read(buffer, offset, aligned);
      if (read == 0 && (stopped.get() || !current.isOpen())) {
        return -1;
      }
      return read;
    }
  }
}
