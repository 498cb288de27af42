package com.scholary.podcast.storage;

import com.scholary.podcast.assembly.RenderedPodcast;
import com.scholary.podcast.audio.AudioConverter;
import com.scholary.podcast.objectstore.ObjectStoreClient;
import com.scholary.podcast.objectstore.ObjectStoreException;
import com.scholary.podcast.objectstore.ObjectStoreProperties;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Stores podcasts in the object store.
 *
 * <p>Layout per job: {@code <prefix><jobId>/podcast.wav}, {@code podcast.mp3} (when MP3 export is
 * on), {@code manifest.json} and {@code captions.srt}. The WAV is returned with a presigned
 * download URL. If any upload fails the objects already written are removed again.
 *
 * <p>The MP3 is a convenience copy: if it cannot be encoded the podcast is stored without it and
 * {@link StoredPodcast#mp3Key()} is null.
 */
@Component
public class ObjectStorePodcastStorage implements PodcastStorage {

  private static final Logger LOGGER = LoggerFactory.getLogger(ObjectStorePodcastStorage.class);

  private final ObjectStoreClient objectStoreClient;
  private final ManifestWriter manifestWriter;
  private final AudioConverter audioConverter;
  private final StorageProperties properties;
  private final String bucket;

  public ObjectStorePodcastStorage(
      ObjectStoreClient objectStoreClient,
      ManifestWriter manifestWriter,
      AudioConverter audioConverter,
      StorageProperties properties,
      ObjectStoreProperties objectStoreProperties) {
    this.objectStoreClient = objectStoreClient;
    this.manifestWriter = manifestWriter;
    this.audioConverter = audioConverter;
    this.properties = properties;
    this.bucket =
        properties.bucket() == null || properties.bucket().isBlank()
            ? objectStoreProperties.bucket()
            : properties.bucket();
  }

  @Override
  public StoredPodcast store(String jobId, RenderedPodcast podcast, PodcastManifest manifest) {
    String base = properties.keyPrefix() + jobId + "/";
    String audioKey = base + "podcast.wav";
    String manifestKey = base + "manifest.json";
    String captionsKey = base + "captions.srt";
    byte[] mp3 = properties.exportMp3() ? encodeMp3(jobId, podcast.wav()) : null;
    String mp3Key = mp3 == null ? null : base + "podcast.mp3";

    List<String> written = new ArrayList<>(4);
    try {
      put(audioKey, podcast.wav(), "audio/wav", written);
      if (mp3 != null) {
        put(mp3Key, mp3, "audio/mpeg", written);
      }
      put(manifestKey, manifestWriter.writeJson(manifest), "application/json", written);
      put(captionsKey, manifestWriter.writeSrt(manifest), "application/x-subrip", written);

      URL audioUrl =
          objectStoreClient.presignGet(
              bucket, audioKey, Duration.ofHours(properties.urlTtlHours()));

      LOGGER.info(
          "Stored podcast: bucket={}, audioKey={}, mp3Key={}, duration={}s",
          bucket,
          audioKey,
          mp3Key,
          podcast.durationSeconds());
      return new StoredPodcast(
          bucket, audioKey, mp3Key, manifestKey, captionsKey, audioUrl.toString());

    } catch (IOException | ObjectStoreException e) {
      deleteQuietly(written);
      throw new StorageFailedException("Failed to store podcast for job " + jobId, e);
    }
  }

  @Override
  public void discard(StoredPodcast stored) {
    LOGGER.info(
        "Discarding stored podcast: bucket={}, audioKey={}", stored.bucket(), stored.audioKey());
    List<String> keys = new ArrayList<>(4);
    keys.add(stored.audioKey());
    if (stored.mp3Key() != null) {
      keys.add(stored.mp3Key());
    }
    keys.add(stored.manifestKey());
    keys.add(stored.captionsKey());
    deleteQuietly(keys);
  }

  private byte[] encodeMp3(String jobId, byte[] wav) {
    Path dir = null;
    try {
      dir = Files.createTempDirectory("podcast-export-");
      Path wavFile = Files.write(dir.resolve("podcast.wav"), wav);
      Path mp3File = dir.resolve("podcast.mp3");
      audioConverter.toMp3(wavFile, mp3File, properties.mp3Bitrate());
      return Files.readAllBytes(mp3File);
    } catch (IOException e) {
      LOGGER.warn("MP3 export failed for job {}, storing WAV only: {}", jobId, e.getMessage());
      return null;
    } finally {
      deleteDirectory(dir);
    }
  }

  private static void deleteDirectory(Path dir) {
    if (dir == null) {
      return;
    }
    try (Stream<Path> paths = Files.walk(dir)) {
      for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
        Files.deleteIfExists(path);
      }
    } catch (IOException e) {
      LOGGER.warn("Failed to clean up export directory {}: {}", dir, e.getMessage());
    }
  }

  private void put(String key, byte[] bytes, String contentType, List<String> written) {
    objectStoreClient.putObject(
        bucket, key, new ByteArrayInputStream(bytes), bytes.length, contentType);
    written.add(key);
  }

  private void deleteQuietly(List<String> keys) {
    for (String key : keys) {
      try {
        objectStoreClient.deleteObject(bucket, key);
      } catch (ObjectStoreException e) {
        LOGGER.warn("Could not delete {} from bucket {}: {}", key, bucket, e.getMessage());
      }
    }
  }
}
