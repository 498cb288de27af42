package com.scholary.podcast.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.podcast.assembly.RenderedPodcast;
import com.scholary.podcast.audio.AudioConverter;
import com.scholary.podcast.audio.WavCodec;
import com.scholary.podcast.error.ErrorKind;
import com.scholary.podcast.objectstore.ObjectStoreClient;
import com.scholary.podcast.objectstore.ObjectStoreException;
import com.scholary.podcast.objectstore.ObjectStoreProperties;
import java.io.IOException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ObjectStorePodcastStorageTest {

  @Mock private ObjectStoreClient objectStoreClient;
  @Mock private AudioConverter audioConverter;

  private static final byte[] MP3_BYTES = {(byte) 0xFF, (byte) 0xFB, 0x10, 0x00};

  private ObjectStorePodcastStorage storage;

  private final RenderedPodcast podcast =
      new RenderedPodcast(WavCodec.encode(new short[160]), 0.01);
  private final PodcastManifest manifest =
      new PodcastManifest(
          "job-7",
          "Retro",
          "2026-03-02T10:15:30Z",
          "default",
          "calm",
          0.01,
          null,
          List.of(),
          List.of());

  @BeforeEach
  void setUp() {
    storage =
        new ObjectStorePodcastStorage(
            objectStoreClient,
            new ManifestWriter(new ObjectMapper()),
            audioConverter,
            new StorageProperties("", "podcasts/", 24, true, "192k"),
            new ObjectStoreProperties(
                "http://localhost:9000",
                "minioadmin",
                "minioadmin",
                "meetings",
                "us-east-1",
                true));
  }

  @Test
  void store_shouldWriteAudioMp3ManifestAndCaptions() throws Exception {
    when(objectStoreClient.presignGet(
            eq("meetings"), eq("podcasts/job-7/podcast.wav"), eq(Duration.ofHours(24))))
        .thenReturn(new URL("http://localhost:9000/meetings/podcasts/job-7/podcast.wav?sig=1"));
    doAnswer(
            invocation -> {
              Files.write(invocation.getArgument(1, Path.class), MP3_BYTES);
              return null;
            })
        .when(audioConverter)
        .toMp3(any(Path.class), any(Path.class), eq("192k"));

    StoredPodcast stored = storage.store("job-7", podcast, manifest);

    assertThat(stored.bucket()).isEqualTo("meetings");
    assertThat(stored.audioKey()).isEqualTo("podcasts/job-7/podcast.wav");
    assertThat(stored.mp3Key()).isEqualTo("podcasts/job-7/podcast.mp3");
    assertThat(stored.manifestKey()).isEqualTo("podcasts/job-7/manifest.json");
    assertThat(stored.captionsKey()).isEqualTo("podcasts/job-7/captions.srt");
    assertThat(stored.audioUrl()).contains("sig=1");
    verify(objectStoreClient)
        .putObject(
            eq("meetings"),
            eq("podcasts/job-7/podcast.wav"),
            any(),
            eq((long) podcast.wav().length),
            eq("audio/wav"));
    verify(objectStoreClient)
        .putObject(
            eq("meetings"),
            eq("podcasts/job-7/podcast.mp3"),
            any(),
            eq((long) MP3_BYTES.length),
            eq("audio/mpeg"));
    verify(objectStoreClient)
        .putObject(
            eq("meetings"),
            eq("podcasts/job-7/manifest.json"),
            any(),
            anyLong(),
            eq("application/json"));
  }

  @Test
  void store_shouldKeepWavWhenMp3CannotBeEncoded() throws Exception {
    when(objectStoreClient.presignGet(any(), any(), any()))
        .thenReturn(new URL("http://localhost:9000/meetings/podcasts/job-7/podcast.wav?sig=1"));
    doThrow(new IOException("Cannot run program \"ffmpeg\""))
        .when(audioConverter)
        .toMp3(any(Path.class), any(Path.class), any());

    StoredPodcast stored = storage.store("job-7", podcast, manifest);

    assertThat(stored.mp3Key()).isNull();
    assertThat(stored.audioKey()).isEqualTo("podcasts/job-7/podcast.wav");
    verify(objectStoreClient, never())
        .putObject(any(), eq("podcasts/job-7/podcast.mp3"), any(), anyLong(), any());
  }

  @Test
  void store_shouldRemovePartialUploadsOnFailure() {
    lenient()
        .doThrow(new ObjectStoreException("bucket full"))
        .when(objectStoreClient)
        .putObject(eq("meetings"), eq("podcasts/job-7/captions.srt"), any(), anyLong(), any());

    assertThatThrownBy(() -> storage.store("job-7", podcast, manifest))
        .isInstanceOfSatisfying(
            StorageFailedException.class,
            e -> assertThat(e.kind()).isEqualTo(ErrorKind.STORAGE_FAILED));

    verify(objectStoreClient).deleteObject("meetings", "podcasts/job-7/podcast.wav");
    verify(objectStoreClient).deleteObject("meetings", "podcasts/job-7/manifest.json");
    verify(objectStoreClient, never()).deleteObject("meetings", "podcasts/job-7/captions.srt");
  }

  @Test
  void discard_shouldDeleteEveryObjectAndTolerateFailures() {
    lenient()
        .doThrow(new ObjectStoreException("gone"))
        .when(objectStoreClient)
        .deleteObject("meetings", "podcasts/job-7/podcast.wav");

    storage.discard(
        new StoredPodcast(
            "meetings",
            "podcasts/job-7/podcast.wav",
            "podcasts/job-7/podcast.mp3",
            "podcasts/job-7/manifest.json",
            "podcasts/job-7/captions.srt",
            "http://example"));

    verify(objectStoreClient).deleteObject("meetings", "podcasts/job-7/podcast.mp3");
    verify(objectStoreClient).deleteObject("meetings", "podcasts/job-7/manifest.json");
    verify(objectStoreClient).deleteObject("meetings", "podcasts/job-7/captions.srt");
  }
}
