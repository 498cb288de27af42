package com.scholary.podcast.storage;

import com.scholary.podcast.assembly.RenderedPodcast;

/** Destination for finished podcasts. */
public interface PodcastStorage {

  /**
   * Persist a rendered podcast and its manifest.
   *
   * @param jobId the owning job
   * @param podcast rendered audio
   * @param manifest description of the audio
   * @return where everything was written
   * @throws StorageFailedException if anything could not be written; nothing is left behind
   */
  StoredPodcast store(String jobId, RenderedPodcast podcast, PodcastManifest manifest);

  /**
   * Remove a stored podcast, used when the job was cancelled while its output was being handed
   * over. Best effort.
   */
  void discard(StoredPodcast stored);
}
