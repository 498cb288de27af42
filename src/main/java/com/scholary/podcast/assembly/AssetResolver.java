package com.scholary.podcast.assembly;

import java.io.IOException;

/** Resolves timeline source references to canonical WAV bytes. */
@FunctionalInterface
public interface AssetResolver {

  /**
   * Load an asset.
   *
   * @param sourceRef the reference stored in a timeline entry
   * @return canonical WAV bytes
   * @throws IOException if the asset cannot be read
   */
  byte[] load(String sourceRef) throws IOException;
}
