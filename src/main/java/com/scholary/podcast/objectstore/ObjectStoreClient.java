package com.scholary.podcast.objectstore;

import java.io.InputStream;
import java.net.URL;
import java.time.Duration;

/**
 * Abstraction for object storage operations.
 *
 * <p>Uploaded meeting recordings are read from here and finished podcasts are written back. Tests
 * mock this interface; production uses {@link S3ObjectStoreClient} against S3 or MinIO.
 */
public interface ObjectStoreClient {

  /**
   * Retrieve an object as a stream. The caller is responsible for closing the stream.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @return an input stream for reading the object
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  InputStream getObjectStream(String bucket, String key);

  /**
   * Store an object from a stream.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @param data the input stream containing object data
   * @param contentLength the size of the object in bytes
   * @param contentType the MIME type of the object
   * @throws ObjectStoreException if the upload fails
   */
  void putObject(
      String bucket, String key, InputStream data, long contentLength, String contentType);

  /**
   * Generate a presigned URL for temporary access to an object.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @param ttl time-to-live for the URL
   * @return a presigned URL
   * @throws ObjectStoreException if URL generation fails
   */
  URL presignGet(String bucket, String key, Duration ttl);

  /**
   * Delete an object. Deleting a missing object is not an error.
   *
   * @throws ObjectStoreException if the delete fails
   */
  void deleteObject(String bucket, String key);
}
