package com.scholary.audiobook.handler.objectstore;

import java.io.InputStream;
import java.net.URL;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Abstraction for object storage operations.
 *
 * <p>The library of books is a key layout in a single bucket, so everything the ingestion side and
 * the catalog side need is expressed here: read, write, list by prefix, delete, and presign.
 */
public interface ObjectStoreClient {

  /**
   * Retrieve an object as a stream. The caller is responsible for closing the stream.
   *
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
   * Upload a local file. Segments can be well over 100MB, so they are streamed from disk rather
   * than buffered.
   *
   * @throws ObjectStoreException if the upload fails
   */
  void putFile(String bucket, String key, Path file, String contentType);

  /**
   * List every object whose key starts with the prefix, sorted by key.
   *
   * @throws ObjectStoreException if listing fails
   */
  List<ObjectSummary> listObjects(String bucket, String prefix);

  /**
   * Delete an object. Deleting a missing key is not an error.
   *
   * @throws ObjectStoreException if the delete fails
   */
  void deleteObject(String bucket, String key);

  /**
   * Generate a presigned URL for temporary access to an object.
   *
   * @throws ObjectStoreException if URL generation fails
   */
  URL presignGet(String bucket, String key, Duration ttl);

  /**
   * Get object metadata without downloading the content.
   *
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  ObjectMetadata getObjectMetadata(String bucket, String key);

  /** Object metadata returned by getObjectMetadata. */
  record ObjectMetadata(long contentLength, String contentType) {}

  /** One entry of a prefix listing. */
  record ObjectSummary(String key, long size) {}
}
