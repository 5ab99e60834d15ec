package com.scholary.orchestrator.objectstore;

import java.util.List;

/**
 * Abstraction for object storage operations.
 *
 * <p>Decouples the result store from a specific backend (S3, MinIO) and lets tests mock storage.
 * Batch records are small JSON documents, so objects are moved as byte arrays.
 */
public interface ObjectStoreClient {

  /**
   * Store an object.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @param data the object content
   * @param contentType the MIME type of the object
   * @throws ObjectStoreException if the upload fails
   */
  void putObject(String bucket, String key, byte[] data, String contentType);

  /**
   * Retrieve an object.
   *
   * @throws ObjectNotFoundException if the object doesn't exist
   * @throws ObjectStoreException if retrieval fails
   */
  byte[] getObject(String bucket, String key);

  /** Keys under a prefix, in the order the backend returns them. */
  List<String> listKeys(String bucket, String prefix);

  boolean objectExists(String bucket, String key);

  /** Create the bucket unless it already exists. */
  void ensureBucket(String bucket);
}
