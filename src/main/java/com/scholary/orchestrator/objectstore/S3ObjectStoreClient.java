package com.scholary.orchestrator.objectstore;

import java.net.URI;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

/**
 * S3/MinIO implementation of ObjectStoreClient.
 *
 * <p>This uses AWS SDK v2, which works with both real S3 and S3-compatible services like MinIO. The
 * key difference is the endpoint and path-style access configuration.
 *
 * <p>The SDK retries transient failures (network issues, 500 errors, throttling) on its own. For
 * missing objects and permission errors we fail fast.
 */
public class S3ObjectStoreClient implements ObjectStoreClient, AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3ObjectStoreClient.class);

  private final S3Client s3Client;

  public S3ObjectStoreClient(ObjectStoreProperties properties) {
    this(buildClient(properties));
  }

  public S3ObjectStoreClient(S3Client s3Client) {
    this.s3Client = s3Client;
  }

  private static S3Client buildClient(ObjectStoreProperties properties) {
    LOGGER.info(
        "Initializing S3 client: endpoint={}, bucket={}, pathStyleAccess={}",
        properties.endpoint(),
        properties.bucket(),
        properties.pathStyleAccess());

    AwsBasicCredentials credentials =
        AwsBasicCredentials.create(properties.accessKey(), properties.secretKey());

    Region region =
        properties.region() != null && !properties.region().isEmpty()
            ? Region.of(properties.region())
            : Region.US_EAST_1;

    return S3Client.builder()
        .region(region)
        .credentialsProvider(StaticCredentialsProvider.create(credentials))
        .endpointOverride(URI.create(properties.endpoint()))
        .forcePathStyle(properties.pathStyleAccess()) // Required for MinIO
        .build();
  }

  @Override
  public void putObject(String bucket, String key, byte[] data, String contentType) {
    LOGGER.debug(
        "Uploading object: bucket={}, key={}, contentLength={}, contentType={}",
        bucket,
        key,
        data.length,
        contentType);

    try {
      PutObjectRequest request =
          PutObjectRequest.builder()
              .bucket(bucket)
              .key(key)
              .contentType(contentType)
              .contentLength((long) data.length)
              .build();

      s3Client.putObject(request, RequestBody.fromBytes(data));

      LOGGER.info("Successfully uploaded object: bucket={}, key={}", bucket, key);

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to upload object: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  @Override
  public byte[] getObject(String bucket, String key) {
    LOGGER.debug("Fetching object: bucket={}, key={}", bucket, key);

    try {
      GetObjectRequest request = GetObjectRequest.builder().bucket(bucket).key(key).build();
      byte[] bytes = s3Client.getObjectAsBytes(request).asByteArray();

      LOGGER.debug("Retrieved object: bucket={}, key={}, size={}", bucket, key, bytes.length);
      return bytes;

    } catch (NoSuchKeyException e) {
      // Not retryable; callers decide whether a missing object is an error
      String message = String.format("Object not found: bucket=%s, key=%s", bucket, key);
      LOGGER.warn(message);
      throw new ObjectNotFoundException(message, e);

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to retrieve object: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  @Override
  public List<String> listKeys(String bucket, String prefix) {
    LOGGER.debug("Listing objects: bucket={}, prefix={}", bucket, prefix);

    try {
      ListObjectsV2Request request =
          ListObjectsV2Request.builder().bucket(bucket).prefix(prefix).build();
      return s3Client.listObjectsV2Paginator(request).contents().stream()
          .map(S3Object::key)
          .toList();

    } catch (NoSuchBucketException e) {
      LOGGER.warn("Bucket does not exist yet: {}", bucket);
      return List.of();

    } catch (S3Exception e) {
      String message =
          String.format(
              "Failed to list objects: bucket=%s, prefix=%s, statusCode=%s",
              bucket, prefix, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  @Override
  public boolean objectExists(String bucket, String key) {
    try {
      s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build());
      return true;

    } catch (NoSuchKeyException e) {
      return false;

    } catch (S3Exception e) {
      if (e.statusCode() == 404) {
        return false;
      }
      String message =
          String.format(
              "Failed to check object: bucket=%s, key=%s, statusCode=%s",
              bucket, key, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  @Override
  public void ensureBucket(String bucket) {
    try {
      s3Client.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
      LOGGER.debug("Bucket exists: {}", bucket);

    } catch (NoSuchBucketException e) {
      createBucket(bucket);

    } catch (S3Exception e) {
      if (e.statusCode() != 404) {
        String message =
            String.format("Failed to check bucket: bucket=%s, statusCode=%s", bucket, e.statusCode());
        LOGGER.error(message, e);
        throw new ObjectStoreException(message, e);
      }
      createBucket(bucket);
    }
  }

  private void createBucket(String bucket) {
    try {
      s3Client.createBucket(CreateBucketRequest.builder().bucket(bucket).build());
      LOGGER.info("Created bucket: {}", bucket);

    } catch (S3Exception e) {
      String message =
          String.format("Failed to create bucket: bucket=%s, statusCode=%s", bucket, e.statusCode());
      LOGGER.error(message, e);
      throw new ObjectStoreException(message, e);
    }
  }

  /** Release connections and threads held by the SDK client. */
  @Override
  public void close() {
    LOGGER.info("Closing S3 client");
    s3Client.close();
  }
}
