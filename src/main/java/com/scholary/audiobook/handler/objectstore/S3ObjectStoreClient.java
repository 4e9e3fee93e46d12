package com.scholary.audiobook.handler.objectstore;

import java.io.InputStream;
import java.net.URI;
import java.net.URL;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PresignedGetObjectRequest;

/**
 * S3/MinIO implementation of ObjectStoreClient.
 *
 * <p>This uses AWS SDK v2, which works with both real S3 and S3-compatible services like MinIO. The
 * key difference is the endpoint and path-style access configuration.
 *
 * <p>The SDK retries transient failures itself. Whatever still fails is translated into an {@link
 * ObjectStoreException}: credential rejections become {@link ObjectStoreAuthException}, connection
 * problems and 5xx/429 responses are marked transient, everything else fails fast.
 */
public class S3ObjectStoreClient implements ObjectStoreClient, AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(S3ObjectStoreClient.class);

  private final S3Client s3Client;
  private final S3Presigner s3Presigner;

  public S3ObjectStoreClient(ObjectStoreProperties properties) {
    LOGGER.info(
        "Initializing S3 client: endpoint={}, bucket={}, pathStyleAccess={}",
        properties.endpoint(),
        properties.bucket(),
        properties.pathStyleAccess());

    AwsBasicCredentials credentials =
        AwsBasicCredentials.create(properties.accessKey(), properties.secretKey());
    StaticCredentialsProvider credentialsProvider = StaticCredentialsProvider.create(credentials);

    Region region =
        properties.region() != null && !properties.region().isEmpty()
            ? Region.of(properties.region())
            : Region.US_EAST_1;

    this.s3Client =
        S3Client.builder()
            .region(region)
            .credentialsProvider(credentialsProvider)
            .endpointOverride(URI.create(properties.endpoint()))
            .forcePathStyle(properties.pathStyleAccess()) // Required for MinIO
            .build();

    this.s3Presigner =
        S3Presigner.builder()
            .region(region)
            .credentialsProvider(credentialsProvider)
            .endpointOverride(URI.create(properties.endpoint()))
            .build();

    LOGGER.info("S3 client initialized successfully");
  }

  S3ObjectStoreClient(S3Client s3Client, S3Presigner s3Presigner) {
    this.s3Client = s3Client;
    this.s3Presigner = s3Presigner;
  }

  @Override
  public InputStream getObjectStream(String bucket, String key) {
    LOGGER.debug("Fetching object: bucket={}, key={}", bucket, key);

    try {
      GetObjectRequest request = GetObjectRequest.builder().bucket(bucket).key(key).build();
      InputStream stream = s3Client.getObject(request);
      LOGGER.info("Successfully retrieved object: bucket={}, key={}", bucket, key);
      return stream;

    } catch (Exception e) {
      throw translate("retrieve object", bucket, key, e);
    }
  }

  @Override
  public void putObject(
      String bucket, String key, InputStream data, long contentLength, String contentType) {
    LOGGER.debug(
        "Uploading object: bucket={}, key={}, contentLength={}, contentType={}",
        bucket,
        key,
        contentLength,
        contentType);

    try {
      PutObjectRequest request =
          PutObjectRequest.builder()
              .bucket(bucket)
              .key(key)
              .contentType(contentType)
              .contentLength(contentLength)
              .build();

      s3Client.putObject(request, RequestBody.fromInputStream(data, contentLength));
      LOGGER.info("Successfully uploaded object: bucket={}, key={}", bucket, key);

    } catch (Exception e) {
      throw translate("upload object", bucket, key, e);
    }
  }

  @Override
  public void putFile(String bucket, String key, Path file, String contentType) {
    LOGGER.debug("Uploading file: bucket={}, key={}, file={}", bucket, key, file);

    try {
      PutObjectRequest request =
          PutObjectRequest.builder().bucket(bucket).key(key).contentType(contentType).build();

      s3Client.putObject(request, RequestBody.fromFile(file));
      LOGGER.info("Successfully uploaded file: bucket={}, key={}", bucket, key);

    } catch (Exception e) {
      throw translate("upload file", bucket, key, e);
    }
  }

  @Override
  public List<ObjectSummary> listObjects(String bucket, String prefix) {
    LOGGER.debug("Listing objects: bucket={}, prefix={}", bucket, prefix);

    try {
      List<ObjectSummary> summaries = new ArrayList<>();
      String continuationToken = null;
      do {
        ListObjectsV2Request request =
            ListObjectsV2Request.builder()
                .bucket(bucket)
                .prefix(prefix)
                .continuationToken(continuationToken)
                .build();
        ListObjectsV2Response response = s3Client.listObjectsV2(request);
        for (S3Object object : response.contents()) {
          summaries.add(new ObjectSummary(object.key(), object.size() == null ? 0 : object.size()));
        }
        continuationToken =
            Boolean.TRUE.equals(response.isTruncated()) ? response.nextContinuationToken() : null;
      } while (continuationToken != null);

      summaries.sort(Comparator.comparing(ObjectSummary::key));
      LOGGER.info("Listed {} objects: bucket={}, prefix={}", summaries.size(), bucket, prefix);
      return summaries;

    } catch (Exception e) {
      throw translate("list objects", bucket, prefix, e);
    }
  }

  @Override
  public void deleteObject(String bucket, String key) {
    LOGGER.debug("Deleting object: bucket={}, key={}", bucket, key);

    try {
      s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
      LOGGER.info("Deleted object: bucket={}, key={}", bucket, key);

    } catch (Exception e) {
      throw translate("delete object", bucket, key, e);
    }
  }

  @Override
  public URL presignGet(String bucket, String key, Duration ttl) {
    LOGGER.debug("Generating presigned URL: bucket={}, key={}, ttl={}", bucket, key, ttl);

    try {
      GetObjectRequest getObjectRequest =
          GetObjectRequest.builder().bucket(bucket).key(key).build();

      GetObjectPresignRequest presignRequest =
          GetObjectPresignRequest.builder()
              .signatureDuration(ttl)
              .getObjectRequest(getObjectRequest)
              .build();

      PresignedGetObjectRequest presignedRequest = s3Presigner.presignGetObject(presignRequest);
      URL url = presignedRequest.url();

      LOGGER.info("Generated presigned URL: bucket={}, key={}", bucket, key);
      return url;

    } catch (Exception e) {
      throw translate("generate presigned URL", bucket, key, e);
    }
  }

  @Override
  public ObjectMetadata getObjectMetadata(String bucket, String key) {
    LOGGER.debug("Getting metadata for object: bucket={}, key={}", bucket, key);

    try {
      HeadObjectRequest request = HeadObjectRequest.builder().bucket(bucket).key(key).build();
      HeadObjectResponse response = s3Client.headObject(request);

      LOGGER.info(
          "Retrieved metadata: bucket={}, key={}, size={} bytes, contentType={}",
          bucket,
          key,
          response.contentLength(),
          response.contentType());

      return new ObjectMetadata(response.contentLength(), response.contentType());

    } catch (Exception e) {
      throw translate("get metadata", bucket, key, e);
    }
  }

  private ObjectStoreException translate(String action, String bucket, String key, Exception e) {
    if (e instanceof NoSuchKeyException) {
      String message = String.format("Object not found: bucket=%s, key=%s", bucket, key);
      LOGGER.error(message);
      return new ObjectStoreException(message, e);
    }

    if (e instanceof S3Exception s3e) {
      int status = s3e.statusCode();
      String message =
          String.format(
              "Failed to %s: bucket=%s, key=%s, statusCode=%s", action, bucket, key, status);
      LOGGER.error(message, e);
      if (status == 401 || status == 403) {
        return new ObjectStoreAuthException(message, e);
      }
      return new ObjectStoreException(message, e, status >= 500 || status == 429);
    }

    if (e instanceof SdkClientException) {
      String message =
          String.format("Could not reach object store to %s: bucket=%s, key=%s", action, bucket, key);
      LOGGER.error(message, e);
      return new ObjectStoreException(message, e, true);
    }

    String message =
        String.format("Unexpected error trying to %s: bucket=%s, key=%s", action, bucket, key);
    LOGGER.error(message, e);
    return new ObjectStoreException(message, e);
  }

  /** Release connections and threads when the application shuts down. */
  @Override
  public void close() {
    LOGGER.info("Closing S3 client and presigner");
    s3Client.close();
    s3Presigner.close();
  }
}
