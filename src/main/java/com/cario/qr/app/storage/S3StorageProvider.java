package com.cario.qr.app.storage;

import com.cario.qr.app.exception.StorageException;
import com.cario.qr.app.model.OutputFormat;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CreateBucketConfiguration;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

/** Stores QR codes in an S3 bucket and hands out presigned GET URLs. */
@Log4j2
public class S3StorageProvider implements StorageProvider {

  public static final String NAME = "aws";

  private static final String US_EAST_1 = "us-east-1";

  private final S3Client s3;
  private final S3Presigner presigner;
  private final String bucket;
  private final String region;
  private final String namespace;
  private final Duration signedUrlTtl;

  private volatile boolean enabled;

  public S3StorageProvider(
      S3Client s3,
      S3Presigner presigner,
      String bucket,
      String region,
      String namespace,
      Duration signedUrlTtl) {
    this.s3 = Objects.requireNonNull(s3, "S3Client must not be null");
    this.presigner = Objects.requireNonNull(presigner, "S3Presigner must not be null");
    this.bucket = Objects.requireNonNull(bucket, "bucket must not be null");
    this.region = (region == null || region.isBlank()) ? US_EAST_1 : region;
    this.namespace = namespace;
    this.signedUrlTtl = Objects.requireNonNull(signedUrlTtl, "signedUrlTtl must not be null");
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public boolean isEnabled() {
    return enabled;
  }

  @Override
  public String location() {
    return bucket;
  }

  // ------------------ Lifecycle ------------------

  @Override
  public void initialize() {
    try {
      s3.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
      enabled = true;
      log.info("s3.init ok bucket={} region={}", bucket, region);
    } catch (S3Exception e) {
      if (e.statusCode() == 404) {
        enabled = createBucket();
      } else {
        disable(e);
      }
    } catch (SdkException e) {
      disable(e);
    }
  }

  @Override
  public void close() {
    try {
      presigner.close();
    } finally {
      s3.close();
    }
  }

  // ------------------ Public API ------------------

  @Override
  public String upload(String id, byte[] bytes, OutputFormat format) {
    if (!enabled) {
      log.warn("s3.upload skipped, provider disabled id={}", id);
      return null;
    }
    String key = StorageProvider.objectKey(namespace, id, format);
    try {
      PutObjectRequest req =
          PutObjectRequest.builder()
              .bucket(bucket)
              .key(key)
              .contentType(format.contentType())
              .contentLength((long) bytes.length)
              .metadata(
                  Map.of(
                      "generated_at", Instant.now().toString(), "file_format", format.name()))
              .build();

      PutObjectResponse resp = s3.putObject(req, RequestBody.fromBytes(bytes));
      String url = presignGetUrl(key);

      log.info(
          "s3.upload ok bucket={} key={} size={} eTag={}",
          bucket,
          logKey(key),
          bytes.length,
          resp.eTag());
      return url;
    } catch (RuntimeException e) {
      log.error("s3.upload error bucket={} key={} msg={}", bucket, logKey(key), e.getMessage());
      throw new StorageException(NAME, "Failed to upload to S3: " + e.getMessage(), e);
    }
  }

  @Override
  public boolean delete(String id, OutputFormat format) {
    if (!enabled) {
      return false;
    }
    String key = StorageProvider.objectKey(namespace, id, format);
    try {
      s3.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
      log.info("s3.delete ok bucket={} key={}", bucket, logKey(key));
      return true;
    } catch (RuntimeException e) {
      log.error("s3.delete error bucket={} key={} msg={}", bucket, logKey(key), e.getMessage());
      return false;
    }
  }

  // ------------------ Helpers ------------------

  private String presignGetUrl(String key) {
    GetObjectRequest get = GetObjectRequest.builder().bucket(bucket).key(key).build();
    GetObjectPresignRequest presign =
        GetObjectPresignRequest.builder()
            .signatureDuration(signedUrlTtl)
            .getObjectRequest(get)
            .build();
    return presigner.presignGetObject(presign).url().toString();
  }

  private boolean createBucket() {
    try {
      CreateBucketRequest.Builder req = CreateBucketRequest.builder().bucket(bucket);
      // us-east-1 rejects an explicit location constraint
      if (!US_EAST_1.equals(region)) {
        req.createBucketConfiguration(
            CreateBucketConfiguration.builder().locationConstraint(region).build());
      }
      s3.createBucket(req.build());
      log.info("s3.init created bucket={} region={}", bucket, region);
      return true;
    } catch (SdkException e) {
      log.error("s3.init failed to create bucket={} msg={}", bucket, e.getMessage());
      return false;
    }
  }

  private void disable(Exception e) {
    enabled = false;
    log.warn(
        "s3.init failed bucket={} region={} msg={}; continuing without S3 replication",
        bucket,
        region,
        e.getMessage());
  }

  private static String logKey(String key) {
    if (key == null) return null;
    return key.length() > 120 ? key.substring(0, 120) + "...(truncated)" : key;
  }
}
