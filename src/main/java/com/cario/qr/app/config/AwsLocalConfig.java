package com.cario.qr.app.config;

import java.net.URI;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Profile;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

/**
 * AWS configuration for the local environment.
 *
 * <p>Uses static credentials from the application properties. When {@code aws.s3.endpoint} is set
 * (LocalStack, MinIO) both the client and the presigner talk to that endpoint with path-style
 * addressing.
 *
 * <p>Active only when the {@code local} Spring profile is enabled.
 */
@Configuration
@Profile("local")
@Import({ServiceConfig.class, AzureStorageConfig.class, ExecutorConfig.class})
public class AwsLocalConfig {

  /** AWS region in which the clients will operate. */
  @Value("${aws.region}")
  private String region;

  /** AWS access key ID for local development. */
  @Value("${aws.accessKeyId}")
  private String accessKeyId;

  /** AWS secret access key for local development. */
  @Value("${aws.secretAccessKey}")
  private String secretAccessKey;

  @Value("${aws.s3.endpoint:}")
  private String endpoint;

  @Bean
  StaticCredentialsProvider awsCreds() {
    return StaticCredentialsProvider.create(
        AwsBasicCredentials.create(accessKeyId, secretAccessKey));
  }

  /** Closed by the S3 storage provider, not by the container. */
  @Bean(destroyMethod = "")
  public S3Client s3Client(StaticCredentialsProvider creds) {
    S3ClientBuilder builder =
        S3Client.builder().region(Region.of(region)).credentialsProvider(creds);
    if (!endpoint.isBlank()) {
      builder.endpointOverride(URI.create(endpoint)).forcePathStyle(true);
    }
    return builder.build();
  }

  @Bean(destroyMethod = "")
  S3Presigner s3Presigner(StaticCredentialsProvider creds) {
    S3Presigner.Builder builder =
        S3Presigner.builder().region(Region.of(region)).credentialsProvider(creds);
    if (!endpoint.isBlank()) {
      builder
          .endpointOverride(URI.create(endpoint))
          .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(true).build());
    }
    return builder.build();
  }
}
