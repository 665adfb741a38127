package com.cario.qr.app.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Profile;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

/**
 * AWS configuration for the production profile.
 *
 * <p>Credentials come from the default provider chain (environment, instance profile, IRSA). A
 * missing or rejected credential only disables S3 replication; see {@code
 * S3StorageProvider#initialize()}.
 */
@Configuration
@Profile("production")
@Import({ServiceConfig.class, AzureStorageConfig.class, ExecutorConfig.class})
public class AwsProdConfig {

  /**
   * AWS region in which the clients will operate. Injected from the application configuration
   * property {@code aws.region}.
   */
  @Value("${aws.region:us-east-1}")
  private String region;

  @Bean(destroyMethod = "")
  public S3Client s3Client() {
    return S3Client.builder()
        .region(Region.of(region))
        .credentialsProvider(DefaultCredentialsProvider.create())
        .build();
  }

  @Bean(destroyMethod = "")
  S3Presigner s3Presigner() {
    return S3Presigner.builder()
        .region(Region.of(region))
        .credentialsProvider(DefaultCredentialsProvider.create())
        .build();
  }
}
