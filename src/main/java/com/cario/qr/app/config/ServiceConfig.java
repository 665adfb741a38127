package com.cario.qr.app.config;

import com.cario.qr.app.service.ArtifactCache;
import com.cario.qr.app.service.HealthService;
import com.cario.qr.app.service.QrEncoder;
import com.cario.qr.app.service.QrGenerationService;
import com.cario.qr.app.service.QrRenderer;
import com.cario.qr.app.service.StorageReplicator;
import com.cario.qr.app.storage.AzureBlobStorageProvider;
import com.cario.qr.app.storage.S3StorageProvider;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

@Configuration
@RequiredArgsConstructor
public class ServiceConfig {

  private final S3Client s3Client;
  private final S3Presigner s3Presigner;
  private final QrServiceProperties props;
  private final MeterRegistry meterRegistry;

  @Value("${aws.s3.bucket:qr-codes-bucket}")
  private String bucket;

  @Value("${aws.region:us-east-1}")
  private String region;

  // -------------------
  // Generation
  // -------------------

  @Bean
  public QrEncoder qrEncoder() {
    return new QrEncoder();
  }

  @Bean
  public QrRenderer qrRenderer() {
    return new QrRenderer();
  }

  @Bean
  public ArtifactCache artifactCache() {
    return new ArtifactCache();
  }

  @Bean
  public QrGenerationService qrGenerationService(
      QrEncoder encoder,
      QrRenderer renderer,
      ArtifactCache cache,
      @Qualifier("qrRenderExecutor") ThreadPoolTaskExecutor renderExecutor) {
    return new QrGenerationService(encoder, renderer, cache, renderExecutor, meterRegistry);
  }

  // -------------------
  // Storage
  // -------------------

  /** Closed through {@link StorageReplicator#close()}. */
  @Bean(destroyMethod = "")
  public S3StorageProvider s3StorageProvider() {
    return new S3StorageProvider(
        s3Client,
        s3Presigner,
        bucket,
        region,
        props.getStorage().getNamespace(),
        props.getStorage().getSignedUrlTtl());
  }

  @Bean(initMethod = "initialize", destroyMethod = "close")
  public StorageReplicator storageReplicator(
      S3StorageProvider s3Provider,
      AzureBlobStorageProvider azureProvider,
      @Qualifier("storageReplicationExecutor") ThreadPoolTaskExecutor replicationExecutor) {
    return new StorageReplicator(s3Provider, azureProvider, replicationExecutor, meterRegistry);
  }

  // -------------------
  // Health
  // -------------------

  @Bean
  public HealthService healthService(
      QrGenerationService generationService, StorageReplicator replicator) {
    return new HealthService(generationService, replicator, props.getVersion(), Clock.systemUTC());
  }
}
