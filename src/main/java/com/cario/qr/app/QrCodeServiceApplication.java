package com.cario.qr.app;

import com.cario.qr.app.config.QrServiceProperties;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the QR Code Service Spring Boot application.
 *
 * <p>This service renders QR codes as PNG, SVG or PDF, keeps the results in an in-memory cache for
 * download, and replicates every generated file to AWS S3 and Azure Blob Storage in the
 * background.
 *
 * <p>Logging is provided via Lombok's {@code @Log4j2} annotation, which injects a {@code log} field
 * for Log4j2-based logging. Usage:
 *
 * <pre>
 *   mvn spring-boot:run -Dspring-boot.run.profiles=local
 * </pre>
 *
 * @author Shaji Nair
 */
@Log4j2
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(QrServiceProperties.class)
public class QrCodeServiceApplication {

  /**
   * Main entry point for the Spring Boot application.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    log.info("Starting QR Code Service application...");
    SpringApplication.run(QrCodeServiceApplication.class, args);
    log.info("QR Code Service application started successfully.");
  }
}
