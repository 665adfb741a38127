package com.cario.qr.app.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Tunables under the {@code qr.*} prefix. */
@Data
@ConfigurationProperties(prefix = "qr")
public class QrServiceProperties {

  /** Reported by {@code /} and {@code /health}. */
  private String version = "1.0.0";

  private Render render = new Render();
  private Replication replication = new Replication();
  private Storage storage = new Storage();
  private Batch batch = new Batch();
  private Health health = new Health();

  @Data
  public static class Render {
    private int workers = 4;
    private int queueCapacity = 500;
    private int awaitTerminationSeconds = 30;
  }

  @Data
  public static class Replication {
    private int threads = 2;
    private int queueCapacity = 1000;
    private int awaitTerminationSeconds = 60;
  }

  @Data
  public static class Storage {
    /** Object key prefix shared by both providers. */
    private String namespace = "qr-codes";

    private Duration signedUrlTtl = Duration.ofHours(1);
  }

  @Data
  public static class Batch {
    private int maxItems = 100;
  }

  @Data
  public static class Health {
    private Duration interval = Duration.ofSeconds(60);
  }
}
