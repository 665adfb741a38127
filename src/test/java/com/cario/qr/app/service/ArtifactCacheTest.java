package com.cario.qr.app.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.cario.qr.app.exception.ArtifactNotFoundException;
import com.cario.qr.app.model.CacheStats;
import com.cario.qr.app.model.GeneratedArtifact;
import com.cario.qr.app.model.OutputFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ArtifactCacheTest {

  private final ArtifactCache cache = new ArtifactCache();

  static GeneratedArtifact artifact(int size) {
    return GeneratedArtifact.builder()
        .id(UUID.randomUUID().toString())
        .sourceData("data")
        .format(OutputFormat.PNG)
        .sizeParameter(10)
        .borderParameter(4)
        .symbolVersion(1)
        .bytes(new byte[size])
        .build();
  }

  @Test
  void putThenGetReturnsSameArtifact() {
    GeneratedArtifact a = artifact(10);
    cache.put(a);

    assertThat(cache.get(a.getId())).containsSame(a);
    assertThat(cache.require(a.getId())).isSameAs(a);
  }

  @Test
  void unknownIdIsNotFound() {
    assertThat(cache.get("missing")).isEmpty();
    assertThat(cache.get(null)).isEmpty();
    assertThatThrownBy(() -> cache.require("missing"))
        .isInstanceOf(ArtifactNotFoundException.class)
        .hasMessage("QR code missing not found");
  }

  @Test
  void statsSumSizes() {
    cache.put(artifact(100));
    cache.put(artifact(300));

    CacheStats stats = cache.stats();
    assertThat(stats.count()).isEqualTo(2);
    assertThat(stats.totalBytes()).isEqualTo(400);
    assertThat(stats.averageBytes()).isEqualTo(200.0);
  }

  @Test
  void emptyStatsHaveZeroAverage() {
    assertThat(cache.stats()).isEqualTo(new CacheStats(0, 0, 0.0));
  }

  @Test
  void removeAndClear() {
    GeneratedArtifact a = artifact(1);
    GeneratedArtifact b = artifact(1);
    cache.put(a);
    cache.put(b);

    assertThat(cache.remove(a.getId())).containsSame(a);
    assertThat(cache.remove(a.getId())).isEmpty();
    assertThat(cache.size()).isEqualTo(1);

    cache.clear();
    assertThat(cache.size()).isZero();
    assertThat(cache.get(b.getId())).isEmpty();
  }

  @Test
  void concurrentPutsAreAllRetained() throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(8);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    try {
      for (int i = 0; i < 1000; i++) {
        futures.add(
            pool.submit(
                () -> {
                  start.await();
                  cache.put(artifact(5));
                  return null;
                }));
      }
      start.countDown();
      for (Future<?> f : futures) {
        f.get(10, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    assertThat(cache.size()).isEqualTo(1000);
    assertThat(cache.stats().totalBytes()).isEqualTo(5000);
  }

  @Test
  void artifactBytesAreDefensiveCopies() {
    byte[] source = {1, 2, 3};
    GeneratedArtifact a =
        GeneratedArtifact.builder()
            .id("id-1")
            .sourceData("x")
            .format(OutputFormat.SVG)
            .bytes(source)
            .build();
    source[0] = 9;
    a.getBytes()[1] = 9;

    assertThat(a.getBytes()).containsExactly(1, 2, 3);
    assertThat(a.fileName()).isEqualTo("id-1.svg");
    assertThat(a.contentType()).isEqualTo("image/svg+xml");
  }
}
