package com.cario.qr.app.service;

import com.cario.qr.app.exception.CapacityExceededException;
import com.cario.qr.app.model.CacheStats;
import com.cario.qr.app.model.GeneratedArtifact;
import com.cario.qr.app.model.GenerationRequest;
import com.cario.qr.app.model.ModuleMatrix;
import com.cario.qr.app.util.Futures;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.log4j.Log4j2;

/**
 * Generates QR codes: encode, render, cache.
 *
 * <ol>
 *   <li>Assign a random id.
 *   <li>Encode and render on the bounded render executor, so CPU-heavy image work never runs on
 *       the request thread.
 *   <li>Store the finished {@link GeneratedArtifact} in the {@link ArtifactCache}.
 * </ol>
 *
 * Callers receive a {@link CompletableFuture} that completes once their own render is done.
 * Encoding and rendering failures complete the future exceptionally with {@code
 * EncodingException} / {@code RenderException}; a saturated render pool fails it with {@link
 * CapacityExceededException}.
 */
@Log4j2
public class QrGenerationService {

  /** Payload used by {@link #probe()}; the probe artifact is removed again immediately. */
  public static final String PROBE_PAYLOAD = "health-check-test";

  private final QrEncoder encoder;
  private final QrRenderer renderer;
  private final ArtifactCache cache;
  private final Executor renderExecutor;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  public QrGenerationService(
      QrEncoder encoder,
      QrRenderer renderer,
      ArtifactCache cache,
      Executor renderExecutor,
      MeterRegistry meterRegistry) {
    this(encoder, renderer, cache, renderExecutor, meterRegistry, Clock.systemUTC());
  }

  public QrGenerationService(
      QrEncoder encoder,
      QrRenderer renderer,
      ArtifactCache cache,
      Executor renderExecutor,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.encoder = Objects.requireNonNull(encoder, "encoder must not be null");
    this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
    this.cache = Objects.requireNonNull(cache, "cache must not be null");
    this.renderExecutor = Objects.requireNonNull(renderExecutor, "renderExecutor must not be null");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");

    Gauge.builder("qr.cache.entries", cache, ArtifactCache::size)
        .description("Artifacts currently cached")
        .register(meterRegistry);
    Gauge.builder("qr.cache.bytes", cache, c -> c.stats().totalBytes())
        .description("Bytes held by cached artifacts")
        .baseUnit("bytes")
        .register(meterRegistry);
  }

  // ------------------ Public API ------------------

  /** Generates one QR code. The artifact is cached before the returned future completes. */
  public CompletableFuture<GeneratedArtifact> generate(GenerationRequest request) {
    return submit(request, true);
  }

  /**
   * Generates one QR code per item, strictly in input order, with the shared parameters. Items are
   * processed one after another; each render still runs on the worker pool. The first failure
   * fails the whole batch.
   */
  public CompletableFuture<List<GeneratedArtifact>> generateBatch(
      List<String> items, GenerationRequest shared) {
    Objects.requireNonNull(items, "items must not be null");
    Objects.requireNonNull(shared, "shared parameters must not be null");
    log.info(
        "qr.batch.start count={} format={} size={}",
        items.size(),
        shared.getFormat(),
        shared.getSize());
    long t0 = System.nanoTime();

    CompletableFuture<List<GeneratedArtifact>> chain =
        CompletableFuture.completedFuture(new ArrayList<>(items.size()));
    for (String item : items) {
      chain =
          chain.thenCompose(
              done ->
                  generate(shared.withData(item))
                      .thenApply(
                          artifact -> {
                            done.add(artifact);
                            return done;
                          }));
    }
    return chain
        .<List<GeneratedArtifact>>thenApply(List::copyOf)
        .whenComplete(
            (artifacts, error) -> {
              long ms = (System.nanoTime() - t0) / 1_000_000;
              if (error != null) {
                log.error(
                    "qr.batch.error count={} durationMs={} msg={}",
                    items.size(),
                    ms,
                    Futures.unwrap(error).getMessage());
              } else {
                log.info("qr.batch.success count={} durationMs={}", artifacts.size(), ms);
              }
            });
  }

  /**
   * Cached artifact by id.
   *
   * @throws com.cario.qr.app.exception.ArtifactNotFoundException if the id is unknown
   */
  public GeneratedArtifact getArtifact(String id) {
    return cache.require(id);
  }

  /** Removes an artifact from the cache, returning it when present. */
  public Optional<GeneratedArtifact> evict(String id) {
    return cache.remove(id);
  }

  public CacheStats cacheStats() {
    return cache.stats();
  }

  public void clearCache() {
    cache.clear();
  }

  /**
   * Synchronous self-test used by the health checks: renders {@link #PROBE_PAYLOAD}, then drops
   * it from the cache so probes do not accumulate.
   *
   * @return {@code true} when a non-empty artifact was produced
   */
  public boolean probe() {
    try {
      GeneratedArtifact artifact =
          Futures.await(submit(GenerationRequest.builder().data(PROBE_PAYLOAD).build(), false));
      cache.remove(artifact.getId());
      return artifact.getSizeBytes() > 0;
    } catch (RuntimeException e) {
      log.error("qr.probe failed msg={}", e.getMessage(), e);
      return false;
    }
  }

  // ------------------ Internals ------------------

  private CompletableFuture<GeneratedArtifact> submit(GenerationRequest request, boolean metered) {
    Objects.requireNonNull(request, "request must not be null");
    final String id = UUID.randomUUID().toString();
    final long t0 = System.nanoTime();
    int length = request.getData() == null ? 0 : request.getData().length();
    log.debug("qr.generate.start id={} length={} format={}", id, length, request.getFormat());

    CompletableFuture<GeneratedArtifact> future;
    try {
      future = CompletableFuture.supplyAsync(() -> produce(id, request), renderExecutor);
    } catch (RejectedExecutionException e) {
      future =
          CompletableFuture.failedFuture(
              new CapacityExceededException("Render pool is saturated, retry later", e));
    }

    return future.whenComplete(
        (artifact, error) -> {
          long ms = (System.nanoTime() - t0) / 1_000_000;
          if (error == null) {
            log.info(
                "qr.generate.success id={} format={} version={} bytes={} durationMs={}",
                id,
                artifact.getFormat(),
                artifact.getSymbolVersion(),
                artifact.getSizeBytes(),
                ms);
          } else {
            Throwable cause = Futures.unwrap(error);
            log.error(
                "qr.generate.error id={} length={} format={} durationMs={} error={} msg={}",
                id,
                length,
                request.getFormat(),
                ms,
                cause.getClass().getSimpleName(),
                cause.getMessage());
          }
          if (metered) {
            recordMetrics(request, error == null, ms);
          }
        });
  }

  private GeneratedArtifact produce(String id, GenerationRequest request) {
    ModuleMatrix matrix = encoder.encode(request.getData(), request.getErrorCorrection());
    byte[] bytes =
        renderer.render(
            matrix,
            request.getFormat(),
            request.getSize(),
            request.getBorder(),
            request.getFillColor(),
            request.getBackColor(),
            request.getStyle());

    GeneratedArtifact artifact =
        GeneratedArtifact.builder()
            .id(id)
            .sourceData(request.getData())
            .format(request.getFormat())
            .sizeParameter(request.getSize())
            .borderParameter(request.getBorder())
            .errorCorrection(request.getErrorCorrection())
            .symbolVersion(matrix.version())
            .bytes(bytes)
            .createdAt(clock.instant())
            .build();

    cache.put(artifact);
    return artifact;
  }

  private void recordMetrics(GenerationRequest request, boolean success, long latencyMs) {
    String format = request.getFormat() == null ? "unknown" : request.getFormat().name();
    String status = success ? "success" : "failure";

    Counter.builder("qr.codes.generated")
        .tag("format", format)
        .tag("status", status)
        .register(meterRegistry)
        .increment();

    Timer.builder("qr.generation.duration")
        .tag("format", format)
        .tag("status", status)
        .register(meterRegistry)
        .record(Duration.ofMillis(latencyMs));
  }
}
