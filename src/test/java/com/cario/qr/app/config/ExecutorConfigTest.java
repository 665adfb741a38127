package com.cario.qr.app.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.cario.qr.app.exception.CapacityExceededException;
import com.cario.qr.app.model.GeneratedArtifact;
import com.cario.qr.app.model.GenerationRequest;
import com.cario.qr.app.service.ArtifactCache;
import com.cario.qr.app.service.QrEncoder;
import com.cario.qr.app.service.QrGenerationService;
import com.cario.qr.app.service.QrRenderer;
import com.cario.qr.app.util.Futures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

class ExecutorConfigTest {

  private ThreadPoolTaskExecutor renderExecutor;

  @BeforeEach
  void setUp() {
    QrServiceProperties props = new QrServiceProperties();
    props.getRender().setWorkers(1);
    props.getRender().setQueueCapacity(1);
    props.getRender().setAwaitTerminationSeconds(1);
    renderExecutor = new ExecutorConfig().qrRenderExecutor(props);
  }

  @AfterEach
  void tearDown() {
    renderExecutor.shutdown();
  }

  @Test
  void saturatedRenderPoolFailsFastInsteadOfRenderingOnCaller() throws Exception {
    Set<String> renderThreads = ConcurrentHashMap.newKeySet();
    CountDownLatch started = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    QrRenderer renderer = mock(QrRenderer.class);
    when(renderer.render(any(), any(), anyInt(), anyInt(), any(), any(), any()))
        .thenAnswer(
            inv -> {
              renderThreads.add(Thread.currentThread().getName());
              started.countDown();
              release.await(5, TimeUnit.SECONDS);
              return new byte[] {1, 2, 3};
            });
    QrGenerationService service =
        new QrGenerationService(
            new QrEncoder(),
            renderer,
            new ArtifactCache(),
            renderExecutor,
            new SimpleMeterRegistry());

    CompletableFuture<GeneratedArtifact> running = service.generate(request("a"));
    assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
    CompletableFuture<GeneratedArtifact> queued = service.generate(request("b"));
    CompletableFuture<GeneratedArtifact> rejected = service.generate(request("c"));

    assertThat(rejected).isCompletedExceptionally();
    assertThatThrownBy(() -> Futures.await(rejected))
        .isInstanceOf(CapacityExceededException.class);

    release.countDown();
    Futures.await(running);
    Futures.await(queued);

    assertThat(renderThreads)
        .isNotEmpty()
        .allMatch(name -> name.startsWith("qr-render-"))
        .doesNotContain(Thread.currentThread().getName());
  }

  private static GenerationRequest request(String data) {
    return GenerationRequest.builder().data(data).build();
  }
}
