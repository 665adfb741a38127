package com.cario.qr.app.api;

import com.cario.qr.app.config.QrServiceProperties;
import com.cario.qr.app.exception.ArtifactNotFoundException;
import com.cario.qr.app.exception.ValidationException;
import com.cario.qr.app.model.CacheStats;
import com.cario.qr.app.model.ErrorCorrection;
import com.cario.qr.app.model.GeneratedArtifact;
import com.cario.qr.app.model.GenerationRequest;
import com.cario.qr.app.model.ModuleStyle;
import com.cario.qr.app.model.OutputFormat;
import com.cario.qr.app.model.QrCodeResponse;
import com.cario.qr.app.model.StorageStatus;
import com.cario.qr.app.service.QrGenerationService;
import com.cario.qr.app.service.StorageReplicator;
import com.cario.qr.app.util.QrPayloads;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.apache.commons.io.FilenameUtils;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

@Log4j2
@Validated
@RestController
@RequestMapping("/qr")
@RequiredArgsConstructor
public class QrCodeController {

  /** Byte-mode capacity of a version 40 symbol at level L. */
  static final int MAX_DATA_LENGTH = 4296;

  private static final Set<String> UPLOAD_EXTENSIONS = Set.of("txt", "csv");

  private final QrGenerationService generationService;
  private final StorageReplicator replicator;
  private final QrServiceProperties props;

  // ------------------------------------------------------------
  // /qr/generate
  // ------------------------------------------------------------
  @PostMapping(
      path = "/generate",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public CompletableFuture<QrCodeResponse> generate(@RequestBody @Validated GenerateRequest req) {
    log.info(
        "qr.api.generate length={} format={} size={}",
        req.getData().length(),
        req.getFormat(),
        req.getSize());
    return generateOne(req.toRequest(req.getData()));
  }

  // ------------------------------------------------------------
  // /qr/batch
  // ------------------------------------------------------------
  @PostMapping(
      path = "/batch",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public CompletableFuture<List<QrCodeResponse>> batch(@RequestBody @Validated BatchRequest req) {
    checkBatchSize(req.getItems().size());
    log.info("qr.api.batch count={} format={}", req.getItems().size(), req.getFormat());
    return generateMany(req.getItems(), req.toRequest(null));
  }

  // ------------------------------------------------------------
  // /qr/upload
  // ------------------------------------------------------------
  @PostMapping(
      path = "/upload",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public CompletableFuture<List<QrCodeResponse>> upload(
      @RequestPart("file") MultipartFile file,
      @RequestParam(name = "format", defaultValue = "PNG") String format,
      @RequestParam(name = "size", defaultValue = "10") int size) {

    String filename = file.getOriginalFilename();
    String ext = FilenameUtils.getExtension(filename == null ? "" : filename);
    if (!UPLOAD_EXTENSIONS.contains(ext.toLowerCase(Locale.ROOT))) {
      throw new ValidationException("Only .txt and .csv files are supported");
    }
    if (size < 1 || size > 40) {
      throw new ValidationException("size must be between 1 and 40");
    }

    List<String> items = nonEmptyLines(file);
    if (items.isEmpty()) {
      throw new ValidationException("File contains no data lines");
    }
    checkBatchSize(items.size());
    for (String item : items) {
      if (item.length() > MAX_DATA_LENGTH) {
        throw new ValidationException(
            "Line exceeds " + MAX_DATA_LENGTH + " characters: " + abbreviate(item));
      }
    }

    log.info("qr.api.upload filename={} lines={} format={}", filename, items.size(), format);
    GenerationRequest shared =
        GenerationRequest.builder().format(OutputFormat.from(format)).size(size).build();
    return generateMany(items, shared);
  }

  // ------------------------------------------------------------
  // Payload helpers: /qr/wifi, /qr/vcard, /qr/url
  // ------------------------------------------------------------
  @PostMapping(
      path = "/wifi",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public CompletableFuture<QrCodeResponse> wifi(@RequestBody @Validated WifiRequest req) {
    String payload =
        QrPayloads.wifi(req.getSsid(), req.getPassword(), req.getSecurity(), req.isHidden());
    return generateOne(req.toRequest(payload));
  }

  @PostMapping(
      path = "/vcard",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public CompletableFuture<QrCodeResponse> vcard(@RequestBody @Validated VcardRequest req) {
    String payload =
        QrPayloads.vcard(req.getName(), req.getPhone(), req.getEmail(), req.getOrganization());
    return generateOne(req.toRequest(payload));
  }

  @PostMapping(
      path = "/url",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public CompletableFuture<QrCodeResponse> url(@RequestBody @Validated UrlRequest req) {
    return generateOne(req.toRequest(QrPayloads.url(req.getUrl())));
  }

  // ------------------------------------------------------------
  // /qr/download/{id}
  // ------------------------------------------------------------
  @GetMapping("/download/{id}")
  public ResponseEntity<byte[]> download(@PathVariable("id") String id) {
    GeneratedArtifact artifact = generationService.getArtifact(id);
    log.info("qr.api.download id={} format={}", id, artifact.getFormat());
    return ResponseEntity.ok()
        .contentType(MediaType.parseMediaType(artifact.contentType()))
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment().filename(artifact.fileName()).build().toString())
        .body(artifact.getBytes());
  }

  // ------------------------------------------------------------
  // /qr/{id}
  // ------------------------------------------------------------
  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable("id") String id) {
    GeneratedArtifact artifact =
        generationService.evict(id).orElseThrow(() -> new ArtifactNotFoundException(id));
    replicator.deleteInBackground(artifact);
    log.info("qr.api.delete id={}", id);
    return ResponseEntity.noContent().build();
  }

  // ------------------------------------------------------------
  // /qr/cache
  // ------------------------------------------------------------
  @GetMapping(path = "/cache/stats", produces = MediaType.APPLICATION_JSON_VALUE)
  public CacheStats cacheStats() {
    return generationService.cacheStats();
  }

  @DeleteMapping("/cache")
  public ResponseEntity<Void> clearCache() {
    generationService.clearCache();
    return ResponseEntity.noContent().build();
  }

  // ------------------------------------------------------------
  // helpers
  // ------------------------------------------------------------

  private CompletableFuture<QrCodeResponse> generateOne(GenerationRequest request) {
    return generationService
        .generate(request)
        .thenApply(
            artifact -> {
              replicator.replicateInBackground(artifact);
              return QrCodeResponse.from(artifact, true);
            });
  }

  private CompletableFuture<List<QrCodeResponse>> generateMany(
      List<String> items, GenerationRequest shared) {
    return generationService
        .generateBatch(items, shared)
        .thenApply(
            artifacts ->
                artifacts.stream()
                    .map(
                        artifact -> {
                          replicator.replicateInBackground(artifact);
                          return QrCodeResponse.from(artifact, false);
                        })
                    .toList());
  }

  private void checkBatchSize(int count) {
    int max = props.getBatch().getMaxItems();
    if (count > max) {
      throw new ValidationException("Batch size cannot exceed " + max + " items");
    }
  }

  private static List<String> nonEmptyLines(MultipartFile file) {
    try {
      String content = new String(file.getBytes(), StandardCharsets.UTF_8);
      return Arrays.stream(content.split("\\R"))
          .map(String::strip)
          .filter(line -> !line.isEmpty())
          .toList();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read uploaded file", e);
    }
  }

  private static String abbreviate(String s) {
    return s.length() > 40 ? s.substring(0, 40) + "..." : s;
  }

  // ------------------------------------------------------------
  // DTOs
  // ------------------------------------------------------------

  /** Rendering options shared by every single-code endpoint. */
  @Data
  public static class RenderOptions {
    @Pattern(regexp = "(?i)PNG|SVG|PDF", message = "format must be PNG, SVG or PDF")
    private String format = "PNG";

    @Min(1)
    @Max(40)
    private Integer size = 10;

    @Min(0)
    @Max(20)
    private Integer border = 4;

    @JsonProperty("error_correction")
    @Pattern(regexp = "(?i)[LMQH]", message = "error_correction must be L, M, Q or H")
    private String errorCorrection = "M";

    @JsonProperty("fill_color")
    @Size(max = 32)
    private String fillColor = "black";

    @JsonProperty("back_color")
    @Size(max = 32)
    private String backColor = "white";

    @Pattern(regexp = "(?i)none|rounded|circle", message = "style must be none, rounded or circle")
    private String style = "none";

    GenerationRequest toRequest(String data) {
      return GenerationRequest.builder()
          .data(data)
          .format(OutputFormat.from(format))
          .size(size == null ? 10 : size)
          .border(border == null ? 4 : border)
          .errorCorrection(ErrorCorrection.from(errorCorrection))
          .fillColor(fillColor)
          .backColor(backColor)
          .style(ModuleStyle.from(style))
          .build();
    }
  }

  @Data
  @EqualsAndHashCode(callSuper = true)
  public static class GenerateRequest extends RenderOptions {
    // whitespace is valid payload
    @NotNull
    @Size(min = 1, max = MAX_DATA_LENGTH)
    private String data;
  }

  @Data
  @EqualsAndHashCode(callSuper = true)
  public static class BatchRequest extends RenderOptions {
    @NotEmpty private List<@NotNull @Size(min = 1, max = MAX_DATA_LENGTH) String> items;
  }

  @Data
  @EqualsAndHashCode(callSuper = true)
  public static class WifiRequest extends RenderOptions {
    @NotBlank
    @Size(max = 32)
    private String ssid;

    @Size(max = 63)
    private String password;

    @Pattern(regexp = "WPA|WEP|nopass", message = "security must be WPA, WEP or nopass")
    private String security = "WPA";

    private boolean hidden;
  }

  @Data
  @EqualsAndHashCode(callSuper = true)
  public static class VcardRequest extends RenderOptions {
    @NotBlank
    @Size(max = 200)
    private String name;

    @Size(max = 50)
    private String phone;

    @Size(max = 200)
    private String email;

    @Size(max = 200)
    private String organization;
  }

  @Data
  @EqualsAndHashCode(callSuper = true)
  public static class UrlRequest extends RenderOptions {
    @NotBlank
    @Size(max = 2048)
    private String url;
  }
}
