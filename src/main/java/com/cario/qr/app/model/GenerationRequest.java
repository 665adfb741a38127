package com.cario.qr.app.model;

import lombok.Builder;
import lombok.Value;

/**
 * Parameters for a single generation. Defaults match the public API: PNG, scale 10, border 4,
 * error correction M, black on white, plain square modules.
 */
@Value
@Builder(toBuilder = true)
public class GenerationRequest {

  String data;

  @Builder.Default OutputFormat format = OutputFormat.PNG;

  /** Pixels per module. Rendering scale only, never a symbol version override. */
  @Builder.Default int size = 10;

  /** Quiet-zone width in modules. */
  @Builder.Default int border = 4;

  @Builder.Default ErrorCorrection errorCorrection = ErrorCorrection.M;

  @Builder.Default String fillColor = "black";

  @Builder.Default String backColor = "white";

  @Builder.Default ModuleStyle style = ModuleStyle.NONE;

  /** Same parameters for a different payload; used by batch generation. */
  public GenerationRequest withData(String newData) {
    return toBuilder().data(newData).build();
  }
}
