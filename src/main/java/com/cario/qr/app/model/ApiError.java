package com.cario.qr.app.model;

import lombok.Builder;
import lombok.Value;

/** Error body returned by every failed request. */
@Value
@Builder
public class ApiError {
  String error;
  String detail;
  int status;
  String timestamp;
}
