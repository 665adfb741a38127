package com.cario.qr.app.storage;

import com.cario.qr.app.model.OutputFormat;
import java.util.Locale;

/**
 * Remote object store that receives replicated QR codes.
 *
 * <p>{@link #initialize()} is called once at startup. A provider that fails to initialize stays
 * disabled for the lifetime of the process; there is no re-probing. After initialization the
 * enabled flag is read-only, so implementations need no locking beyond their client's own.
 */
public interface StorageProvider extends AutoCloseable {

  /** Short provider name used in logs, metrics and replication results, e.g. {@code aws}. */
  String name();

  boolean isEnabled();

  /** Bucket or container name, for status reporting. */
  String location();

  /**
   * Probes connectivity and creates the bucket or container when it is missing. Never throws;
   * failures disable the provider.
   */
  void initialize();

  /**
   * Stores the file under {@code <namespace>/<id>.<ext>} and returns a read-only signed URL.
   *
   * @return signed URL, or {@code null} when the provider is disabled
   * @throws com.cario.qr.app.exception.StorageException when the upload or signing fails
   */
  String upload(String id, byte[] bytes, OutputFormat format);

  /**
   * Deletes a previously uploaded file.
   *
   * @return {@code true} when the delete call succeeded, {@code false} when disabled or failed
   */
  boolean delete(String id, OutputFormat format);

  @Override
  default void close() {}

  /** Object key shared by all providers. */
  static String objectKey(String namespace, String id, OutputFormat format) {
    String p = (namespace == null) ? "" : namespace;
    if (!p.isEmpty() && !p.endsWith("/")) {
      p = p + "/";
    }
    return p + id + "." + format.name().toLowerCase(Locale.ROOT);
  }
}
