package com.cario.qr.app.storage;

import com.azure.core.util.BinaryData;
import com.azure.core.util.Context;
import com.azure.storage.blob.BlobClient;
import com.azure.storage.blob.BlobContainerClient;
import com.azure.storage.blob.BlobServiceClient;
import com.azure.storage.blob.models.BlobHttpHeaders;
import com.azure.storage.blob.models.UserDelegationKey;
import com.azure.storage.blob.options.BlobParallelUploadOptions;
import com.azure.storage.blob.sas.BlobSasPermission;
import com.azure.storage.blob.sas.BlobServiceSasSignatureValues;
import com.cario.qr.app.exception.StorageException;
import com.cario.qr.app.model.OutputFormat;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;

/**
 * Stores QR codes in an Azure Blob Storage container and hands out read-only SAS URLs.
 *
 * <p>With a connection string (account key) the SAS is signed with the shared key. With Azure AD
 * credentials a user-delegation key is requested for every signature instead. A {@code null}
 * client means no Azure credentials were configured; the provider then stays disabled.
 */
@Log4j2
public class AzureBlobStorageProvider implements StorageProvider {

  public static final String NAME = "azure";

  private final BlobServiceClient serviceClient;
  private final String container;
  private final String namespace;
  private final Duration signedUrlTtl;
  private final boolean userDelegationSas;

  private volatile boolean enabled;

  public AzureBlobStorageProvider(
      BlobServiceClient serviceClient,
      String container,
      String namespace,
      Duration signedUrlTtl,
      boolean userDelegationSas) {
    this.serviceClient = serviceClient;
    this.container = Objects.requireNonNull(container, "container must not be null");
    this.namespace = namespace;
    this.signedUrlTtl = Objects.requireNonNull(signedUrlTtl, "signedUrlTtl must not be null");
    this.userDelegationSas = userDelegationSas;
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public boolean isEnabled() {
    return enabled;
  }

  @Override
  public String location() {
    return container;
  }

  @Override
  public void initialize() {
    if (serviceClient == null) {
      enabled = false;
      log.warn("azure.init skipped: no Azure credentials provided; continuing without Azure");
      return;
    }
    try {
      BlobContainerClient containerClient = serviceClient.getBlobContainerClient(container);
      if (!containerClient.exists()) {
        containerClient.create();
        log.info("azure.init created container={}", container);
      }
      enabled = true;
      log.info("azure.init ok account={} container={}", serviceClient.getAccountName(), container);
    } catch (RuntimeException e) {
      // credential, network and service errors all end here
      enabled = false;
      log.warn(
          "azure.init failed container={} msg={}; continuing without Azure replication",
          container,
          e.getMessage());
    }
  }

  @Override
  public String upload(String id, byte[] bytes, OutputFormat format) {
    if (!enabled) {
      log.warn("azure.upload skipped, provider disabled id={}", id);
      return null;
    }
    String blobName = StorageProvider.objectKey(namespace, id, format);
    try {
      BlobClient blob = serviceClient.getBlobContainerClient(container).getBlobClient(blobName);

      BlobParallelUploadOptions options =
          new BlobParallelUploadOptions(BinaryData.fromBytes(bytes))
              .setHeaders(new BlobHttpHeaders().setContentType(format.contentType()))
              .setMetadata(
                  Map.of(
                      "generated_at", Instant.now().toString(), "file_format", format.name()));
      blob.uploadWithResponse(options, null, Context.NONE);

      String url = blob.getBlobUrl() + "?" + sasToken(blob);
      log.info("azure.upload ok container={} blob={} size={}", container, blobName, bytes.length);
      return url;
    } catch (RuntimeException e) {
      log.error(
          "azure.upload error container={} blob={} msg={}", container, blobName, e.getMessage());
      throw new StorageException(NAME, "Failed to upload to Azure: " + e.getMessage(), e);
    }
  }

  @Override
  public boolean delete(String id, OutputFormat format) {
    if (!enabled) {
      return false;
    }
    String blobName = StorageProvider.objectKey(namespace, id, format);
    try {
      serviceClient.getBlobContainerClient(container).getBlobClient(blobName).delete();
      log.info("azure.delete ok container={} blob={}", container, blobName);
      return true;
    } catch (RuntimeException e) {
      log.error(
          "azure.delete error container={} blob={} msg={}", container, blobName, e.getMessage());
      return false;
    }
  }

  private String sasToken(BlobClient blob) {
    OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
    OffsetDateTime expiry = now.plus(signedUrlTtl);
    BlobServiceSasSignatureValues values =
        new BlobServiceSasSignatureValues(expiry, new BlobSasPermission().setReadPermission(true));

    if (userDelegationSas) {
      UserDelegationKey key = serviceClient.getUserDelegationKey(now.minusMinutes(5), expiry);
      return blob.generateUserDelegationSas(values, key);
    }
    return blob.generateSas(values);
  }
}
