package com.cario.qr.app.config;

import com.azure.identity.DefaultAzureCredentialBuilder;
import com.azure.storage.blob.BlobServiceClient;
import com.azure.storage.blob.BlobServiceClientBuilder;
import com.cario.qr.app.storage.AzureBlobStorageProvider;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Azure Blob Storage wiring.
 *
 * <p>A connection string wins (account key, Azurite). Otherwise an account name selects Azure AD
 * authentication through {@code DefaultAzureCredential}. With neither, the provider is created
 * without a client and stays disabled.
 */
@Log4j2
@Configuration
public class AzureStorageConfig {

  @Value("${azure.storage.connection-string:}")
  private String connectionString;

  @Value("${azure.storage.account-name:}")
  private String accountName;

  @Value("${azure.storage.container:qr-codes}")
  private String container;

  @Bean(destroyMethod = "")
  public AzureBlobStorageProvider azureBlobStorageProvider(QrServiceProperties props) {
    BlobServiceClient client = null;
    boolean userDelegation = false;

    if (!connectionString.isBlank()) {
      client = new BlobServiceClientBuilder().connectionString(connectionString).buildClient();
      log.info("azure.config using connection string container={}", container);
    } else if (!accountName.isBlank()) {
      client =
          new BlobServiceClientBuilder()
              .endpoint("https://" + accountName + ".blob.core.windows.net")
              .credential(new DefaultAzureCredentialBuilder().build())
              .buildClient();
      userDelegation = true;
      log.info("azure.config using Azure AD account={} container={}", accountName, container);
    }

    return new AzureBlobStorageProvider(
        client,
        container,
        props.getStorage().getNamespace(),
        props.getStorage().getSignedUrlTtl(),
        userDelegation);
  }
}
