package com.cario.qr.app.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class StorageUploadOutcomeTest {

  @Test
  void succeededCarriesUrlAndNoError() {
    StorageUploadOutcome outcome = StorageUploadOutcome.succeeded("aws", "id-1", "https://u", 12);

    assertThat(outcome.isSuccess()).isTrue();
    assertThat(outcome.isSkipped()).isFalse();
    assertThat(outcome.getSignedUrl()).isEqualTo("https://u");
    assertThat(outcome.getError()).isNull();
    assertThat(outcome.status()).isEqualTo("success");
  }

  @Test
  void skippedIsNeitherSuccessNorFailure() {
    StorageUploadOutcome outcome = StorageUploadOutcome.skipped("azure", "id-2");

    assertThat(outcome.isSuccess()).isFalse();
    assertThat(outcome.isSkipped()).isTrue();
    assertThat(outcome.getSignedUrl()).isNull();
    assertThat(outcome.getError()).isEqualTo("provider disabled");
    assertThat(outcome.status()).isEqualTo("skipped");
  }

  @Test
  void failedKeepsTheErrorMessage() {
    StorageUploadOutcome outcome = StorageUploadOutcome.failed("aws", "id-3", "denied", 40);

    assertThat(outcome.isSuccess()).isFalse();
    assertThat(outcome.isSkipped()).isFalse();
    assertThat(outcome.getError()).isEqualTo("denied");
    assertThat(outcome.getDurationMs()).isEqualTo(40);
    assertThat(outcome.status()).isEqualTo("failure");
  }
}
