package com.cario.qr.app.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Enablement of the two storage providers. Locations are reported only for enabled providers. */
public record StorageStatus(
    @JsonProperty("aws_enabled") boolean awsEnabled,
    @JsonProperty("azure_enabled") boolean azureEnabled,
    @JsonProperty("aws_bucket") String awsBucket,
    @JsonProperty("azure_container") String azureContainer) {}
