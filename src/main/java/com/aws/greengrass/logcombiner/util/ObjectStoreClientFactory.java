/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.logcombiner.util;

import com.aws.greengrass.logcombiner.exceptions.EnumerationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AnonymousCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.http.apache.ApacheHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Builds the anonymous S3 compatible client used to read public log buckets.
 */
public class ObjectStoreClientFactory {
    private static final Logger LOGGER = LoggerFactory.getLogger(ObjectStoreClientFactory.class);
    // A failed request fails the whole run, so the SDK must not retry behind our back.
    private static final ClientOverrideConfiguration OVERRIDE_CONFIGURATION =
            ClientOverrideConfiguration.builder().retryPolicy(RetryPolicy.none()).build();

    private final LogCombinerConfig config;

    public ObjectStoreClientFactory(LogCombinerConfig config) {
        this.config = config;
    }

    /**
     * Creates a client for the configured endpoint.
     *
     * @return a new client, owned by the caller
     * @throws EnumerationException if the configured endpoint is not a valid URI
     */
    public S3Client createClient() throws EnumerationException {
        URI endpoint;
        try {
            endpoint = new URI(config.getObjectStoreEndpoint());
        } catch (URISyntaxException e) {
            throw new EnumerationException(
                    String.format("Invalid object store endpoint %s", config.getObjectStoreEndpoint()), e);
        }
        LOGGER.atDebug().addKeyValue("endpoint", endpoint).addKeyValue("region", config.getObjectStoreRegion())
                .log("Creating object store client");
        return S3Client.builder()
                .credentialsProvider(AnonymousCredentialsProvider.create())
                .endpointOverride(endpoint)
                .region(Region.of(config.getObjectStoreRegion()))
                .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(true).build())
                .httpClient(ApacheHttpClient.builder().build())
                .overrideConfiguration(OVERRIDE_CONFIGURATION)
                .build();
    }
}
