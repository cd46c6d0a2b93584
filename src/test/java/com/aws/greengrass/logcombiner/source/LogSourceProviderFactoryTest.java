/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.logcombiner.source;

import com.aws.greengrass.logcombiner.exceptions.EnumerationException;
import com.aws.greengrass.logcombiner.util.LogCombinerConfig;
import com.aws.greengrass.logcombiner.util.ObjectStoreClientFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.s3.S3Client;

import java.nio.file.Path;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LogSourceProviderFactoryTest {
    private final LogCombinerConfig config = new LogCombinerConfig(name -> null);

    @Mock
    private ObjectStoreClientFactory clientFactory;
    @Mock
    private S3Client s3Client;

    @Test
    void GIVEN_locations_WHEN_is_url_THEN_only_http_schemes() {
        assertTrue(LogSourceProviderFactory.isUrl("https://gcsweb.k8s.io/gcs/kubernetes-jenkins/logs/"));
        assertTrue(LogSourceProviderFactory.isUrl("http://localhost/kubernetes-jenkins/x/"));
        assertFalse(LogSourceProviderFactory.isUrl("/tmp/https://not-a-url"));
        assertFalse(LogSourceProviderFactory.isUrl("logs"));
    }

    @Test
    void GIVEN_url_WHEN_create_THEN_object_store_provider_with_prefix() throws Exception {
        when(clientFactory.createClient()).thenReturn(s3Client);
        LogSourceProviderFactory factory = new LogSourceProviderFactory(config, clientFactory);

        LogSourceProvider provider = factory.create("https://gcsweb.k8s.io/gcs/kubernetes-jenkins/logs/job/7/");

        assertThat(provider, instanceOf(ObjectStoreLogSourceProvider.class));
        ObjectStoreLogSourceProvider objectStoreProvider = (ObjectStoreLogSourceProvider) provider;
        assertEquals("kubernetes-jenkins", objectStoreProvider.getBucketName());
        assertEquals("logs/job/7/", objectStoreProvider.getPrefix());
    }

    @Test
    void GIVEN_url_for_other_bucket_WHEN_create_THEN_no_client_created() {
        LogSourceProviderFactory factory = new LogSourceProviderFactory(config, clientFactory);

        assertThrows(EnumerationException.class, () -> factory.create("https://example.com/other-bucket/logs/"));
        verifyNoInteractions(clientFactory);
    }

    @Test
    void GIVEN_path_WHEN_create_THEN_local_provider() throws Exception {
        LogSourceProviderFactory factory = new LogSourceProviderFactory(config, clientFactory);

        LogSourceProvider provider = factory.create("build/logs");

        assertThat(provider, instanceOf(LocalDirectoryLogSourceProvider.class));
        assertEquals(Path.of("build/logs").toAbsolutePath(), ((LocalDirectoryLogSourceProvider) provider).getRoot());
    }
}
