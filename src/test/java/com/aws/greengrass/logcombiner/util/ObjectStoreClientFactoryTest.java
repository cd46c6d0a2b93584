/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.logcombiner.util;

import com.aws.greengrass.logcombiner.exceptions.EnumerationException;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.s3.S3Client;

import java.util.HashMap;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ObjectStoreClientFactoryTest {
    private final Map<String, String> values = new HashMap<>();

    @Test
    void GIVEN_default_config_WHEN_create_client_THEN_client_built_without_credentials() throws Exception {
        ObjectStoreClientFactory factory = new ObjectStoreClientFactory(new LogCombinerConfig(values::get));
        try (S3Client client = factory.createClient()) {
            assertNotNull(client);
        }
    }

    @Test
    void GIVEN_invalid_endpoint_WHEN_create_client_THEN_enumeration_exception() {
        values.put(LogCombinerConfig.OBJECT_STORE_ENDPOINT, "http://bad host/");
        ObjectStoreClientFactory factory = new ObjectStoreClientFactory(new LogCombinerConfig(values::get));

        EnumerationException e = assertThrows(EnumerationException.class, factory::createClient);
        assertThat(e.getMessage(), containsString("http://bad host/"));
    }
}
