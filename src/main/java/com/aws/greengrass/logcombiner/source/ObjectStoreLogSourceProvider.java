/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.logcombiner.source;

import com.aws.greengrass.logcombiner.exceptions.EnumerationException;
import com.aws.greengrass.logcombiner.exceptions.SourceOpenException;
import com.aws.greengrass.logcombiner.model.SourceListing;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Log sources stored as objects under a key prefix of a bucket, read through the S3 compatible API.
 */
public class ObjectStoreLogSourceProvider implements LogSourceProvider {
    private static final Logger logger = LoggerFactory.getLogger(ObjectStoreLogSourceProvider.class);
    private final S3Client client;
    @Getter
    private final String bucketName;
    @Getter
    private final String prefix;

    /**
     * Constructor.
     *
     * @param client     client for the object store, owned by this provider from now on
     * @param bucketName bucket holding the logs
     * @param prefix     key prefix to list under
     */
    public ObjectStoreLogSourceProvider(S3Client client, String bucketName, String prefix) {
        this.client = client;
        this.bucketName = bucketName;
        this.prefix = prefix;
    }

    /**
     * Extracts the key prefix from a browsable URL such as
     * {@code https://gcsweb.k8s.io/gcs/kubernetes-jenkins/logs/ci-job/123/}: everything after the bucket segment.
     *
     * @param url        the URL given on the command line
     * @param bucketName bucket whose segment must appear in the URL
     * @return the key prefix
     * @throws EnumerationException if the URL does not contain the bucket segment
     */
    public static String prefixFromUrl(String url, String bucketName) throws EnumerationException {
        String marker = "/" + bucketName + "/";
        int index = url.indexOf(marker);
        if (index < 0) {
            throw new EnumerationException(
                    String.format("Unable to determine prefix from the specified path %s, expected bucket %s",
                            url, bucketName));
        }
        return url.substring(index + marker.length());
    }

    @Override
    public SourceListing listSources() throws EnumerationException {
        List<String> names = new ArrayList<>();
        String continuationToken = null;
        try {
            do {
                ListObjectsV2Request.Builder request = ListObjectsV2Request.builder()
                        .bucket(bucketName)
                        .prefix(prefix);
                if (continuationToken != null) {
                    request.continuationToken(continuationToken);
                }
                ListObjectsV2Response response = client.listObjectsV2(request.build());
                for (S3Object object : response.contents()) {
                    if (LogSourceProvider.isLogName(object.key())) {
                        names.add(object.key());
                    }
                }
                continuationToken = Boolean.TRUE.equals(response.isTruncated())
                        ? response.nextContinuationToken() : null;
            } while (continuationToken != null);
        } catch (SdkException e) {
            throw new EnumerationException(
                    String.format("Failed to list objects in bucket %s under %s", bucketName, prefix), e);
        }
        logger.atDebug().addKeyValue("bucket", bucketName).addKeyValue("prefix", prefix)
                .addKeyValue("sources", names.size()).log("Listed object store sources");
        return SourceListing.builder().names(names).prefix(prefix).build();
    }

    @Override
    public InputStream openStream(String name) throws SourceOpenException {
        try {
            return client.getObject(GetObjectRequest.builder().bucket(bucketName).key(name).build());
        } catch (SdkException e) {
            throw new SourceOpenException(String.format("Failed to create new reader for %s", name), e);
        }
    }

    @Override
    public void close() {
        client.close();
    }
}
