/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.logcombiner.source;

import com.aws.greengrass.logcombiner.exceptions.EnumerationException;
import com.aws.greengrass.logcombiner.exceptions.SourceOpenException;
import com.aws.greengrass.logcombiner.model.SourceListing;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static com.aws.greengrass.logcombiner.util.TestUtils.createLogFile;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LocalDirectoryLogSourceProviderTest {
    @TempDir
    Path directoryPath;

    @Test
    void GIVEN_directory_tree_WHEN_list_sources_THEN_only_log_files_in_path_order() throws Exception {
        Path root = directoryPath.toAbsolutePath().normalize();
        createLogFile(root.resolve("sub/b.log"), "b");
        createLogFile(root.resolve("sub/build-log.txt"), "build");
        createLogFile(root.resolve("a.log"), "a");
        createLogFile(root.resolve("c.txt"), "c");
        createLogFile(root.resolve("d.log.gz"), "d");
        createLogFile(root.resolve("sub/other-log.txt"), "e");

        SourceListing listing = new LocalDirectoryLogSourceProvider(directoryPath).listSources();

        assertThat(listing.getNames(), contains(root.resolve("a.log").toString(),
                root.resolve("sub/b.log").toString(), root.resolve("sub/build-log.txt").toString()));
        assertEquals(root.toString(), listing.getPrefix());
    }

    @Test
    void GIVEN_subdirectory_sharing_a_file_name_prefix_WHEN_list_sources_THEN_depth_first_name_order()
            throws Exception {
        Path root = directoryPath.toAbsolutePath().normalize();
        createLogFile(root.resolve("d/b.log"), "file");
        createLogFile(root.resolve("d/b/x.log"), "nested");
        createLogFile(root.resolve("d/a.log"), "first");

        SourceListing listing = new LocalDirectoryLogSourceProvider(directoryPath).listSources();

        assertThat(listing.getNames(), contains(root.resolve("d/a.log").toString(),
                root.resolve("d/b/x.log").toString(), root.resolve("d/b.log").toString()));
    }

    @Test
    void GIVEN_relative_path_WHEN_created_THEN_root_is_absolute() {
        LocalDirectoryLogSourceProvider provider = new LocalDirectoryLogSourceProvider(Path.of("logs/../logs"));
        assertEquals(Path.of("logs").toAbsolutePath().normalize(), provider.getRoot());
    }

    @Test
    void GIVEN_single_file_WHEN_list_sources_THEN_prefix_is_its_directory() throws Exception {
        Path file = createLogFile(directoryPath.resolve("only.log"), "x").toAbsolutePath().normalize();

        SourceListing listing = new LocalDirectoryLogSourceProvider(file).listSources();

        assertThat(listing.getNames(), contains(file.toString()));
        assertEquals(file.getParent().toString(), listing.getPrefix());
    }

    @Test
    void GIVEN_missing_path_WHEN_list_sources_THEN_enumeration_exception() {
        LocalDirectoryLogSourceProvider provider =
                new LocalDirectoryLogSourceProvider(directoryPath.resolve("does-not-exist"));
        assertThrows(EnumerationException.class, provider::listSources);
    }

    @Test
    void GIVEN_listed_file_WHEN_open_stream_THEN_content_readable() throws Exception {
        Path file = createLogFile(directoryPath.resolve("a.log"), "hello");
        LocalDirectoryLogSourceProvider provider = new LocalDirectoryLogSourceProvider(directoryPath);

        try (InputStream in = provider.openStream(file.toString())) {
            assertEquals("hello\n", new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
    }

    @Test
    void GIVEN_missing_file_WHEN_open_stream_THEN_open_exception() {
        LocalDirectoryLogSourceProvider provider = new LocalDirectoryLogSourceProvider(directoryPath);
        SourceOpenException e = assertThrows(SourceOpenException.class,
                () -> provider.openStream(directoryPath.resolve("gone.log").toString()));
        assertThat(e.getCause(), instanceOf(IOException.class));
    }
}
