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

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Log sources from a local directory tree.
 */
public class LocalDirectoryLogSourceProvider implements LogSourceProvider {
    private static final Logger logger = LoggerFactory.getLogger(LocalDirectoryLogSourceProvider.class);
    private static final Comparator<Path> BY_NAME = Comparator.comparing(path -> path.getFileName().toString());
    @Getter
    private final Path root;

    public LocalDirectoryLogSourceProvider(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public SourceListing listSources() throws EnumerationException {
        if (!Files.exists(root)) {
            throw new EnumerationException(String.format("Path %s does not exist", root));
        }
        // A single file argument is shown relative to its directory rather than as an empty name.
        Path prefixPath = Files.isRegularFile(root) && root.getParent() != null ? root.getParent() : root;
        List<String> names = new ArrayList<>();
        try {
            walk(root, names);
        } catch (IOException | UncheckedIOException e) {
            throw new EnumerationException(String.format("Failed to get file names from path %s", root), e);
        }
        logger.atDebug().addKeyValue("root", root).addKeyValue("sources", names.size()).log("Listed local sources");
        return SourceListing.builder().names(names).prefix(prefixPath.toString()).build();
    }

    /**
     * Depth first, entries of each directory in name order, so {@code d/b/x.log} comes before {@code d/b.log}.
     * Symbolic links to directories are not followed.
     */
    private static void walk(Path path, List<String> names) throws IOException {
        if (!Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
            if (LogSourceProvider.isLogName(path.toString())) {
                names.add(path.toString());
            }
            return;
        }
        List<Path> children;
        try (Stream<Path> entries = Files.list(path)) {
            children = entries.sorted(BY_NAME).collect(Collectors.toList());
        }
        for (Path child : children) {
            walk(child, names);
        }
    }

    @Override
    public InputStream openStream(String name) throws SourceOpenException {
        try {
            return Files.newInputStream(Paths.get(name));
        } catch (IOException e) {
            throw new SourceOpenException(String.format("Failed to open %s", name), e);
        }
    }
}
