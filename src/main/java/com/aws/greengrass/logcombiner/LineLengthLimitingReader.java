/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.logcombiner;

import com.aws.greengrass.logcombiner.exceptions.LineTooLongException;

import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;

/**
 * Splits a character stream into lines without ever buffering more than a fixed number of characters for one
 * line. Only a line feed ends a line; a single carriage return right before it is dropped, any other carriage
 * return stays part of the line.
 */
public class LineLengthLimitingReader implements Closeable {
    private static final int DEFAULT_BUFFER_SIZE = 8192;
    private static final int DEFAULT_EXPECTED_LINE_LENGTH = 80;

    private final int maxLineLength;
    private Reader in;
    private char[] buffer;
    private int count;
    private int next;

    /**
     * Constructor.
     *
     * @param in            the stream to split
     * @param bufferSize    characters read from {@code in} at a time
     * @param maxLineLength longest line, in characters, that {@link #readLine()} accepts
     * @throws IllegalArgumentException if either size is not positive
     */
    public LineLengthLimitingReader(Reader in, int bufferSize, int maxLineLength) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("Buffer size <= 0");
        }
        if (maxLineLength <= 0) {
            throw new IllegalArgumentException("Maximum line length <= 0");
        }
        this.in = in;
        this.maxLineLength = maxLineLength;
        this.buffer = new char[bufferSize];
    }

    public LineLengthLimitingReader(Reader in, int maxLineLength) {
        this(in, DEFAULT_BUFFER_SIZE, maxLineLength);
    }

    /**
     * Reads the next line.
     *
     * @return the line without its terminator, or null at the end of the stream
     * @throws LineTooLongException if the line, carriage returns included, is longer than the maximum
     * @throws IOException          if reading fails or the reader is closed
     */
    public String readLine() throws IOException {
        if (in == null) {
            throw new IOException("Stream closed");
        }
        StringBuilder line = null;
        while (true) {
            if (next >= count && !fill()) {
                return line == null || line.length() == 0 ? null : dropCarriageReturn(line);
            }
            int start = next;
            int end = start;
            while (end < count && buffer[end] != '\n') {
                end++;
            }
            int buffered = line == null ? 0 : line.length();
            if (buffered + end - start > maxLineLength) {
                throw new LineTooLongException(String.format(
                        "Line is longer than the maximum of %d characters", maxLineLength));
            }
            if (line == null) {
                line = new StringBuilder(Math.max(DEFAULT_EXPECTED_LINE_LENGTH, end - start));
            }
            line.append(buffer, start, end - start);
            next = end;
            if (end < count) {
                next++;
                return dropCarriageReturn(line);
            }
        }
    }

    private boolean fill() throws IOException {
        int n;
        do {
            n = in.read(buffer, 0, buffer.length);
        } while (n == 0);
        if (n < 0) {
            return false;
        }
        count = n;
        next = 0;
        return true;
    }

    private static String dropCarriageReturn(StringBuilder line) {
        int length = line.length();
        if (length > 0 && line.charAt(length - 1) == '\r') {
            line.setLength(length - 1);
        }
        return line.toString();
    }

    @Override
    public void close() throws IOException {
        if (in == null) {
            return;
        }
        try {
            in.close();
        } finally {
            in = null;
            buffer = null;
        }
    }
}
