/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package com.aws.greengrass.logcombiner;

import com.aws.greengrass.logcombiner.util.LogCombinerConfig;
import org.apache.commons.lang3.StringUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static com.aws.greengrass.logcombiner.util.TestUtils.createLogFile;
import static com.aws.greengrass.logcombiner.util.TestUtils.givenAStringOfSize;
import static org.junit.jupiter.api.Assertions.assertEquals;

class LogCombinerApplicationTest {
    private final Map<String, String> values = new HashMap<>();
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    @TempDir
    Path directoryPath;

    private int execute(String... args) {
        LogCombinerConfig config = new LogCombinerConfig(values::get);
        return new CommandLine(new LogCombinerApplication(config, out)).execute(args);
    }

    private String output() {
        return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    void GIVEN_directory_with_logs_WHEN_run_THEN_merged_stream_written_and_success() throws Exception {
        createLogFile(directoryPath.resolve("kubelet.log"), "I0101 08:00:01.500000 kubelet started");
        createLogFile(directoryPath.resolve("build-log.txt"), "08:00:00 build started");
        createLogFile(directoryPath.resolve("notes.txt"), "00:00:01 ignored");

        int exitCode = execute(directoryPath.toString());

        assertEquals(LogCombinerApplication.EXIT_SUCCESS, exitCode);
        String expected = "08:00:00.000000000 " + StringUtils.rightPad("[/build-log.txt]", 62)
                + " 08:00:00 build started\n"
                + "08:00:01.500000000 " + StringUtils.rightPad("[/kubelet.log]", 62)
                + " I0101 08:00:01.500000 kubelet started\n";
        assertEquals(expected, output());
    }

    @Test
    void GIVEN_directory_without_logs_WHEN_run_THEN_empty_output_and_success() throws Exception {
        createLogFile(directoryPath.resolve("readme.md"), "hello");

        assertEquals(LogCombinerApplication.EXIT_SUCCESS, execute(directoryPath.toString()));
        assertEquals("", output());
    }

    @Test
    void GIVEN_missing_path_WHEN_run_THEN_failure_and_no_output() {
        int exitCode = execute(directoryPath.resolve("missing").toString());

        assertEquals(LogCombinerApplication.EXIT_FAILURE, exitCode);
        assertEquals("", output());
    }

    @Test
    void GIVEN_no_argument_WHEN_run_THEN_usage_error() {
        assertEquals(CommandLine.ExitCode.USAGE, execute());
        assertEquals("", output());
    }

    @Test
    void GIVEN_url_outside_bucket_WHEN_run_THEN_failure_before_any_request() {
        assertEquals(LogCombinerApplication.EXIT_FAILURE, execute("https://example.com/some/prefix/"));
        assertEquals("", output());
    }

    @Test
    void GIVEN_line_longer_than_limit_WHEN_run_THEN_failure_and_no_partial_output() throws Exception {
        values.put("LOG_COMBINER_MAX_LINE_SIZE", "16");
        createLogFile(directoryPath.resolve("a.log"), "short");
        createLogFile(directoryPath.resolve("b.log"), givenAStringOfSize(40));

        assertEquals(LogCombinerApplication.EXIT_FAILURE, execute(directoryPath.toString()));
        assertEquals("", output());
    }
}
