package com.libragraph.depot.cli.command;

import picocli.CommandLine.Option;

/**
 * Per-invocation overrides of {@code depot.upload.*}.
 */
public class UploadOptions {

    @Option(names = "--binary-part-size", paramLabel = "BYTES",
            description = "Size of each uploaded part (at least 5242880).")
    Long partSize;

    @Option(names = "--concurrency", paramLabel = "N", description = "Parts uploaded in parallel.")
    Integer concurrency;
}
