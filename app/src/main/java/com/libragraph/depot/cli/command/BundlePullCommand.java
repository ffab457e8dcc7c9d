package com.libragraph.depot.cli.command;

import com.libragraph.depot.core.bundle.BundlePullService;
import com.libragraph.depot.core.bundle.PullOptions;
import jakarta.inject.Inject;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "pull", mixinStandardHelpOptions = true,
        description = "Download a bundle and its binaries into a bundle archive.")
public class BundlePullCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Inject
    BundlePullService pullService;

    @Option(names = "--bundle-prn", required = true)
    String bundlePrn;

    @Option(names = "--output", description = "Archive to write. Defaults to <bundle name>.cpio.zst.")
    Path output;

    @Option(names = "--allow-placeholders",
            description = "Write zero-filled payloads for binaries that cannot be downloaded.")
    boolean allowPlaceholders;

    @Override
    public Integer call() {
        Path written = pullService.pull(bundlePrn, new PullOptions(output, allowPlaceholders));
        spec.commandLine().getOut().println(written);
        return 0;
    }
}
