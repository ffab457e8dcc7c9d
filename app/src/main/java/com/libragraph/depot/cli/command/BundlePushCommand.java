package com.libragraph.depot.cli.command;

import com.libragraph.depot.cli.PipelineFactory;
import com.libragraph.depot.core.bundle.PushOptions;
import com.libragraph.depot.core.bundle.PushResult;
import com.libragraph.depot.core.registry.model.Binary;
import com.libragraph.depot.core.registry.model.CreateBundleRequest;
import com.libragraph.depot.formats.archive.PayloadMatching;
import jakarta.inject.Inject;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "push", mixinStandardHelpOptions = true,
        description = "Create the artifacts, versions and binaries of a bundle archive and publish the bundle.")
public class BundlePushCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Inject
    PipelineFactory pipelines;

    @Option(names = "--path", required = true, description = "Bundle archive (.cpio.zst).")
    Path path;

    @Option(names = "--api-version", defaultValue = "" + CreateBundleRequest.CURRENT_API_VERSION,
            description = "Bundle schema: 1 (legacy) or 2. Default: ${DEFAULT-VALUE}.")
    int apiVersion;

    @Option(names = "--lenient-payload-matching",
            description = "Pair payloads with manifest entries by position when hashes do not match.")
    boolean lenient;

    @Mixin
    UploadOptions upload;

    @Override
    public Integer call() {
        PushOptions options = new PushOptions(apiVersion, lenient ? PayloadMatching.LENIENT : PayloadMatching.STRICT);
        PushResult result = pipelines.pushService(pipelines.uploadSettings(upload.partSize, upload.concurrency))
                .push(path, options);

        PrintWriter out = spec.commandLine().getOut();
        out.println(result.bundle().prn());
        for (Binary binary : result.binaries()) {
            out.printf("  %s %s %s%n", binary.prn(), binary.target(), binary.state().wireName());
        }
        return 0;
    }
}
