package com.libragraph.depot.cli.command;

import io.quarkus.picocli.runtime.annotations.TopCommand;
import picocli.CommandLine.Command;

@TopCommand
@Command(name = "depot", mixinStandardHelpOptions = true,
        description = "Uploads, signs and bundles binaries in an artifact registry.",
        subcommands = {BinariesCommand.class, BundlesCommand.class})
public class DepotCommand {
}
