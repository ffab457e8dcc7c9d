package com.libragraph.depot.cli.command;

import picocli.CommandLine.Command;

@Command(name = "binaries", mixinStandardHelpOptions = true, description = "Manage binaries.",
        subcommands = {BinaryCreateCommand.class})
public class BinariesCommand {
}
