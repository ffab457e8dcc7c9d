package com.libragraph.depot.cli.command;

import picocli.CommandLine.Command;

@Command(name = "bundles", mixinStandardHelpOptions = true, description = "Push and pull bundle archives.",
        subcommands = {BundlePushCommand.class, BundlePullCommand.class})
public class BundlesCommand {
}
