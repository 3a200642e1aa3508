/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp;

import java.util.List;
import java.util.function.Consumer;
import software.amazon.smithy.cli.ArgumentReceiver;
import software.amazon.smithy.cli.AnsiColorFormatter;
import software.amazon.smithy.cli.Arguments;
import software.amazon.smithy.cli.CliError;
import software.amazon.smithy.cli.CliPrinter;
import software.amazon.smithy.cli.HelpPrinter;

/**
 * Command line arguments of the server.
 */
final class ServerArguments implements ArgumentReceiver {
    static final int DEFAULT_PORT = 0; // Standard in/out.

    private static final int MIN_PORT = 0;
    private static final int MAX_PORT = 65535;
    private static final String HELP = "--help";
    private static final String HELP_SHORT = "-h";
    private static final String PORT = "--port";
    private static final String PORT_SHORT = "-p";
    private static final String COMMAND = "java -jar awk-language-server.jar";

    private int port = DEFAULT_PORT;
    private boolean help = false;

    /**
     * Parses {@code args}, printing the help output if it was asked for.
     *
     * @param args Command line arguments
     * @param printer Where help output goes
     * @return The parsed arguments
     * @throws CliError If an argument is invalid
     */
    static ServerArguments create(String[] args, CliPrinter printer) {
        Arguments arguments = Arguments.of(args);
        var serverArguments = new ServerArguments();
        arguments.addReceiver(serverArguments);
        List<String> positional = arguments.getPositional();
        if (serverArguments.help) {
            HelpPrinter helpPrinter = HelpPrinter.fromArguments(COMMAND, arguments);
            helpPrinter.summary("Options for the AWK Language Server:");
            helpPrinter.print(AnsiColorFormatter.NO_COLOR, printer);
            printer.flush();
        } else if (!positional.isEmpty()) {
            throw new CliError("Unexpected CLI argument: " + positional.get(0));
        }
        return serverArguments;
    }

    @Override
    public void registerHelp(HelpPrinter printer) {
        printer.option(HELP, HELP_SHORT, "Print this help output.");
        printer.param(PORT, PORT_SHORT, "PORT",
                "The port to use for talking to the client. When not specified, or set to 0, "
                        + "standard in/out is used.");
    }

    @Override
    public boolean testOption(String name) {
        if (name.equals(HELP) || name.equals(HELP_SHORT)) {
            help = true;
            return true;
        }
        return false;
    }

    @Override
    public Consumer<String> testParameter(String name) {
        if (name.equals(PORT_SHORT) || name.equals(PORT)) {
            return value -> port = validatePortNumber(value);
        }
        return null;
    }

    int port() {
        return port;
    }

    boolean help() {
        return help;
    }

    boolean useSocket() {
        return port != DEFAULT_PORT;
    }

    private static int validatePortNumber(String portStr) {
        try {
            int portNumber = Integer.parseInt(portStr);
            if (portNumber < MIN_PORT || portNumber > MAX_PORT) {
                throw invalidPort(portStr);
            }
            return portNumber;
        } catch (NumberFormatException e) {
            throw invalidPort(portStr);
        }
    }

    private static CliError invalidPort(String portStr) {
        return new CliError("Invalid port number: expected an integer between "
                + MIN_PORT + " and " + MAX_PORT + ", inclusive. Was: " + portStr);
    }
}
