/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.awk.lsp;

import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import org.eclipse.lsp4j.launch.LSPLauncher;
import software.amazon.smithy.cli.CliPrinter;

/**
 * Main launcher for the language server, started by the editor.
 */
public final class Main {
    private Main() {
    }

    /**
     * Main entry point for the language server.
     * @param args Arguments passed to the server.
     * @throws Exception If there is an error starting the server.
     */
    public static void main(String[] args) throws Exception {
        var serverArguments = ServerArguments.create(args, CliPrinter.fromOutputStream(System.out));
        if (serverArguments.help()) {
            System.exit(0);
        }

        launch(serverArguments);
    }

    private static void launch(ServerArguments serverArguments) throws Exception {
        if (!serverArguments.useSocket()) {
            startServer(System.in, System.out);
        } else {
            try (var socket = new Socket("localhost", serverArguments.port())) {
                startServer(socket.getInputStream(), socket.getOutputStream());
            }
        }
    }

    private static void startServer(InputStream in, OutputStream out) throws Exception {
        var server = new AwkLanguageServer();
        var launcher = LSPLauncher.createServerLauncher(server, in, out);

        var client = launcher.getRemoteProxy();
        server.connect(client);

        launcher.startListening().get();
    }
}
