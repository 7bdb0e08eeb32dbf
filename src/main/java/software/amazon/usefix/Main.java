/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.usefix;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import software.amazon.smithy.cli.AnsiColorFormatter;
import software.amazon.smithy.cli.CliError;
import software.amazon.smithy.cli.CliPrinter;
import software.amazon.smithy.cli.HelpPrinter;
import software.amazon.smithy.utils.IoUtils;
import software.amazon.usefix.conflict.UnresolvedConflict;
import software.amazon.usefix.render.BackendException;

/**
 * Command line entry point.
 */
public final class Main {
    private Main() {
    }

    /**
     * Fixes the imports of a file, or of standard in.
     * @param args Arguments passed on the command line.
     */
    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    /**
     * @param args Arguments passed on the command line
     * @param in Where to read the input from when no file is given
     * @param out Where to write the output
     * @param err Where to write diagnostics
     * @return The exit code
     */
    static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        try {
            var arguments = UsefixArguments.create(args);
            if (arguments.help()) {
                printHelp(out);
                return 0;
            }

            String text = arguments.file() == null
                    ? IoUtils.toUtf8String(in)
                    : IoUtils.readUtf8File(arguments.file());
            FixResult result = new ImportFixer(arguments.toOptions()).fix(text);
            for (UnresolvedConflict conflict : result.unresolved()) {
                err.println("warning: " + conflict.describe());
            }

            if (arguments.write()) {
                Files.writeString(arguments.file(), result.text(), StandardCharsets.UTF_8);
            } else {
                out.print(result.text());
                out.flush();
            }
            return 0;
        } catch (CliError | BackendException e) {
            err.println("error: " + e.getMessage());
            return 1;
        } catch (IOException | UncheckedIOException e) {
            err.println("error: " + e.getMessage());
            return 1;
        }
    }

    private static void printHelp(PrintStream out) {
        HelpPrinter printer = new HelpPrinter("usefix");
        printer.summary("Sorts, deduplicates, and groups use declarations, "
                        + "and resolves merge conflicts between imports.");
        new UsefixArguments().registerHelp(printer);
        CliPrinter cliPrinter = CliPrinter.fromOutputStream(out);
        printer.print(AnsiColorFormatter.NO_COLOR, cliPrinter);
        cliPrinter.flush();
    }
}
