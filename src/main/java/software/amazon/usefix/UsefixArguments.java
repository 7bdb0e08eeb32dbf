/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.usefix;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;
import software.amazon.smithy.cli.ArgumentReceiver;
import software.amazon.smithy.cli.Arguments;
import software.amazon.smithy.cli.CliError;
import software.amazon.smithy.cli.HelpPrinter;
import software.amazon.usefix.render.FormattingBackend;
import software.amazon.usefix.render.RenderStyle;
import software.amazon.usefix.render.SubprocessBackend;

/**
 * Options and params available on the command line.
 */
final class UsefixArguments implements ArgumentReceiver {

    private static final String HELP = "--help";
    private static final String HELP_SHORT = "-h";
    private static final String FORMATTER = "--formatter";
    private static final String FORMATTER_SHORT = "-f";
    private static final String GROUPED = "--grouped";
    private static final String GROUPED_SHORT = "-g";
    private static final String WRITE = "--write";
    private static final String WRITE_SHORT = "-w";
    private static final String FILE_POSITIONAL = "<file>";
    private boolean help = false;
    private boolean grouped = false;
    private boolean write = false;
    private List<String> formatter;
    private Path file;

    static UsefixArguments create(String[] args) {
        Arguments arguments = Arguments.of(args);
        var usefixArguments = new UsefixArguments();
        arguments.addReceiver(usefixArguments);
        var positional = arguments.getPositional();
        if (positional.size() > 1) {
            throw new CliError("Expected at most one file, but got " + positional.size());
        }
        if (!positional.isEmpty()) {
            usefixArguments.file = Path.of(positional.get(0));
        }
        if (usefixArguments.write && usefixArguments.file == null && !usefixArguments.help) {
            throw new CliError(WRITE + " requires a file");
        }
        return usefixArguments;
    }

    @Override
    public void registerHelp(HelpPrinter printer) {
        printer.option(HELP, HELP_SHORT, "Print this help output.");
        printer.param(FORMATTER, FORMATTER_SHORT, "COMMAND",
                "A command that formats the rewritten imports, like \"rustfmt --emit stdout\". "
                        + "Imports are passed on stdin and read back from stdout. "
                        + "When not specified, imports are written one per line.");
        printer.option(GROUPED, GROUPED_SHORT, "Write one declaration per root, with nested groups.");
        printer.option(WRITE, WRITE_SHORT, "Write the result back to <file> instead of standard out.");
        printer.positional(FILE_POSITIONAL, "The file to fix. When not specified, standard in is used.");
    }

    @Override
    public boolean testOption(String name) {
        if (name.equals(HELP) || name.equals(HELP_SHORT)) {
            help = true;
            return true;
        }
        if (name.equals(GROUPED) || name.equals(GROUPED_SHORT)) {
            grouped = true;
            return true;
        }
        if (name.equals(WRITE) || name.equals(WRITE_SHORT)) {
            write = true;
            return true;
        }
        return false;
    }

    @Override
    public Consumer<String> testParameter(String name) {
        if (name.equals(FORMATTER) || name.equals(FORMATTER_SHORT)) {
            return value -> {
                formatter = parseCommand(value);
            };
        }
        return null;
    }

    boolean help() {
        return help;
    }

    boolean write() {
        return write;
    }

    Path file() {
        return file;
    }

    UsefixOptions toOptions() {
        FormattingBackend backend = formatter == null
                ? FormattingBackend.builtin()
                : new SubprocessBackend(formatter);
        return UsefixOptions.builder()
                .setStyle(grouped ? RenderStyle.GROUPED : RenderStyle.FLAT)
                .setBackend(backend)
                .build();
    }

    private static List<String> parseCommand(String value) {
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            throw new CliError("Invalid formatter: expected a command. Was: \"" + value + "\"");
        }
        return Arrays.asList(trimmed.split("\\s+"));
    }
}
