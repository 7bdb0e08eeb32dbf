/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.usefix;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.emptyString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.startsWith;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

public class MainTest {
    private static final String CONFLICT = """
            <<<<<<< HEAD
            use a::b;
            =======
            use a::c;
            >>>>>>> branch
            """;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @Test
    public void fixesStandardIn() {
        int code = run("use b;\nuse a;\n", "--grouped");

        assertThat(code, equalTo(0));
        assertThat(out(), equalTo("use a;\nuse b;\n"));
        assertThat(err(), emptyString());
    }

    @Test
    public void fixesFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("lib.rs");
        Files.writeString(file, CONFLICT);

        int code = run("", "-g", file.toString());

        assertThat(code, equalTo(0));
        assertThat(out(), equalTo("use a::{b, c};\n"));
        assertThat(Files.readString(file), equalTo(CONFLICT));
    }

    @Test
    public void writesFileInPlace(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("lib.rs");
        Files.writeString(file, CONFLICT);

        int code = run("", "--write", file.toString());

        assertThat(code, equalTo(0));
        assertThat(out(), emptyString());
        assertThat(Files.readString(file), equalTo("use a::b;\nuse a::c;\n"));
    }

    @Test
    public void warnsAboutUnresolvedConflicts() {
        String text = "<<<<<<< HEAD\nuse a;\nfn f() {}\n=======\nuse b;\n>>>>>>> branch\n";

        int code = run(text);

        assertThat(code, equalTo(0));
        assertThat(out(), equalTo(text));
        assertThat(err(), startsWith("warning: Conflict at line 1 left unresolved: ours side, line 3"));
    }

    @Test
    public void printsHelp() {
        int code = run("", "--help");

        assertThat(code, equalTo(0));
        assertThat(out(), containsString("--formatter"));
        assertThat(out(), containsString("--grouped"));
    }

    @Test
    public void failsOnUsageError() {
        int code = run("", "--write");

        assertThat(code, equalTo(1));
        assertThat(out(), emptyString());
        assertThat(err(), startsWith("error: "));
    }

    @Test
    public void failsOnMissingFile(@TempDir Path dir) {
        int code = run("", dir.resolve("missing.rs").toString());

        assertThat(code, equalTo(1));
        assertThat(out(), emptyString());
        assertThat(err(), startsWith("error: "));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    public void failsWhenFormatterFails(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("lib.rs");
        Files.writeString(file, CONFLICT);

        int code = run("", "--formatter", "false", "--write", file.toString());

        assertThat(code, equalTo(1));
        assertThat(err(), equalTo("error: `false` returned 1" + System.lineSeparator()));
        assertThat(Files.readString(file), equalTo(CONFLICT));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    public void usesFormatter() {
        int code = run("use b;\nuse a;\n", "--formatter", "cat");

        assertThat(code, equalTo(0));
        assertThat(out(), equalTo("use a;\nuse b;\n"));
    }

    private int run(String stdin, String... args) {
        return Main.run(
                args,
                new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return err.toString(StandardCharsets.UTF_8);
    }
}
