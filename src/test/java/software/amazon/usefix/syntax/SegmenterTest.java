/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.usefix.syntax;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class SegmenterTest {
    @Test
    public void splitsCodeAndImports() {
        String text = """
                //! Crate docs.
                use std::io;
                use std::fmt;

                fn main() {}
                """;
        List<Segment> segments = Segmenter.segment(text);

        assertThat(segments, hasSize(3));
        assertThat(segments.get(0), instanceOf(Segment.Code.class));
        assertThat(segments.get(1), instanceOf(Segment.ImportBlock.class));
        assertThat(segments.get(1).text(), equalTo("use std::io;\nuse std::fmt;\n"));
        assertThat(segments.get(1).line(), equalTo(1));
        assertThat(segments.get(2).text(), equalTo("\nfn main() {}\n"));
        assertThat(concat(segments), equalTo(text));
    }

    @Test
    public void importRunAbsorbsBlankLinesBetweenDeclarations() {
        String text = "use a;\n\nuse b;\n\nfn f() {}\n";
        List<Segment> segments = Segmenter.segment(text);

        assertThat(segments, hasSize(2));
        assertThat(segments.get(0).text(), equalTo("use a;\n\nuse b;\n"));
        assertThat(segments.get(1).text(), equalTo("\nfn f() {}\n"));
    }

    @Test
    public void declarationsCanSpanLines() {
        String text = "use a::{\n    b,\n    c,\n};\nfn f() {}\n";
        List<Segment> segments = Segmenter.segment(text);

        assertThat(segments, hasSize(2));
        assertThat(segments.get(0).text(), equalTo("use a::{\n    b,\n    c,\n};\n"));
    }

    @Test
    public void multipleDeclarationsOnOneLine() {
        List<Segment> segments = Segmenter.segment("use a; use b;\n");

        assertThat(segments, hasSize(1));
        Segment.ImportBlock block = (Segment.ImportBlock) segments.get(0);
        assertThat(block.forest().paths(), hasSize(2));
    }

    @Test
    public void declarationFollowedByCodeIsCode() {
        List<Segment> segments = Segmenter.segment("use a; let x = 1;\n");

        assertThat(segments, hasSize(1));
        Segment.Code code = (Segment.Code) segments.get(0);
        assertThat(code.parseFailure(), containsString("unexpected text after `;`"));
    }

    @Test
    public void declarationWithTrailingCommentIsCode() {
        List<Segment> segments = Segmenter.segment("use a; // why\n");

        assertThat(segments.get(0), instanceOf(Segment.Code.class));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "use foo bar;\n",
            "user = 1;\n",
            "pub fn f() {}\n",
            "use_it();\n",
            "#[derive(Debug)]\nstruct S;\n",
            "use a::{\n    b\n"
    })
    public void textThatOnlyLooksLikeAnImportIsCode(String text) {
        List<Segment> segments = Segmenter.segment(text);

        assertThat(segments, hasSize(1));
        assertThat(segments.get(0), instanceOf(Segment.Code.class));
        assertThat(segments.get(0).text(), equalTo(text));
    }

    @Test
    public void recordsFirstParseFailure() {
        Segment.Code code = (Segment.Code) Segmenter.segment("fn f() {}\nuse a b;\n").get(0);

        assertThat(code.parseFailure(), equalTo("line 2: expected `;`"));
        assertThat(code.isBlank(), is(false));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "let s = \"\nuse a;\n\";\n",
            "let s = r#\"\nuse a;\n\"#;\n",
            "let s = br\"\nuse a;\n\";\n",
            "/*\nuse a;\n*/\n",
            "/* /* */\nuse a;\n*/\n",
            "let s = \"\\\"\nuse a;\n\";\n"
    })
    public void ignoresDeclarationsInsideLiteralsAndComments(String text) {
        List<Segment> segments = Segmenter.segment(text);

        assertThat(segments, hasSize(1));
        assertThat(segments.get(0), instanceOf(Segment.Code.class));
    }

    @Test
    public void docCommentsBelongToTheirDeclaration() {
        String text = "use a;\n\n/// Docs.\npub use b;\n/// Not an import.\nfn f() {}\n";
        List<Segment> segments = Segmenter.segment(text);

        assertThat(segments, hasSize(2));
        Segment.ImportBlock block = (Segment.ImportBlock) segments.get(0);
        assertThat(block.text(), equalTo("use a;\n\n/// Docs.\npub use b;\n"));
        assertThat(block.forest().paths().get(1).qualifiers().docs(), contains("/// Docs."));
        assertThat(segments.get(1).text(), equalTo("/// Not an import.\nfn f() {}\n"));
        assertThat(concat(segments), equalTo(text));
    }

    @Test
    public void charLiteralsDontOpenScopes() {
        List<Segment> segments = Segmenter.segment("const C: char = '{';\nuse a;\n");

        Segment.ImportBlock block = (Segment.ImportBlock) segments.get(1);
        assertThat(block.scope(), equalTo(CodeScanner.FILE_SCOPE));
    }

    @Test
    public void tracksScopes() {
        String text = """
                use a;
                fn f<'a>(x: &'a str) {
                    use b;
                }
                mod m {
                    use c;
                }
                use d;
                """;
        List<Segment> segments = Segmenter.segment(text);
        List<Integer> scopes = segments.stream()
                .filter(segment -> segment instanceof Segment.ImportBlock)
                .map(segment -> ((Segment.ImportBlock) segment).scope())
                .collect(Collectors.toList());

        assertThat(scopes, equalTo(List.of(0, 1, 2, 0)));
        assertThat(((Segment.ImportBlock) segments.get(2)).indentation(), equalTo("    "));
        assertThat(concat(segments), equalTo(text));
    }

    @Test
    public void splitsConflicts() {
        String text = """
                use a;
                <<<<<<< HEAD
                use b;
                =======
                use c;
                >>>>>>> branch
                fn f() {}
                """;
        List<Segment> segments = Segmenter.segment(text);

        assertThat(segments, hasSize(3));
        Segment.ConflictBlock block = (Segment.ConflictBlock) segments.get(1);
        assertThat(block.line(), equalTo(1));
        assertThat(block.ours(), equalTo("use b;\n"));
        assertThat(block.oursLine(), equalTo(2));
        assertThat(block.theirs(), equalTo("use c;\n"));
        assertThat(block.theirsLine(), equalTo(4));
        assertThat(block.base(), nullValue());
        assertThat(block.scopeKnown(), is(true));
        assertThat(block.nested(), is(false));
        assertThat(concat(segments), equalTo(text));
    }

    @Test
    public void splitsDiff3Conflicts() {
        String text = """
                <<<<<<< ours
                use a;
                ||||||| base
                use z;
                =======
                use b;
                >>>>>>> theirs
                """;
        Segment.ConflictBlock block = (Segment.ConflictBlock) Segmenter.segment(text).get(0);

        assertThat(block.ours(), equalTo("use a;\n"));
        assertThat(block.base(), equalTo("use z;\n"));
        assertThat(block.theirs(), equalTo("use b;\n"));
        assertThat(block.theirsLine(), equalTo(5));
    }

    @Test
    public void unterminatedConflictIsCode() {
        List<Segment> segments = Segmenter.segment("<<<<<<< ours\nuse a;\n");

        assertThat(segments, hasSize(2));
        assertThat(segments.get(0), instanceOf(Segment.Code.class));
        assertThat(segments.get(1), instanceOf(Segment.ImportBlock.class));
    }

    @Test
    public void marksNestedConflicts() {
        String text = """
                <<<<<<< a
                <<<<<<< b
                use x;
                =======
                use y;
                >>>>>>> b
                =======
                use z;
                >>>>>>> a
                """;
        List<Segment> segments = Segmenter.segment(text);

        assertThat(segments, hasSize(1));
        Segment.ConflictBlock block = (Segment.ConflictBlock) segments.get(0);
        assertThat(block.nested(), is(true));
        assertThat(block.theirs(), equalTo("use z;\n"));
    }

    @Test
    public void conflictIndentationComesFromFirstNonBlankLine() {
        String text = "mod m {\n<<<<<<< ours\n\n    use a;\n=======\n  use b;\n>>>>>>> theirs\n}\n";
        Segment.ConflictBlock block = (Segment.ConflictBlock) Segmenter.segment(text).get(1);

        assertThat(block.indentation(), equalTo("    "));
        assertThat(block.scope(), equalTo(1));
    }

    @Test
    public void sidesThatOpenTheSameScopeAgree() {
        String text = """
                <<<<<<< ours
                fn a() {
                =======
                fn b() {
                >>>>>>> theirs
                    use x;
                }
                """;
        List<Segment> segments = Segmenter.segment(text);

        assertThat(segments.get(1), instanceOf(Segment.ImportBlock.class));
        assertThat(((Segment.ImportBlock) segments.get(1)).scope(), equalTo(1));
    }

    @Test
    public void sidesThatDisagreeLoseTheScope() {
        String text = """
                <<<<<<< ours
                fn a() {
                =======
                fn a() {}
                >>>>>>> theirs
                use x;
                <<<<<<< ours
                use y;
                =======
                use z;
                >>>>>>> theirs
                """;
        List<Segment> segments = Segmenter.segment(text);

        assertThat(segments, hasSize(3));
        assertThat(segments.get(1), instanceOf(Segment.Code.class));
        assertThat(segments.get(1).text(), equalTo("use x;\n"));
        assertThat(((Segment.ConflictBlock) segments.get(2)).scopeKnown(), is(false));
    }

    @Test
    public void handlesEmptyText() {
        assertThat(Segmenter.segment(""), hasSize(0));
    }

    @Test
    public void keepsTextWithoutTrailingNewline() {
        List<Segment> segments = Segmenter.segment("fn f() {}\nuse a;");

        assertThat(segments, hasSize(2));
        assertThat(segments.get(1).text(), equalTo("use a;"));
    }

    @Test
    public void recognizesMarkers() {
        assertThat(Segmenter.isMarker("<<<<<<< HEAD\n", Segmenter.START_MARKER), is(true));
        assertThat(Segmenter.isMarker("<<<<<<<\n", Segmenter.START_MARKER), is(true));
        assertThat(Segmenter.isMarker("<<<<<<<<\n", Segmenter.START_MARKER), is(false));
        assertThat(Segmenter.isSeparator("=======\r\n"), is(true));
        assertThat(Segmenter.isSeparator("======= x\n"), is(false));
    }

    private static String concat(List<Segment> segments) {
        return segments.stream().map(Segment::text).collect(Collectors.joining());
    }
}
