/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.usefix.syntax;

import java.util.ArrayList;
import java.util.List;
import software.amazon.smithy.utils.SimpleParser;
import software.amazon.usefix.tree.ImportForest;
import software.amazon.usefix.tree.ImportLeaf;
import software.amazon.usefix.tree.ImportPath;
import software.amazon.usefix.tree.ImportRoot;
import software.amazon.usefix.tree.PathSegment;
import software.amazon.usefix.tree.Qualifiers;

/**
 * Parser for {@code use} declarations:
 * <pre>
 * declaration = *( doc | attribute ) [visibility] "use" tree ";"
 * tree        = ["::"] ( "*" | group | path [ "::" ( "*" | group ) ] [ "as" ident ] )
 * group       = "{" [ tree *( "," tree ) [","] ] "}"
 * path        = segment *( "::" segment )
 * </pre>
 *
 * <p>Every tree is flattened into {@link ImportPath}s while parsing, so the
 * result of a parse is already in the shape of an {@link ImportForest}.
 * Outer doc comments and {@code #[doc = ...]} attributes before a
 * declaration are kept as its docs; any other comment is treated as
 * whitespace. {@code self} at the end of a path (or
 * alone in a group) stands for the path's prefix, so {@code a::{self}} and
 * {@code a} parse to the same import.
 *
 * <p>Any syntax error throws an {@link ImportParseException}; the parser never
 * tries to recover, since callers fall back to treating the text as opaque.
 */
public final class ImportParser extends SimpleParser {
    private static final int MAX_GROUP_DEPTH = 64;
    private static final String USE = "use";
    private static final String PUB = "pub";
    private static final String AS = "as";
    private static final String UNDERSCORE = "_";

    private List<ImportPath> paths = new ArrayList<>();
    private Qualifiers qualifiers = Qualifiers.NONE;
    private int groupDepth;

    private ImportParser(CharSequence text) {
        super(text);
    }

    /**
     * Parses a single declaration at the start of {@code text}, preceded by
     * optional whitespace. Parsing stops right after the declaration's
     * {@code ;}, whatever follows it.
     *
     * @param text The text to parse
     * @return The parsed declaration
     * @throws ImportParseException If {@code text} doesn't start with a
     *  declaration
     */
    public static ImportDeclaration parseDeclaration(CharSequence text) {
        return new ImportParser(text).declaration();
    }

    /**
     * Parses text that consists only of declarations, whitespace, and comments.
     *
     * @param text The text to parse
     * @return A forest of every import in {@code text}
     * @throws ImportParseException If {@code text} contains anything else
     */
    public static ImportForest parse(CharSequence text) {
        ImportParser parser = new ImportParser(text);
        ImportForest forest = ImportForest.empty();
        parser.skipWhitespace(false);
        while (!parser.eof()) {
            for (ImportPath path : parser.declaration().paths()) {
                forest.insert(path);
            }
            parser.skipWhitespace(false);
        }
        return forest;
    }

    private ImportDeclaration declaration() {
        int start = position();
        paths = new ArrayList<>();
        skipWhitespace(false);

        List<String> docs = new ArrayList<>();
        List<String> attributes = new ArrayList<>();
        while (true) {
            if (isDocComment()) {
                docs.add(docComment());
            } else if (is('#') && peek(1) == '[') {
                String attribute = attribute();
                if (isDocAttribute(attribute)) {
                    docs.add(attribute);
                } else {
                    attributes.add(attribute);
                }
            } else {
                break;
            }
            skipWhitespace(false);
        }

        String visibility = "";
        if (isKeyword(PUB)) {
            visibility = visibility();
            ws();
        }

        if (!isKeyword(USE)) {
            throw error("expected `use`");
        }
        skipKeyword(USE);
        List<String> docBlocks = docs.isEmpty() ? List.of() : List.of(String.join("\n", docs));
        qualifiers = new Qualifiers(attributes, visibility, docBlocks);

        tree(List.of(), false);
        ws();
        if (!is(';')) {
            throw error("expected `;`");
        }
        skip();
        return new ImportDeclaration(paths, position() - start);
    }

    private String attribute() {
        int start = position();
        skip(); // '#'
        skip(); // '['
        int depth = 1;
        while (depth > 0) {
            if (eof()) {
                throw error("unclosed attribute");
            }
            switch (peek()) {
                case '"' -> {
                    string();
                    continue;
                }
                case '[' -> depth++;
                case ']' -> depth--;
                default -> {
                }
            }
            skip();
        }
        return text(start, position());
    }

    private void string() {
        skip(); // '"'
        while (!is('"')) {
            if (eof()) {
                throw error("unclosed string");
            }
            if (is('\\')) {
                skip();
            }
            skip();
        }
        skip();
    }

    private String visibility() {
        skipKeyword(PUB);
        int offset = 0;
        while (peek(offset) == ' ' || peek(offset) == '\t') {
            offset++;
        }
        if (peek(offset) != '(') {
            return PUB;
        }

        for (int i = 0; i <= offset; i++) {
            skip();
        }
        ws();
        String restriction = identifier();
        if (restriction.equals("in")) {
            ws();
            StringBuilder path = new StringBuilder(identifier());
            ws();
            while (isPathSeparator()) {
                skip();
                skip();
                ws();
                path.append("::").append(identifier());
                ws();
            }
            restriction = "in " + path;
        } else if (!restriction.equals("crate") && !restriction.equals("self") && !restriction.equals("super")) {
            throw error("invalid visibility restriction `" + restriction + "`");
        }
        ws();
        if (!is(')')) {
            throw error("expected `)`");
        }
        skip();
        return PUB + "(" + restriction + ")";
    }

    private void tree(List<PathSegment> prefix, boolean rooted) {
        ws();
        if (isPathSeparator()) {
            if (!prefix.isEmpty()) {
                throw error("unexpected `::`");
            }
            skip();
            skip();
            ws();
            rooted = true;
        }

        if (is('*')) {
            skip();
            addPath(prefix, rooted, ImportLeaf.glob());
            return;
        }

        if (is('{')) {
            group(prefix, rooted);
            return;
        }

        List<PathSegment> path = new ArrayList<>(prefix);
        while (true) {
            PathSegment segment = segment();
            if (segment.equals(PathSegment.SELF) && !path.isEmpty()) {
                ws();
                if (isPathSeparator()) {
                    throw error("`self` is only allowed at the start or end of a path");
                }
                leaf(path, rooted);
                return;
            }

            path.add(segment);
            ws();
            if (!isPathSeparator()) {
                leaf(path, rooted);
                return;
            }

            skip();
            skip();
            ws();
            if (is('*')) {
                skip();
                addPath(path, rooted, ImportLeaf.glob());
                return;
            } else if (is('{')) {
                group(path, rooted);
                return;
            }
        }
    }

    private void group(List<PathSegment> prefix, boolean rooted) {
        skip(); // '{'
        if (++groupDepth > MAX_GROUP_DEPTH) {
            throw error("groups nested too deeply");
        }
        ws();
        while (!is('}')) {
            if (eof()) {
                throw error("unclosed `{`");
            }
            tree(prefix, rooted);
            ws();
            if (is(',')) {
                skip();
                ws();
            } else if (!is('}')) {
                throw error("expected `,` or `}`");
            }
        }
        skip();
        groupDepth--;
    }

    private void leaf(List<PathSegment> path, boolean rooted) {
        if (!isKeyword(AS)) {
            addPath(path, rooted, ImportLeaf.plain());
            return;
        }

        skipKeyword(AS);
        ws();
        String alias;
        if (is('_') && !isIdentPart(1)) {
            skip();
            alias = UNDERSCORE;
        } else {
            alias = identifier();
        }
        addPath(path, rooted, ImportLeaf.alias(alias));
    }

    private void addPath(List<PathSegment> path, boolean rooted, ImportLeaf leaf) {
        if (path.isEmpty()) {
            throw error("nothing to import");
        }
        ImportRoot root = new ImportRoot(rooted, path.get(0));
        paths.add(new ImportPath(root, path.subList(1, path.size()), leaf, qualifiers));
    }

    private PathSegment segment() {
        String identifier = identifier();
        if (identifier.equals(UNDERSCORE)) {
            throw error("`_` is not a valid path segment");
        }
        return PathSegment.of(identifier);
    }

    private String identifier() {
        int start = position();
        if (is('r') && peek(1) == '#') {
            skip();
            skip();
        }
        if (!isIdentStart()) {
            throw error("expected identifier");
        }
        do {
            skip();
        } while (isIdentPart(0));
        return text(start, position());
    }

    private boolean isKeyword(String keyword) {
        for (int i = 0; i < keyword.length(); i++) {
            if (peek(i) != keyword.charAt(i)) {
                return false;
            }
        }
        return !isIdentPart(keyword.length());
    }

    private void skipKeyword(String keyword) {
        for (int i = 0; i < keyword.length(); i++) {
            skip();
        }
    }

    private boolean isPathSeparator() {
        return is(':') && peek(1) == ':';
    }

    private boolean isIdentStart() {
        char peeked = peek();
        return !eof() && (Character.isUnicodeIdentifierStart(peeked) || peeked == '_');
    }

    // peek returns '\0' past the end, which Character counts as an identifier part.
    private boolean isIdentPart(int offset) {
        if (position() + offset >= expression().length()) {
            return false;
        }
        char peeked = peek(offset);
        return Character.isUnicodeIdentifierPart(peeked) && !Character.isIdentifierIgnorable(peeked);
    }

    private boolean is(char c) {
        return !eof() && peek() == c;
    }

    private String text(int start, int end) {
        return expression().subSequence(start, end).toString();
    }

    private ImportParseException error(String reason) {
        return new ImportParseException(reason, line(), column());
    }

    @Override
    public void ws() {
        skipWhitespace(true);
    }

    // Skips whitespace and comments, stopping at a doc comment unless
    // `includeDocs` is set.
    private void skipWhitespace(boolean includeDocs) {
        while (!eof()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\n' || c == '\r') {
                skip();
            } else if (!includeDocs && isDocComment()) {
                break;
            } else if (c == '/' && peek(1) == '/') {
                lineComment();
            } else if (c == '/' && peek(1) == '*') {
                blockComment();
            } else {
                break;
            }
        }
    }

    // `///` and `/**` start outer doc comments, but `////`, `/***`, and the
    // empty `/**/` are plain comments.
    private boolean isDocComment() {
        if (!is('/')) {
            return false;
        }
        if (peek(1) == '/' && peek(2) == '/') {
            return peek(3) != '/';
        }
        return peek(1) == '*' && peek(2) == '*' && peek(3) != '*' && peek(3) != '/';
    }

    private String docComment() {
        int start = position();
        int indentation = column() - 1;
        if (peek(1) == '/') {
            lineComment();
        } else {
            blockComment();
        }
        return dedent(text(start, position()), indentation);
    }

    private void lineComment() {
        while (!eof() && peek() != '\n') {
            skip();
        }
    }

    private static boolean isDocAttribute(String attribute) {
        String inner = attribute.substring(2, attribute.length() - 1).trim();
        if (!inner.startsWith("doc")) {
            return false;
        }
        return inner.substring(3).trim().startsWith("=");
    }

    // Normalizes line endings and removes up to `indentation` columns of
    // leading whitespace from continuation lines, so a multi-line doc can be
    // re-indented wherever it's written back.
    private static String dedent(String doc, int indentation) {
        String[] lines = doc.stripTrailing().split("\r?\n", -1);
        StringBuilder builder = new StringBuilder(lines[0]);
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i];
            int strip = 0;
            while (strip < indentation && strip < line.length()
                   && (line.charAt(strip) == ' ' || line.charAt(strip) == '\t')) {
                strip++;
            }
            builder.append('\n').append(line.substring(strip));
        }
        return builder.toString();
    }

    private void blockComment() {
        int depth = 0;
        do {
            if (eof()) {
                throw error("unclosed block comment");
            }
            if (peek() == '/' && peek(1) == '*') {
                depth++;
                skip();
            } else if (peek() == '*' && peek(1) == '/') {
                depth--;
                skip();
            }
            skip();
        } while (depth > 0);
    }
}
