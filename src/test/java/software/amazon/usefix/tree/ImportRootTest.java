/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.usefix.tree;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.lessThan;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

public class ImportRootTest {
    @Test
    public void categorizesRoots() {
        assertThat(ImportRoot.of("std").category(), equalTo(RootCategory.STANDARD_LIBRARY));
        assertThat(ImportRoot.of("alloc").category(), equalTo(RootCategory.STANDARD_LIBRARY));
        assertThat(ImportRoot.of("serde").category(), equalTo(RootCategory.EXTERNAL));
        assertThat(ImportRoot.of("crate").category(), equalTo(RootCategory.CRATE));
        assertThat(ImportRoot.of("self").category(), equalTo(RootCategory.CURRENT_MODULE));
        assertThat(ImportRoot.of("super").category(), equalTo(RootCategory.PARENT_MODULE));
        assertThat(ImportRoot.of("Self").category(), equalTo(RootCategory.SELF_TYPE));
    }

    @Test
    public void rawIdentifiersSortByTheirName() {
        List<ImportRoot> roots = new ArrayList<>(List.of(
                ImportRoot.of("b"),
                ImportRoot.of("r#async"),
                ImportRoot.of("async_trait")));
        roots.sort(null);

        List<String> names = new ArrayList<>();
        roots.forEach(root -> names.add(root.segment().name()));
        assertThat(names, contains("r#async", "async_trait", "b"));
    }

    @Test
    public void unrootedComesBeforeRooted() {
        ImportRoot unrooted = ImportRoot.of("std");
        ImportRoot rooted = new ImportRoot(true, PathSegment.of("std"));

        assertThat(rooted.compareTo(unrooted), greaterThan(0));
        assertThat(rooted.text(), equalTo("::std"));
        assertThat(unrooted.text(), equalTo("std"));
    }

    @Test
    public void categoryComesBeforeName() {
        assertThat(ImportRoot.of("std").compareTo(ImportRoot.of("anyhow")), lessThan(0));
        assertThat(ImportRoot.of("zip").compareTo(ImportRoot.of("crate")), lessThan(0));
        assertThat(ImportRoot.of("self").compareTo(ImportRoot.of("super")), lessThan(0));
    }
}
