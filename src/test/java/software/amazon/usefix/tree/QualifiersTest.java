/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.usefix.tree;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class QualifiersTest {
    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "''|pub|pub",
            "''|pub(crate)|pub(crate)",
            "pub(self)|pub(super)|pub(super)",
            "pub(super)|pub(in crate::a)|pub(in crate::a)",
            "pub(in crate::a)|pub(in crate::a::b)|pub(in crate::a)",
            "pub(in crate::a)|pub(crate)|pub(crate)",
            "pub(crate)|pub|pub",
            "pub|pub|pub",
            "''|''|''"
    })
    public void morePublicVisibilityWins(String left, String right, String expected) {
        assertThat(Qualifiers.mergeVisibilities(left, right), equalTo(expected));
        assertThat(Qualifiers.mergeVisibilities(right, left), equalTo(expected));
    }

    @Test
    public void equallyPublicPathsPickTheSameOneEitherWay() {
        String merged = Qualifiers.mergeVisibilities("pub(in crate::b)", "pub(in crate::a)");

        assertThat(merged, equalTo("pub(in crate::a)"));
        assertThat(Qualifiers.mergeVisibilities("pub(in crate::a)", "pub(in crate::b)"), equalTo(merged));
    }

    @Test
    public void mergingPropertiesKeepsAttributesAndUnionsDocs() {
        Qualifiers left = new Qualifiers(List.of("#[cfg(test)]"), "", List.of("/// B"));
        Qualifiers right = new Qualifiers(List.of("#[cfg(unix)]"), "pub", List.of("/// A", "/// B"));

        Qualifiers merged = left.mergeProperties(right);

        assertThat(merged.attributes(), contains("#[cfg(test)]"));
        assertThat(merged.visibility(), equalTo("pub"));
        assertThat(merged.docs(), contains("/// A", "/// B"));
    }

    @Test
    public void unconditionalSortsFirst() {
        Qualifiers conditional = new Qualifiers(List.of("#[cfg(test)]"), "");
        Qualifiers exported = new Qualifiers(List.of(), "pub");

        assertThat(Qualifiers.NONE.compareTo(conditional), lessThan(0));
        assertThat(exported.compareTo(conditional), lessThan(0));
        assertThat(Qualifiers.NONE.compareTo(exported), lessThan(0));
        assertThat(exported.isUnconditional(), is(true));
        assertThat(conditional.isUnconditional(), is(false));
    }
}
