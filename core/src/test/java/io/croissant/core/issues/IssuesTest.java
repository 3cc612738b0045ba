package io.croissant.core.issues;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class IssuesTest {

    private final Context dataset = Context.dataset("titanic");

    @Test
    void breadcrumbRendersEveryLevel() {
        Context field = dataset.child(Context.RECORD_SET, "passengers").child(Context.FIELD, "age");

        assertThat(field).hasToString("[dataset(titanic) > record_set(passengers) > field(age)]");
    }

    @Test
    void unnamedNodeRendersEmptyParentheses() {
        assertThat(dataset.child(Context.DISTRIBUTION, null)).hasToString("[dataset(titanic) > distribution()]");
    }

    @Test
    void errorsAndWarningsAreKeptInCollectionOrder() {
        Issues issues = new Issues();
        issues.warning(dataset, "w1");
        issues.error(dataset, "e1");
        issues.warning(dataset, "w2");

        assertThat(issues.size()).isEqualTo(3);
        assertThat(issues.hasErrors()).isTrue();
        assertThat(issues.errors()).extracting(Issue::message).containsExactly("e1");
        assertThat(issues.warnings()).extracting(Issue::message).containsExactly("w1", "w2");
        assertThat(issues.all()).extracting(Issue::message).containsExactly("w1", "e1", "w2");
    }

    @Test
    void warningsAloneDoNotMakeErrors() {
        Issues issues = new Issues();
        issues.warning(dataset, "Property \"https://schema.org/license\" is recommended, but does not exist.");

        assertThat(issues.hasErrors()).isFalse();
        assertThat(issues.report()).isEmpty();
    }

    @Test
    void reportListsOnlyErrorsWithTheirContext() {
        Issues issues = new Issues();
        issues.error(dataset, "first");
        issues.warning(dataset, "ignored");
        issues.error(dataset.child(Context.DISTRIBUTION, "f.csv"), "second");

        assertThat(issues.report())
                .isEqualTo("Found the following 2 error(s) during the validation:"
                        + "\n  -  [dataset(titanic)] first"
                        + "\n  -  [dataset(titanic) > distribution(f.csv)] second");
    }
}
