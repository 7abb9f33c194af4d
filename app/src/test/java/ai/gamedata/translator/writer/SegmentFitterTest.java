package ai.gamedata.translator.writer;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SegmentFitterTest {

    @Test
    void keepsMatchingLineCount() {
        FitResult result = new SegmentFitter(SegmentOverflowPolicy.MERGE_INTO_LAST).fit("One\nTwo", 2);

        assertThat(result.lines()).containsExactly("One", "Two");
        assertThat(result.refitted()).isFalse();
    }

    @Test
    void padsShortTranslationsWithEmptyLines() {
        FitResult result = new SegmentFitter(SegmentOverflowPolicy.MERGE_INTO_LAST).fit("Only one", 3);

        assertThat(result.lines()).containsExactly("Only one", "", "");
        assertThat(result.padded()).isTrue();
        assertThat(result.refitted()).isTrue();
    }

    @Test
    void mergesExcessLinesIntoTheLastSegment() {
        FitResult result = new SegmentFitter(SegmentOverflowPolicy.MERGE_INTO_LAST).fit("A\nB\nC\nD", 2);

        assertThat(result.lines()).containsExactly("A", "B C D");
        assertThat(result.merged()).isTrue();
        assertThat(result.extraLines()).isZero();
    }

    @Test
    void keepsExcessLinesWhenCommandsMayBeInserted() {
        FitResult result = new SegmentFitter(SegmentOverflowPolicy.INSERT_COMMANDS).fit("A\nB\nC", 1);

        assertThat(result.lines()).containsExactly("A", "B", "C");
        assertThat(result.extraLines()).isEqualTo(2);
        assertThat(result.merged()).isFalse();
    }

    @Test
    void parsesPolicyNames() {
        assertThat(SegmentOverflowPolicy.from("insert")).isEqualTo(SegmentOverflowPolicy.INSERT_COMMANDS);
        assertThat(SegmentOverflowPolicy.from(" Merge-Into-Last ")).isEqualTo(SegmentOverflowPolicy.MERGE_INTO_LAST);
        assertThat(SegmentOverflowPolicy.from(null)).isEqualTo(SegmentOverflowPolicy.MERGE_INTO_LAST);
    }
}
