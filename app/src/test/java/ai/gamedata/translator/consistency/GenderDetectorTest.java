package ai.gamedata.translator.consistency;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class GenderDetectorTest {

    private final GenderDetector detector = new GenderDetector();

    @Test
    void detectsFromJapaneseKeywords() {
        assertThat(detector.detect("村の少年。", "勇者", "")).isEqualTo(Gender.MALE);
        assertThat(detector.detect("王女。", "", null)).isEqualTo(Gender.FEMALE);
        assertThat(detector.detect("彼女は魔法使いだ。")).isEqualTo(Gender.FEMALE);
    }

    @Test
    void englishKeywordsMatchWholeWordsOnly() {
        assertThat(detector.detect("A young woman from the capital.")).isEqualTo(Gender.FEMALE);
        assertThat(detector.detect("<gender:female>")).isEqualTo(Gender.FEMALE);
        assertThat(detector.detect("A knight of the realm.")).isEqualTo(Gender.MALE);
    }

    @Test
    void tiesAndMissingKeywordsAreUnknown() {
        assertThat(detector.detect("旅の商人。")).isEqualTo(Gender.UNKNOWN);
        assertThat(detector.detect("兄と姉がいる。")).isEqualTo(Gender.UNKNOWN);
        assertThat(detector.detect()).isEqualTo(Gender.UNKNOWN);
    }
}
