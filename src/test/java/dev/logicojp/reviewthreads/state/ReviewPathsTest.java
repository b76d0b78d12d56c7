package dev.logicojp.reviewthreads.state;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ReviewPaths")
class ReviewPathsTest {

    @Test
    @DisplayName("先頭のスラッシュを補完する")
    void prependsLeadingSlash() {
        assertThat(ReviewPaths.normalize("src/a.ts")).isEqualTo("/src/a.ts");
        assertThat(ReviewPaths.normalize("/src/a.ts")).isEqualTo("/src/a.ts");
    }

    @Test
    @DisplayName("バックスラッシュをスラッシュに変換する")
    void convertsBackslashes() {
        assertThat(ReviewPaths.normalize("a\\b.txt")).isEqualTo("/a/b.txt");
        assertThat(ReviewPaths.topLevelFolder("a\\b.txt")).isEqualTo("a");
    }

    @Test
    @DisplayName("ルート直下のファイルと空のパスはrootフォルダになる")
    void rootLevelFilesBelongToRootFolder() {
        assertThat(ReviewPaths.topLevelFolder("/README.md")).isEqualTo(ReviewPaths.ROOT_FOLDER);
        assertThat(ReviewPaths.topLevelFolder("")).isEqualTo(ReviewPaths.ROOT_FOLDER);
        assertThat(ReviewPaths.topLevelFolder("src/deep/nested/file.java")).isEqualTo("src");
    }

    @Test
    @DisplayName("ファイル名は最後のセグメント")
    void fileNameIsLastSegment() {
        assertThat(ReviewPaths.fileName("/src/deep/file.java")).isEqualTo("file.java");
        assertThat(ReviewPaths.fileName("README.md")).isEqualTo("README.md");
    }

    @Test
    @DisplayName("空のパスは正規化できない")
    void blankPathCannotBeNormalized() {
        assertThatThrownBy(() -> ReviewPaths.normalize(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
