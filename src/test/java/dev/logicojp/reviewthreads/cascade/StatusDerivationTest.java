package dev.logicojp.reviewthreads.cascade;

import dev.logicojp.reviewthreads.state.ReviewEntryNotFoundException;
import dev.logicojp.reviewthreads.state.ReviewState;
import dev.logicojp.reviewthreads.state.ReviewStateFixtures;
import dev.logicojp.reviewthreads.state.ReviewStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static dev.logicojp.reviewthreads.state.ReviewStatus.APPROVED;
import static dev.logicojp.reviewthreads.state.ReviewStatus.IN_PROGRESS;
import static dev.logicojp.reviewthreads.state.ReviewStatus.NEEDS_WORK;
import static dev.logicojp.reviewthreads.state.ReviewStatus.UNREVIEWED;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("StatusDerivation")
class StatusDerivationTest {

    @Nested
    @DisplayName("aggregate")
    class Aggregate {

        @Test
        @DisplayName("子がない、または全て未レビューならunreviewed")
        void emptyOrAllUnreviewed() {
            assertThat(StatusDerivation.aggregate(List.of())).isEqualTo(UNREVIEWED);
            assertThat(StatusDerivation.aggregate(List.of(UNREVIEWED, UNREVIEWED))).isEqualTo(UNREVIEWED);
        }

        @Test
        @DisplayName("着手済みだが全て終端でなければin-progress")
        void startedButNotFinished() {
            assertThat(StatusDerivation.aggregate(List.of(UNREVIEWED, APPROVED))).isEqualTo(IN_PROGRESS);
            assertThat(StatusDerivation.aggregate(List.of(NEEDS_WORK, IN_PROGRESS))).isEqualTo(IN_PROGRESS);
        }

        @Test
        @DisplayName("全て終端でneeds-workを含めばneeds-work")
        void allTerminalWithNeedsWork() {
            assertThat(StatusDerivation.aggregate(List.of(APPROVED, NEEDS_WORK))).isEqualTo(NEEDS_WORK);
        }

        @Test
        @DisplayName("全て承認済みならapproved")
        void allApproved() {
            assertThat(StatusDerivation.aggregate(List.of(APPROVED, APPROVED))).isEqualTo(APPROVED);
        }
    }

    @Test
    @DisplayName("フォルダのステータスは配下のファイルから導出され、何度呼んでも同じ")
    void folderStatusIsDerivedFromFiles() {
        ReviewState state = ReviewStateFixtures.scaffolded("/src/a.ts", "/src/b.ts", "/utils/c.ts");
        state.getFiles().get("/src/a.ts").setStatus(APPROVED);

        assertThat(StatusDerivation.deriveFolderStatus(state, "src")).isEqualTo(IN_PROGRESS);
        assertThat(StatusDerivation.deriveFolderStatus(state, "src")).isEqualTo(IN_PROGRESS);
        assertThat(StatusDerivation.deriveFolderStatus(state, "utils")).isEqualTo(UNREVIEWED);
        assertThat(state.getFolders().get("src").getStatus()).isEqualTo(UNREVIEWED);
    }

    @Test
    @DisplayName("未登録のフォルダはReviewEntryNotFoundExceptionになる")
    void unknownFolderIsNotFound() {
        ReviewState state = ReviewStateFixtures.scaffolded("/src/a.ts");

        assertThatThrownBy(() -> StatusDerivation.deriveFolderStatus(state, "docs"))
            .isInstanceOf(ReviewEntryNotFoundException.class);
    }

    @Test
    @DisplayName("全体のステータスはフォルダのステータスのみから導出される")
    void overallStatusUsesFolderStatusesOnly() {
        ReviewState state = ReviewStateFixtures.scaffolded("/src/a.ts", "/utils/c.ts");
        state.getFiles().get("/src/a.ts").setStatus(NEEDS_WORK);
        assertThat(StatusDerivation.deriveOverallStatus(state)).isEqualTo(UNREVIEWED);

        state.getFolders().get("src").setStatus(APPROVED);
        state.getFolders().get("utils").setStatus(IN_PROGRESS);
        assertThat(StatusDerivation.deriveOverallStatus(state)).isEqualTo(IN_PROGRESS);
    }

    @Test
    @DisplayName("フォルダがない状態はunreviewed")
    void noFoldersIsUnreviewed() {
        ReviewState state = new ReviewState(1, "r", "repo", "p", "https://dev.azure.com/o", 1, "t");

        assertThat(StatusDerivation.deriveOverallStatus(state)).isEqualTo(ReviewStatus.UNREVIEWED);
    }
}
