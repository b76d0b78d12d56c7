package dev.logicojp.reviewthreads.cascade;

import dev.logicojp.reviewthreads.devops.PullRequestRef;
import dev.logicojp.reviewthreads.devops.RecordingThreadClient;
import dev.logicojp.reviewthreads.devops.RecordingThreadClient.Kind;
import dev.logicojp.reviewthreads.devops.ThreadStatus;
import dev.logicojp.reviewthreads.state.ReviewEntryNotFoundException;
import dev.logicojp.reviewthreads.state.ReviewState;
import dev.logicojp.reviewthreads.state.ReviewStateFixtures;
import dev.logicojp.reviewthreads.state.ReviewStateOperations;
import dev.logicojp.reviewthreads.state.ReviewStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static dev.logicojp.reviewthreads.state.ReviewStateFixtures.BASE_URL;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("StatusCascade")
class StatusCascadeTest {

    @Test
    @DisplayName("approvedだけがスレッドをclosedにする")
    void onlyApprovedClosesThreads() {
        assertThat(StatusCascade.threadStatusFor(ReviewStatus.APPROVED)).isEqualTo(ThreadStatus.CLOSED);
        assertThat(StatusCascade.threadStatusFor(ReviewStatus.NEEDS_WORK)).isEqualTo(ThreadStatus.ACTIVE);
        assertThat(StatusCascade.threadStatusFor(ReviewStatus.IN_PROGRESS)).isEqualTo(ThreadStatus.ACTIVE);
        assertThat(StatusCascade.threadStatusFor(ReviewStatus.UNREVIEWED)).isEqualTo(ThreadStatus.ACTIVE);
    }

    @Nested
    @DisplayName("cascadeStatusUpdate")
    class CascadeStatusUpdate {

        @Test
        @DisplayName("単一ファイルがneeds-workならフォルダと全体もneeds-workでactive")
        void singleNeedsWorkFile() {
            ReviewState state = ReviewStateFixtures.scaffolded("/src/a.ts");
            ReviewStateOperations.updateFileStatus(state, "/src/a.ts", ReviewStatus.NEEDS_WORK);

            List<PatchOperation> operations = StatusCascade.cascadeStatusUpdate(state, "src/a.ts", BASE_URL);

            assertThat(operations).hasSize(2);
            assertThat(operations.get(0).threadId()).isEqualTo(101);
            assertThat(operations.get(0).threadStatus()).isEqualTo(ThreadStatus.ACTIVE);
            assertThat(operations.get(0).newContent()).startsWith("## Folder Review Summary: src")
                .contains("*Status:* Needs Work");
            assertThat(operations.get(1).threadId()).isEqualTo(999);
            assertThat(operations.get(1).threadStatus()).isEqualTo(ThreadStatus.ACTIVE);
            assertThat(operations.get(1).newContent()).startsWith("## Overall PR Review Summary")
                .contains("*Status:* Needs Work");
            assertThat(state.getFolders().get("src").getStatus()).isEqualTo(ReviewStatus.NEEDS_WORK);
            assertThat(state.getOverallSummary().getStatus()).isEqualTo(ReviewStatus.NEEDS_WORK);
        }

        @Test
        @DisplayName("承認済みとレビュー中のフォルダがあれば全体はin-progress")
        void approvedAndInProgressFolders() {
            ReviewState state = ReviewStateFixtures.scaffolded("/src/a.ts", "/utils/c.ts", "/utils/d.ts");
            ReviewStateOperations.updateFileStatus(state, "/src/a.ts", ReviewStatus.APPROVED);
            StatusCascade.cascadeStatusUpdate(state, "/src/a.ts", BASE_URL);
            ReviewStateOperations.updateFileStatus(state, "/utils/c.ts", ReviewStatus.APPROVED);

            List<PatchOperation> operations = StatusCascade.cascadeStatusUpdate(state, "/utils/c.ts", BASE_URL);

            assertThat(state.getFolders().get("src").getStatus()).isEqualTo(ReviewStatus.APPROVED);
            assertThat(state.getFolders().get("utils").getStatus()).isEqualTo(ReviewStatus.IN_PROGRESS);
            assertThat(state.getOverallSummary().getStatus()).isEqualTo(ReviewStatus.IN_PROGRESS);
            assertThat(operations).extracting(PatchOperation::threadStatus)
                .containsExactly(ThreadStatus.ACTIVE, ThreadStatus.ACTIVE);
        }

        @Test
        @DisplayName("needs-workとレビュー中のファイルが混在するとフォルダはIn Progressと表示しNeeds Work欄も出す")
        void needsWorkMixedWithInProgressRendersInProgressStatus() {
            ReviewState state = ReviewStateFixtures.scaffolded("/src/a.ts", "/src/b.ts");
            ReviewStateOperations.updateFileStatus(state, "/src/a.ts", ReviewStatus.NEEDS_WORK);
            ReviewStateOperations.updateFileStatus(state, "/src/b.ts", ReviewStatus.IN_PROGRESS);

            List<PatchOperation> operations = StatusCascade.cascadeStatusUpdate(state, "/src/b.ts", BASE_URL);

            String folderContent = operations.get(0).newContent();
            assertThat(folderContent).contains("*Status:* In Progress")
                .doesNotContain("*Status:* Needs Work")
                .contains("### Needs Work");
            assertThat(folderContent.substring(folderContent.indexOf("### Needs Work")))
                .contains("[/src/a.ts](");
            assertThat(operations.get(1).newContent()).contains("*Status:* In Progress");
            assertThat(state.getFolders().get("src").getStatus()).isEqualTo(ReviewStatus.IN_PROGRESS);
        }

        @Test
        @DisplayName("全フォルダが承認済みなら全体はapprovedでclosed")
        void allFoldersApproved() {
            ReviewState state = ReviewStateFixtures.scaffolded("/src/a.ts", "/utils/c.ts");
            ReviewStateOperations.updateFileStatus(state, "/src/a.ts", ReviewStatus.APPROVED);
            StatusCascade.cascadeStatusUpdate(state, "/src/a.ts", BASE_URL);
            ReviewStateOperations.updateFileStatus(state, "/utils/c.ts", ReviewStatus.APPROVED);

            List<PatchOperation> operations = StatusCascade.cascadeStatusUpdate(state, "/utils/c.ts", BASE_URL);

            assertThat(state.getOverallSummary().getStatus()).isEqualTo(ReviewStatus.APPROVED);
            assertThat(operations).extracting(PatchOperation::threadStatus)
                .containsExactly(ThreadStatus.CLOSED, ThreadStatus.CLOSED);
        }

        @Test
        @DisplayName("未登録のファイルはReviewEntryNotFoundExceptionになる")
        void unknownFileIsNotFound() {
            ReviewState state = ReviewStateFixtures.scaffolded("/src/a.ts");

            assertThatThrownBy(() -> StatusCascade.cascadeStatusUpdate(state, "/src/zzz.ts", BASE_URL))
                .isInstanceOf(ReviewEntryNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("executeCascade")
    class ExecuteCascade {

        @Test
        @DisplayName("各操作についてコメント更新の後にスレッドステータスを更新する")
        void patchesContentThenStatusPerOperation() {
            RecordingThreadClient client = new RecordingThreadClient();
            List<PatchOperation> operations = List.of(
                new PatchOperation(101, 1, "folder", ThreadStatus.ACTIVE),
                new PatchOperation(999, 1, "overall", ThreadStatus.CLOSED));

            StatusCascade.executeCascade(operations, client, new PullRequestRef("repo", 42), true);

            assertThat(client.calls()).extracting(RecordingThreadClient.Call::kind)
                .containsExactly(Kind.PATCH_COMMENT, Kind.PATCH_STATUS, Kind.PATCH_COMMENT, Kind.PATCH_STATUS);
            assertThat(client.calls()).extracting(RecordingThreadClient.Call::threadId)
                .containsExactly(101L, 101L, 999L, 999L);
            assertThat(client.calls()).allMatch(RecordingThreadClient.Call::dryRun);
            assertThat(client.calls().get(3).status()).isEqualTo(ThreadStatus.CLOSED);
        }
    }
}
