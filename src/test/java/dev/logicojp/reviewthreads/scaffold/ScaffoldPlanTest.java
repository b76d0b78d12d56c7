package dev.logicojp.reviewthreads.scaffold;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ScaffoldPlan")
class ScaffoldPlanTest {

    @Test
    @DisplayName("ファイルを最上位フォルダごとに出現順でまとめる")
    void groupsFilesByTopLevelFolderInOrder() {
        ScaffoldPlan plan = ScaffoldPlan.of(1, List.of("utils/c.ts", "README.md", "src\\a.ts", "/utils/d.ts"));

        assertThat(plan.files()).containsExactly("/utils/c.ts", "/README.md", "/src/a.ts", "/utils/d.ts");
        assertThat(plan.folders().keySet()).containsExactly("utils", "root", "src");
        assertThat(plan.folders().get("utils")).containsExactly("/utils/c.ts", "/utils/d.ts");
        assertThat(plan.apiCallCount()).isEqualTo(4 + 3 + 1);
    }

    @Test
    @DisplayName("ファイルがなくても全体スレッドの1回は数える")
    void emptyPlanStillCountsOverallThread() {
        ScaffoldPlan plan = ScaffoldPlan.of(1, List.of());

        assertThat(plan.apiCallCount()).isEqualTo(1);
        List<String> lines = plan.describe();
        assertThat(lines.get(lines.size() - 1)).contains("Total API calls: 1");
    }
}
