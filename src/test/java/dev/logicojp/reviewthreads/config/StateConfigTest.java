package dev.logicojp.reviewthreads.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StateConfig")
class StateConfigTest {

    @Test
    @DisplayName("ディレクトリ未指定ではデフォルトを使う")
    void defaultsDirectory() {
        assertThat(new StateConfig(null).directory()).isEqualTo(StateConfig.DEFAULT_DIRECTORY);
        assertThat(new StateConfig().stateFile(7))
            .isEqualTo(Path.of(".review-state", "pull-request-review", "prompts", "7", "review-state.json"));
    }

    @Test
    @DisplayName("指定ディレクトリの下にPRごとの状態ファイルを置く")
    void stateFileIsKeyedByPrId() {
        assertThat(new StateConfig("/tmp/review").stateFile(42))
            .isEqualTo(Path.of("/tmp/review", "pull-request-review", "prompts", "42", "review-state.json"));
    }
}
