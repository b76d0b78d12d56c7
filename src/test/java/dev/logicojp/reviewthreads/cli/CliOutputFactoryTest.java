package dev.logicojp.reviewthreads.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CliOutputFactory")
class CliOutputFactoryTest {

    @Test
    @DisplayName("出力ストリームはUTF-8で書き込み行ごとにフラッシュする")
    void writesUtf8AndFlushesPerLine() {
        ByteArrayOutputStream target = new ByteArrayOutputStream();
        PrintStream stream = CliOutputFactory.utf8Lines(target);

        stream.println("  /src/レビュー.ts: needs-work (1 suggestion(s))");

        assertThat(target.toString(StandardCharsets.UTF_8))
            .isEqualTo("  /src/レビュー.ts: needs-work (1 suggestion(s))" + System.lineSeparator());
    }
}
