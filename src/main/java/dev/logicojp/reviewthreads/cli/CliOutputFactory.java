package dev.logicojp.reviewthreads.cli;

import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Named;
import jakarta.inject.Singleton;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/// Console streams of the review commands and the scaffolder.
///
/// Summaries and suggestion text are free-form markdown (file names and
/// reviewer comments in any language), so both streams always encode UTF-8
/// regardless of the platform default and flush on every line.
@Factory
class CliOutputFactory {

    @Bean
    @Singleton
    @Named("stdout")
    PrintStream stdout() {
        return utf8Lines(new FileOutputStream(FileDescriptor.out));
    }

    @Bean
    @Singleton
    @Named("stderr")
    PrintStream stderr() {
        return utf8Lines(new FileOutputStream(FileDescriptor.err));
    }

    static PrintStream utf8Lines(OutputStream target) {
        return new PrintStream(target, true, StandardCharsets.UTF_8);
    }
}
