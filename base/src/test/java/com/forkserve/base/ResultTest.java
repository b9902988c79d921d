package com.forkserve.base;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultTest {

    @Test
    void ofCapturesCheckedExceptions() {
        Result<String> result = Result.of(() -> {
            throw new IOException("disk gone");
        });

        assertThat(result.isFailure()).isTrue();
        assertThat(result.error()).get().isInstanceOf(IOException.class);
        assertThat(result.getOrElse("fallback")).isEqualTo("fallback");
    }

    @Test
    void nullValueIsAFailure() {
        Result<Object> result = Result.of(() -> null);
        assertThat(result.isFailure()).isTrue();
    }

    @Test
    void mapAndFlatMapChainOnSuccess() {
        Result<Integer> result = Result.success("21")
                .map(Integer::parseInt)
                .flatMap(n -> Result.success(n * 2));

        assertThat(result.getOrThrow()).isEqualTo(42);
    }

    @Test
    void mapCatchesExceptionsFromTheFunction() {
        Result<Integer> result = Result.success("not a number").map(Integer::parseInt);
        assertThat(result.error()).get().isInstanceOf(NumberFormatException.class);
    }

    @Test
    void getOrThrowWrapsCheckedCauses() {
        Result<String> result = Result.failure(new IOException("boom"));
        assertThatThrownBy(result::getOrThrow)
                .isInstanceOf(RuntimeException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void runReportsFailureWithoutThrowing() {
        Result<Boolean> result = Result.run(() -> {
            throw new IllegalStateException("closed");
        });
        assertThat(result.isFailure()).isTrue();
        assertThat(Result.run(() -> { }).isSuccess()).isTrue();
    }

    @Test
    void callbacksSeeOnlyTheirBranch() {
        StringBuilder seen = new StringBuilder();
        Result.success("ok").onSuccess(seen::append).onFailure(e -> seen.append("!"));
        Result.<String>failure(new IOException("x")).onSuccess(seen::append).onFailure(e -> seen.append(e.getMessage()));

        assertThat(seen).hasToString("okx");
    }
}
