package org.semantic.term;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Deferred} and {@link Subterm}.
 */
@Tag("unit")
class DeferredTest {

    @Test
    void computationRunsOnceAcrossForces() {
        AtomicInteger runs = new AtomicInteger();
        Deferred<Integer> deferred = Deferred.of(runs::incrementAndGet);

        assertThat(deferred.isForced()).isFalse();
        assertThat(deferred.get()).isEqualTo(1);
        assertThat(deferred.get()).isEqualTo(1);
        assertThat(runs).hasValue(1);
        assertThat(deferred.isForced()).isTrue();
    }

    @Test
    void failedComputationIsRetried() {
        AtomicInteger runs = new AtomicInteger();
        Deferred<String> deferred = Deferred.of(() -> {
            if (runs.incrementAndGet() == 1) {
                throw new IllegalStateException("first attempt");
            }
            return "ok";
        });

        assertThatThrownBy(deferred::get).isInstanceOf(IllegalStateException.class);
        assertThat(deferred.isForced()).isFalse();
        assertThat(deferred.get()).isEqualTo("ok");
        assertThat(runs).hasValue(2);
    }

    @Test
    void nowIsAlreadyForced() {
        Deferred<String> deferred = Deferred.now("known");

        assertThat(deferred.isForced()).isTrue();
        assertThat(deferred.get()).isEqualTo("known");
    }

    @Test
    void subtermEvaluatesItsTermOnce() {
        AtomicInteger evaluations = new AtomicInteger();
        Subterm<String, Integer> subterm = Subterm.of("x + 1", () -> evaluations.incrementAndGet() * 10);

        assertThat(subterm.isEvaluated()).isFalse();
        assertThat(subterm.value()).isEqualTo(10);
        assertThat(subterm.value()).isEqualTo(10);
        assertThat(evaluations).hasValue(1);
        assertThat(subterm.term()).isEqualTo("x + 1");
    }
}
