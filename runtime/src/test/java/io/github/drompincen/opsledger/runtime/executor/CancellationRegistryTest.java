package io.github.drompincen.opsledger.runtime.executor;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CancellationRegistryTest {

    private final CancellationRegistry registry = new CancellationRegistry();

    @Test
    void registerIsIdempotentPerJob() {
        CancellationToken first = registry.register("job-1");

        assertThat(registry.register("job-1")).isSameAs(first);
        assertThat(registry.find("job-1")).containsSame(first);
    }

    @Test
    void cancelSignalsTokenAndKeepsFirstReason() {
        CancellationToken token = registry.register("job-1");

        assertThat(registry.cancel("job-1", "Cancelled by user")).isTrue();
        registry.cancel("job-1", "Schedule deactivated");

        assertThat(token.isCancelled()).isTrue();
        assertThat(token.getReason()).isEqualTo("Cancelled by user");
        assertThatThrownBy(token::throwIfCancelled)
                .isInstanceOf(CancellationException.class)
                .hasMessageContaining("job-1");
    }

    @Test
    void cancelOfUnknownJobReportsFalse() {
        assertThat(registry.cancel("ghost", "x")).isFalse();
    }

    @Test
    void bindingAfterCancelCancelsTheFuture() {
        CancellationToken token = registry.register("job-1");
        token.cancel("early");
        CompletableFuture<Void> action = new CompletableFuture<>();

        token.bind(action);

        assertThat(action.isCancelled()).isTrue();
    }

    @Test
    void cancelAllCountsOnlyRunningJobs() {
        registry.register("a");
        registry.register("b");
        registry.remove("b");

        assertThat(registry.cancelAll(List.of("a", "b", "c"), "Schedule deactivated")).isEqualTo(1);
        assertThat(registry.find("b")).isEmpty();
    }
}
