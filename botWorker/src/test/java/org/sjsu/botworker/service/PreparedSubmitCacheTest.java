package org.sjsu.botworker.service;

import org.junit.jupiter.api.Test;
import org.sjsu.botworker.exception.PreparedSubmitNotFoundException;
import org.sjsu.botworker.model.Submission;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PreparedSubmitCacheTest {

    private final PreparedSubmitCache cache = new PreparedSubmitCache();

    @Test
    void shouldStripPageClassBeforeStoring() {
        Map<String, Object> postData = Map.of("amount", 12, "note", "x");

        Optional<Submission> stored = cache.prepareIfAbsent("p1",
                () -> new Submission("Contribute", postData, Map.of("must_fail", false)));

        assertThat(stored).isPresent();
        assertThat(stored.get().getPageClass()).isNull();
        assertThat(stored.get().getPostData()).isEqualTo(postData);
        assertThat(stored.get().getAttributes()).containsEntry("must_fail", false);
        assertThat(cache.peek("p1")).isEqualTo(stored);
    }

    @Test
    void shouldNotComputeWhenAlreadyPrepared() {
        AtomicInteger computed = new AtomicInteger();
        cache.prepareIfAbsent("p1", () -> {
            computed.incrementAndGet();
            return Submission.of("A", Map.of("n", 1));
        });

        Optional<Submission> second = cache.prepareIfAbsent("p1", () -> {
            computed.incrementAndGet();
            return Submission.of("B", Map.of("n", 2));
        });

        assertThat(second).isEmpty();
        assertThat(computed).hasValue(1);
        assertThat(cache.consume("p1").getPostData()).containsEntry("n", 1);
    }

    @Test
    void shouldComputeOnceUnderConcurrentDuplicates() throws Exception {
        AtomicInteger computed = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Optional<Submission>>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return cache.prepareIfAbsent("p1", () -> {
                        computed.incrementAndGet();
                        return Submission.of("A", Map.of());
                    });
                }));
            }
            start.countDown();
            int stored = 0;
            for (Future<Optional<Submission>> result : results) {
                if (result.get(5, TimeUnit.SECONDS).isPresent()) {
                    stored++;
                }
            }
            assertThat(stored).isEqualTo(1);
            assertThat(computed).hasValue(1);
            assertThat(cache.size()).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void shouldRemoveEntryOnConsume() {
        cache.prepareIfAbsent("p1", Submission::empty);

        assertThat(cache.consume("p1").isEmpty()).isTrue();
        assertThatThrownBy(() -> cache.consume("p1"))
                .isInstanceOf(PreparedSubmitNotFoundException.class)
                .hasMessageContaining("p1");
    }

    @Test
    void shouldRemoveSelectedAndAllEntries() {
        cache.prepareIfAbsent("p1", Submission::empty);
        cache.prepareIfAbsent("p2", Submission::empty);
        cache.prepareIfAbsent("p3", Submission::empty);

        cache.removeAll(List.of("p1", "p3"));
        assertThat(cache.peek("p2")).isPresent();
        assertThat(cache.size()).isEqualTo(1);

        cache.clear();
        assertThat(cache.size()).isZero();
    }
}
