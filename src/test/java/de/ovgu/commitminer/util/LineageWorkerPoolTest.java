package de.ovgu.commitminer.util;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests the class {@link LineageWorkerPool}.
 */
class LineageWorkerPoolTest {
    @Test
    void shouldProcessEachLineageInOrderOnItsOwnThread() throws UncaughtWorkerThreadException {
        final Map<Integer, List<Integer>> seenByLineage = new ConcurrentHashMap<>();
        final Map<Integer, String> threadByLineage = new ConcurrentHashMap<>();
        LineageWorkerPool<Integer, Integer> pool = new LineageWorkerPool<Integer, Integer>() {
            @Override
            protected Integer processItem(int lineageIndex, Integer item) {
                seenByLineage.computeIfAbsent(lineageIndex, k -> Collections.synchronizedList(new ArrayList<>())).add(item);
                String previous = threadByLineage.putIfAbsent(lineageIndex, Thread.currentThread().getName());
                if (previous != null && !previous.equals(Thread.currentThread().getName())) {
                    throw new IllegalStateException("Lineage " + lineageIndex + " changed threads");
                }
                return item * 10;
            }
        };
        List<Integer> results = new ArrayList<>();

        pool.processLineages(Arrays.asList(
                Arrays.asList(0, 3, 6),
                Arrays.asList(1, 4),
                Arrays.asList(2, 5)), results::add);

        assertThat(results).containsExactlyInAnyOrder(0, 10, 20, 30, 40, 50, 60);
        assertThat(seenByLineage.get(0)).containsExactly(0, 3, 6);
        assertThat(seenByLineage.get(1)).containsExactly(1, 4);
        assertThat(seenByLineage.get(2)).containsExactly(2, 5);
        assertThat(threadByLineage.values()).doesNotHaveDuplicates();
    }

    @Test
    void shouldReportDeadWorker() {
        LineageWorkerPool<Integer, Integer> pool = new LineageWorkerPool<Integer, Integer>() {
            @Override
            protected Integer processItem(int lineageIndex, Integer item) {
                if (item == 2) {
                    throw new IllegalStateException("boom");
                }
                return item;
            }
        };

        assertThatExceptionOfType(UncaughtWorkerThreadException.class).isThrownBy(() ->
                pool.processLineages(Arrays.asList(Arrays.asList(1, 2, 3), Arrays.asList(4)), r -> {
                })).withMessageContaining("lineage-worker-0").withCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldStopDispatchingAfterTerminationRequest() throws UncaughtWorkerThreadException {
        final AtomicReference<LineageWorkerPool<Integer, Integer>> self = new AtomicReference<>();
        LineageWorkerPool<Integer, Integer> pool = new LineageWorkerPool<Integer, Integer>() {
            @Override
            protected Integer processItem(int lineageIndex, Integer item) {
                self.get().requestTermination();
                return item;
            }
        };
        self.set(pool);
        List<Integer> results = new ArrayList<>();

        pool.processLineages(Collections.singletonList(Arrays.asList(1, 2, 3)), results::add);

        assertThat(results).containsExactly(1);
        assertThat(pool.isTerminationRequested()).isTrue();
    }

    @Test
    void shouldDoNothingWithoutLineages() throws UncaughtWorkerThreadException {
        LineageWorkerPool<Integer, Integer> pool = new LineageWorkerPool<Integer, Integer>() {
            @Override
            protected Integer processItem(int lineageIndex, Integer item) {
                throw new AssertionError("unexpected");
            }
        };
        List<Integer> results = new ArrayList<>();

        pool.processLineages(Collections.emptyList(), results::add);

        assertThat(results).isEmpty();
    }
}
