package de.ovgu.commitminer.cache;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests the classes {@link ContentCache} and {@link CacheEntry}.
 */
class ContentCacheTest {
    private static final FileFingerprint FP_A = FileFingerprint.of("a".getBytes(StandardCharsets.UTF_8));
    private static final FileFingerprint FP_B = FileFingerprint.of("b".getBytes(StandardCharsets.UTF_8));

    @Test
    void shouldCountHitsAndMisses() {
        ContentCache cache = new ContentCache();

        assertThat(cache.lookup(FP_A)).isEmpty();
        cache.store(FP_A, CacheEntry.NO_VIOLATIONS);
        assertThat(cache.lookup(FP_A)).contains(CacheEntry.NO_VIOLATIONS);

        assertThat(cache.getHits()).isEqualTo(1);
        assertThat(cache.getMisses()).isEqualTo(1);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void shouldKeepFirstEntryForFingerprint() {
        ContentCache cache = new ContentCache();
        CacheEntry first = new CacheEntry(Collections.singletonMap("UnusedLocalVariable", 2));
        CacheEntry second = new CacheEntry(Collections.singletonMap("UnusedLocalVariable", 3));

        assertThat(cache.store(FP_A, first)).isSameAs(first);
        assertThat(cache.store(FP_A, second)).isSameAs(first);
        assertThat(cache.getModificationCount()).isEqualTo(1);
    }

    @Test
    void shouldRestoreSnapshotSkippingInvalidKeys() {
        ContentCache cache = new ContentCache();
        cache.store(FP_A, new CacheEntry(Collections.singletonMap("EmptyCatchBlock", 1)));
        Map<String, CacheEntry> snapshot = new HashMap<>(cache.snapshot());
        snapshot.put("garbage", CacheEntry.NO_VIOLATIONS);
        snapshot.put(FP_B.toHex(), CacheEntry.NO_VIOLATIONS);

        ContentCache restored = new ContentCache();
        restored.restore(snapshot);

        assertThat(restored.size()).isEqualTo(2);
        assertThat(restored.lookup(FP_A).get().getViolationCount()).isEqualTo(1);
        assertThat(restored.snapshot()).containsOnlyKeys(FP_A.toHex(), FP_B.toHex());
    }

    @Test
    void shouldDropZeroCountsAndSumViolations() {
        Map<String, Integer> counts = new HashMap<>();
        counts.put("A", 2);
        counts.put("B", 0);
        counts.put("C", 3);

        CacheEntry entry = new CacheEntry(counts);

        assertThat(entry.getViolationsByRule()).containsOnlyKeys("A", "C");
        assertThat(entry.getViolationCount()).isEqualTo(5);
        assertThat(entry.getFileCount()).isEqualTo(1);
        counts.remove("B");
        assertThat(entry).isEqualTo(new CacheEntry(counts));
    }

    @Test
    void shouldRejectNegativeCounts() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> new CacheEntry(Collections.singletonMap("A", -1)))
                .withMessageContaining("A");
    }

    @Test
    void shouldAgreeOnOneEntryPerFingerprintUnderConcurrentAccess() throws Exception {
        final int threads = 8;
        final int contents = 200;
        final ContentCache cache = new ContentCache();
        final CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        List<Future<List<CacheEntry>>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    List<CacheEntry> seen = new ArrayList<>(contents);
                    for (int i = 0; i < contents; i++) {
                        FileFingerprint fp = FileFingerprint.of(("class C" + i + " {}").getBytes(StandardCharsets.UTF_8));
                        Optional<CacheEntry> hit = cache.lookup(fp);
                        if (hit.isPresent()) {
                            seen.add(hit.get());
                        } else {
                            seen.add(cache.store(fp, new CacheEntry(Collections.singletonMap("TodoComment", i % 5 + 1))));
                        }
                    }
                    return seen;
                }));
            }
            start.countDown();

            List<CacheEntry> first = futures.get(0).get(30, TimeUnit.SECONDS);
            for (Future<List<CacheEntry>> f : futures) {
                List<CacheEntry> seen = f.get(30, TimeUnit.SECONDS);
                for (int i = 0; i < contents; i++) {
                    assertThat(seen.get(i)).isSameAs(first.get(i));
                    assertThat(seen.get(i).getViolationCount()).isEqualTo(i % 5 + 1);
                }
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(cache.size()).isEqualTo(contents);
        assertThat(cache.getModificationCount()).isEqualTo(contents);
        assertThat(cache.getHits() + cache.getMisses()).isEqualTo((long) threads * contents);
    }
}
