package com.errorbuddy.service.dedup;

import com.errorbuddy.config.ReporterProperties;
import com.errorbuddy.model.ErrorReport;
import com.errorbuddy.model.FailureKind;
import com.errorbuddy.service.diagnostics.ReporterDiagnostics;
import com.errorbuddy.store.DedupStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Suppresses repeat reports of the same signature within the tracking window.
 * <p>
 * Both gates fail open: if the store misbehaves, the report is treated as new
 * rather than silently dropped. Expired entries are removed as they are met on
 * the read path, and the whole store is compacted on the write path once it
 * grows past {@code dedup.max-tracked-entries}, down to 90% of that cap.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DuplicateFilter {

    private final DedupStore store;
    private final SignatureGenerator signatureGenerator;
    private final ReporterProperties properties;
    private final ReporterDiagnostics diagnostics;
    private final Clock clock;

    public boolean isDuplicate(ErrorReport report) {
        return isDuplicate(signatureGenerator.signatureOf(report));
    }

    public boolean markReported(ErrorReport report) {
        return markReported(signatureGenerator.signatureOf(report));
    }

    public boolean isDuplicate(String signature) {
        try {
            Optional<Long> reportedAt = store.get(signature);
            if (reportedAt.isEmpty()) {
                return false;
            }

            long now = nowSeconds();
            if (now - reportedAt.get() < ttlSeconds()) {
                return true;
            }

            store.delete(signature);
            log.debug("Dropped expired signature {}", signature);
            return false;
        } catch (RuntimeException e) {
            diagnostics.record(FailureKind.STORAGE, "Duplicate check failed", e);
            return false;
        }
    }

    public boolean markReported(String signature) {
        try {
            long now = nowSeconds();
            store.set(signature, now);

            if (store.size() > maxTracked()) {
                int removed = compact(now);
                log.debug("Compacted dedup store, removed {} entries", removed);
            }
            return true;
        } catch (RuntimeException e) {
            diagnostics.record(FailureKind.STORAGE, "Mark reported failed for " + signature, e);
            return false;
        }
    }

    public boolean clearAll() {
        try {
            store.deleteAll();
            log.info("Cleared all tracked error signatures");
            return true;
        } catch (RuntimeException e) {
            diagnostics.record(FailureKind.STORAGE, "Clear tracked errors failed", e);
            return false;
        }
    }

    public int getCount() {
        try {
            return store.size();
        } catch (RuntimeException e) {
            diagnostics.record(FailureKind.STORAGE, "Tracked error count failed", e);
            return 0;
        }
    }

    /**
     * Drops expired entries, then the oldest survivors down to the low-water
     * mark, in a single store call.
     *
     * @return number of entries removed
     */
    int compact(long now) {
        long ttl = ttlSeconds();
        List<String> doomed = new ArrayList<>();
        List<Map.Entry<String, Long>> live = new ArrayList<>();

        for (Map.Entry<String, Long> entry : store.getAll().entrySet()) {
            if (now - entry.getValue() >= ttl) {
                doomed.add(entry.getKey());
            } else {
                live.add(entry);
            }
        }

        // Leave headroom so the following writes do not rescan the store
        int excess = live.size() - lowWaterMark();
        if (excess > 0) {
            live.sort(Map.Entry.comparingByValue());
            for (int i = 0; i < excess; i++) {
                doomed.add(live.get(i).getKey());
            }
        }

        if (!doomed.isEmpty()) {
            store.deleteAll(doomed);
        }
        return doomed.size();
    }

    int lowWaterMark() {
        int max = maxTracked();
        return Math.max(1, max - max / 10);
    }

    private long ttlSeconds() {
        return properties.getDedup().getTrackDurationSeconds();
    }

    private int maxTracked() {
        return Math.max(1, properties.getDedup().getMaxTrackedEntries());
    }

    private long nowSeconds() {
        return clock.instant().getEpochSecond();
    }
}
