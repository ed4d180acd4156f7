package io.github.byzatic.jobscheduler.engine;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Result of restoring jobs from a store at startup.
 */
public final class RestoreReport {
    public final List<String> restored;
    /**
     * Job id (or its position in the store listing when it has none) to failure description.
     */
    public final Map<String, String> failed;
    /**
     * Set when the store could not be listed at all.
     */
    public final String listingError;

    RestoreReport(List<String> restored, Map<String, String> failed, @Nullable String listingError) {
        this.restored = List.copyOf(restored);
        this.failed = Map.copyOf(failed);
        this.listingError = listingError;
    }

    public boolean hasFailures() {
        return listingError != null || !failed.isEmpty();
    }

    @Override
    public String toString() {
        return "RestoreReport{restored=" + restored.size() + ", failed=" + failed +
                (listingError != null ? ", listingError='" + listingError + '\'' : "") + '}';
    }
}
