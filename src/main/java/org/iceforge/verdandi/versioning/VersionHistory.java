package org.iceforge.verdandi.versioning;

import org.iceforge.verdandi.storj.s3.StorjModels.VersionEntry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Ordering rules for a key's version history.
 * <p>
 * Entries are ordered by last-modified, newest first. An entry without a timestamp counts as the epoch,
 * so it lands at the end. The sort is stable: entries with equal timestamps keep the order the store
 * listed them in (versions before delete markers). Callers must not rely on that tie-break.
 */
public final class VersionHistory {

    public static final Comparator<VersionEntry> NEWEST_FIRST =
            Comparator.comparing(VersionHistory::timestampOf).reversed();

    private VersionHistory() {}

    public static List<VersionEntry> merge(List<VersionEntry> versions, List<VersionEntry> deleteMarkers) {
        List<VersionEntry> all = new ArrayList<>(
                (versions == null ? 0 : versions.size()) + (deleteMarkers == null ? 0 : deleteMarkers.size()));
        if (versions != null) all.addAll(versions);
        if (deleteMarkers != null) all.addAll(deleteMarkers);
        all.sort(NEWEST_FIRST);
        return all;
    }

    /**
     * The delete marker an undelete should remove: the newest marker whose key equals {@code key}.
     * Prefix listings also return longer keys ("a.txt" lists "a.txt.bak"), hence the exact match.
     */
    public static Optional<VersionEntry> latestDeleteMarker(String key, List<VersionEntry> history) {
        return history.stream()
                .filter(VersionEntry::deleteMarker)
                .filter(e -> key.equals(e.key()))
                .sorted(NEWEST_FIRST)
                .findFirst();
    }

    private static Instant timestampOf(VersionEntry e) {
        return e.lastModified() == null ? Instant.EPOCH : e.lastModified();
    }
}
