package com.syntharb.tracker;

import com.syntharb.domain.model.SyntheticPosition;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable view of every tracked position at one mutation version.
 *
 * <p>The tracker swaps in a new snapshot after each mutation. Readers (metrics, risk
 * evaluation, queries) work against a snapshot and never take the tracker lock.
 * Positions inside a snapshot are private copies and must not be modified.
 */
public final class PositionSnapshot {

    static final PositionSnapshot EMPTY = new PositionSnapshot(0L, new LinkedHashMap<>());

    private final long version;
    private final Map<String, SyntheticPosition> positions;

    PositionSnapshot(long version, LinkedHashMap<String, SyntheticPosition> positions) {
        this.version = version;
        this.positions = Collections.unmodifiableMap(positions);
    }

    /** Tracker mutation counter when this snapshot was taken. */
    public long getVersion() {
        return version;
    }

    /** Positions in creation order. */
    public List<SyntheticPosition> getPositions() {
        return List.copyOf(positions.values());
    }

    /** Positions newest first. */
    public List<SyntheticPosition> getPositionsNewestFirst() {
        List<SyntheticPosition> newestFirst = new ArrayList<>(positions.values());
        Collections.reverse(newestFirst);
        return newestFirst;
    }

    public SyntheticPosition get(String positionId) {
        return positions.get(positionId);
    }

    public int size() {
        return positions.size();
    }

    PositionSnapshot with(long nextVersion, SyntheticPosition position) {
        LinkedHashMap<String, SyntheticPosition> next = new LinkedHashMap<>(positions);
        next.put(position.getId(), position);
        return new PositionSnapshot(nextVersion, next);
    }
}
