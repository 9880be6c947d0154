package org.tactica.runtime.model;

import org.tactica.runtime.spatial.GridPosition;

/**
 * Where a squad stands and which faction owns it. Attached to the squad entity.
 */
public class MapPosition {

    private final long squadId;
    private final long factionId;
    private GridPosition position;

    public MapPosition(long squadId, long factionId, GridPosition position) {
        this.squadId = squadId;
        this.factionId = factionId;
        this.position = position;
    }

    public long getSquadId() {
        return squadId;
    }

    public long getFactionId() {
        return factionId;
    }

    public GridPosition getPosition() {
        return position;
    }

    public void setPosition(GridPosition position) {
        this.position = position;
    }
}
