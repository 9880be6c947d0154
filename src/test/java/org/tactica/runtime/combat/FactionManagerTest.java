package org.tactica.runtime.combat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tactica.runtime.model.ActionState;
import org.tactica.runtime.model.MapPosition;
import org.tactica.runtime.spatial.GridPosition;
import org.tactica.runtime.spatial.PositionIndex;
import org.tactica.runtime.store.InMemoryEntityStore;

public class FactionManagerTest {

    private InMemoryEntityStore store;
    private PositionIndex index;
    private FactionManager factions;

    @BeforeEach
    void setUp() {
        store = new InMemoryEntityStore();
        index = new PositionIndex();
        factions = new FactionManager(store, index);
    }

    @Test
    @Tag("unit")
    void createsNamedFactions() {
        long red = factions.createFaction("Red", true);
        long blue = factions.createFaction("Blue", false);

        assertThat(factions.getFactionName(red)).isEqualTo("Red");
        assertThat(factions.getFaction(blue).playerControlled()).isFalse();
        assertThat(factions.getFactionIds().toLongArray()).containsExactly(red, blue);
        assertThat(factions.getFactionName(999L)).isEqualTo("Unknown");
    }

    @Test
    @Tag("unit")
    void placingASquadRegistersItOnTheMap() throws CombatStateException {
        long red = factions.createFaction("Red", true);
        long squad = store.createEntity();

        factions.addSquadToFaction(red, squad, new GridPosition(2, 2));

        assertThat(index.getEntityIDAt(new GridPosition(2, 2))).isEqualTo(squad);
        assertThat(factions.getFactionOwner(squad)).isEqualTo(red);
        assertThat(factions.getFactionSquads(red).toLongArray()).containsExactly(squad);
        assertThat(factions.hasRemainingSquads(red)).isTrue();
        assertThat(factions.isSquad(squad)).isTrue();
    }

    @Test
    @Tag("unit")
    void placingAnAlreadyPlacedSquadMovesAndReassignsIt() throws CombatStateException {
        long red = factions.createFaction("Red", true);
        long blue = factions.createFaction("Blue", false);
        long squad = store.createEntity();
        factions.addSquadToFaction(red, squad, new GridPosition(0, 0));

        factions.addSquadToFaction(blue, squad, new GridPosition(4, 1));

        assertThat(index.isOccupied(new GridPosition(0, 0))).isFalse();
        assertThat(index.positionOf(squad)).isEqualTo(new GridPosition(4, 1));
        assertThat(factions.getFactionOwner(squad)).isEqualTo(blue);
        assertThat(factions.getFactionSquads(red).toLongArray()).isEmpty();
    }

    @Test
    @Tag("unit")
    void rejectsUnknownFactionOrSquad() {
        long red = factions.createFaction("Red", true);

        assertThatThrownBy(() -> factions.addSquadToFaction(999L, store.createEntity(), new GridPosition(0, 0)))
                .isInstanceOf(CombatStateException.class)
                .hasMessageContaining("Faction 999");
        assertThatThrownBy(() -> factions.addSquadToFaction(red, 999L, new GridPosition(0, 0)))
                .isInstanceOf(CombatStateException.class)
                .hasMessageContaining("Squad 999");
    }

    @Test
    @Tag("unit")
    void removingASquadClearsItsCombatRecords() throws CombatStateException {
        long red = factions.createFaction("Red", true);
        long squad = store.createEntity();
        factions.addSquadToFaction(red, squad, new GridPosition(1, 1));
        store.attach(squad, ActionState.class, new ActionState(squad));

        factions.removeSquadFromFaction(red, squad);

        assertThat(index.contains(squad)).isFalse();
        assertThat(store.has(squad, MapPosition.class)).isFalse();
        assertThat(store.has(squad, ActionState.class)).isFalse();
        assertThat(factions.hasRemainingSquads(red)).isFalse();
        assertThat(store.exists(squad)).isTrue();
    }

    @Test
    @Tag("unit")
    void removingFromTheWrongFactionFails() throws CombatStateException {
        long red = factions.createFaction("Red", true);
        long blue = factions.createFaction("Blue", false);
        long squad = store.createEntity();
        factions.addSquadToFaction(red, squad, new GridPosition(1, 1));

        assertThatThrownBy(() -> factions.removeSquadFromFaction(blue, squad))
                .isInstanceOf(CombatStateException.class)
                .satisfies(e -> assertThat(((CombatStateException) e).getFactionId()).isEqualTo(blue));
        assertThat(index.contains(squad)).isTrue();
    }

    @Test
    @Tag("unit")
    void relocateKeepsRecordAndIndexInStep() throws CombatStateException {
        long red = factions.createFaction("Red", true);
        long squad = store.createEntity();
        factions.addSquadToFaction(red, squad, new GridPosition(1, 1));

        factions.relocateSquad(squad, new GridPosition(3, 2));

        assertThat(factions.getSquadPosition(squad)).isEqualTo(new GridPosition(3, 2));
        assertThat(index.positionOf(squad)).isEqualTo(new GridPosition(3, 2));
    }

    @Test
    @Tag("unit")
    void relocatingAnUnplacedSquadFails() {
        long squad = store.createEntity();

        assertThatThrownBy(() -> factions.relocateSquad(squad, new GridPosition(0, 0)))
                .isInstanceOf(CombatStateException.class);
        assertThatThrownBy(() -> factions.getSquadPosition(squad))
                .isInstanceOf(CombatStateException.class);
    }
}
