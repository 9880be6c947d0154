package org.tactica.runtime.combat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tactica.runtime.model.ActionState;
import org.tactica.runtime.model.CombatPhase;
import org.tactica.runtime.model.TurnState;
import org.tactica.runtime.spi.ICombatEndCondition;
import org.tactica.runtime.spi.IEntityStore;
import org.tactica.runtime.spi.IMovementSpeedProvider;
import org.tactica.runtime.spi.IRandomProvider;
import org.tactica.runtime.spi.ITurnListener;

import it.unimi.dsi.fastutil.longs.LongList;

/**
 * Faction-level turn state machine.
 * <p>
 * A combat moves through {@code COMBAT_INACTIVE -> COMBAT_ACTIVE -> COMBAT_RESOLVING ->
 * COMBAT_INACTIVE}. While active, exactly one faction is current. The turn order is a uniform
 * random permutation of the participating factions, drawn once when the combat starts.
 * <p>
 * Each squad of the current faction has an {@link ActionState}: one attack per turn and a movement
 * budget that starts at the squad's speed. A squad that has acted and has no movement left is
 * exhausted. When all squads of the current faction are exhausted, the turn passes on (if
 * auto-advance is enabled). After the last faction of a round, the configured
 * {@link ICombatEndCondition} decides between a new round and resolution.
 * <p>
 * This class is the only writer of {@link ActionState} records.
 */
public class TurnManager {

    private static final Logger LOG = LoggerFactory.getLogger(TurnManager.class);

    private final IEntityStore store;
    private final FactionManager factions;
    private final IMovementSpeedProvider speeds;
    private final IRandomProvider random;
    private final ICombatEndCondition endCondition;
    private final boolean autoAdvance;
    private final List<ITurnListener> listeners = new ArrayList<>();

    /**
     * @param store The entity store holding the combat records.
     * @param factions Faction and squad lookups.
     * @param speeds Movement budget per squad.
     * @param random Randomness for the turn order shuffle.
     * @param endCondition Decides when the combat is over.
     * @param autoAdvance Pass the turn automatically once every squad of the current faction is exhausted.
     */
    public TurnManager(IEntityStore store, FactionManager factions, IMovementSpeedProvider speeds,
                       IRandomProvider random, ICombatEndCondition endCondition, boolean autoAdvance) {
        this.store = store;
        this.factions = factions;
        this.speeds = speeds;
        this.random = random;
        this.endCondition = endCondition;
        this.autoAdvance = autoAdvance;
    }

    public void addTurnListener(ITurnListener listener) {
        listeners.add(listener);
    }

    public void removeTurnListener(ITurnListener listener) {
        listeners.remove(listener);
    }

    /**
     * Starts a combat between the given factions.
     * <p>
     * Shuffles the turn order, creates an {@link ActionState} for every squad of every faction and
     * resets the budgets of the first faction's squads.
     *
     * @param factionIds The participating factions.
     * @throws IllegalArgumentException if no faction is given.
     * @throws CombatStateException if a combat is already running.
     */
    public void initializeCombat(long... factionIds) throws CombatStateException {
        if (factionIds.length == 0) {
            throw new IllegalArgumentException("At least one faction is required to start combat");
        }
        if (CombatQueries.findTurnStateEntity(store) != 0L) {
            throw new CombatStateException("Combat is already active");
        }

        long[] turnOrder = Arrays.copyOf(factionIds, factionIds.length);
        shuffleFactionOrder(turnOrder, random);

        long turnEntity = store.createEntity();
        store.attach(turnEntity, TurnState.class, new TurnState(turnOrder));

        for (long factionId : factionIds) {
            LongList squads = factions.getFactionSquads(factionId);
            for (int i = 0; i < squads.size(); i++) {
                store.attach(squads.getLong(i), ActionState.class, new ActionState(squads.getLong(i)));
            }
        }

        LOG.info("Combat started between {} faction(s), turn order {}", turnOrder.length, Arrays.toString(turnOrder));
        firePhaseChanged(CombatPhase.COMBAT_INACTIVE, CombatPhase.COMBAT_ACTIVE);

        resetSquadActions(turnOrder[0]);
        fireFactionTurnStarted(turnOrder[0], 1);
    }

    /**
     * Fisher-Yates shuffle in place.
     *
     * @param order The ids to shuffle.
     * @param random The randomness source.
     */
    static void shuffleFactionOrder(long[] order, IRandomProvider random) {
        for (int i = order.length - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            long tmp = order[i];
            order[i] = order[j];
            order[j] = tmp;
        }
    }

    /**
     * Restores the turn budget of every squad of a faction: clears the acted and moved flags and
     * sets the remaining movement to the squad's speed. Squads without an {@link ActionState}
     * (placed after the combat started) get one.
     *
     * @param factionId The faction.
     */
    public void resetSquadActions(long factionId) {
        LongList squads = factions.getFactionSquads(factionId);
        for (int i = 0; i < squads.size(); i++) {
            long squadId = squads.getLong(i);
            ActionState state = CombatQueries.findActionState(store, squadId);
            if (state == null) {
                state = new ActionState(squadId);
                store.attach(squadId, ActionState.class, state);
            }
            state.setHasActed(false);
            state.setHasMoved(false);
            state.setMovementRemaining(Math.max(0, speeds.getMovementSpeed(squadId)));
        }
    }

    /**
     * @return The current phase; {@link CombatPhase#COMBAT_INACTIVE} when no combat is running.
     */
    public CombatPhase getPhase() {
        TurnState state = CombatQueries.findTurnState(store);
        return state == null ? CombatPhase.COMBAT_INACTIVE : state.getPhase();
    }

    public boolean isCombatActive() {
        return getPhase() == CombatPhase.COMBAT_ACTIVE;
    }

    /**
     * @return The faction whose turn it is, or {@code 0} if no combat is active.
     */
    public long getCurrentFaction() {
        TurnState state = CombatQueries.findTurnState(store);
        if (state == null || state.getPhase() != CombatPhase.COMBAT_ACTIVE) {
            return 0L;
        }
        int index = state.getCurrentTurnIndex();
        if (index < 0 || index >= state.getTurnOrderLength()) {
            return 0L;
        }
        return state.getFactionAt(index);
    }

    /**
     * @return The current round, starting at 1, or {@code 0} if no combat is running.
     */
    public int getCurrentRound() {
        TurnState state = CombatQueries.findTurnState(store);
        return state == null ? 0 : state.getCurrentRound();
    }

    /**
     * @return The turn order of the running combat, or an empty array.
     */
    public long[] getTurnOrder() {
        TurnState state = CombatQueries.findTurnState(store);
        return state == null ? new long[0] : state.getTurnOrder();
    }

    /**
     * Passes the turn to the next faction. After the last faction of a round either a new round
     * starts or, if the end condition holds, the combat is resolved.
     *
     * @throws CombatStateException if no combat is active.
     */
    public void endTurn() throws CombatStateException {
        long turnEntity = CombatQueries.findTurnStateEntity(store);
        TurnState state = requireActive(turnEntity);

        int next = state.getCurrentTurnIndex() + 1;
        if (next >= state.getTurnOrderLength()) {
            if (endCondition.isCombatOver(factions, state.getTurnOrder())) {
                resolve(turnEntity, state);
                return;
            }
            next = 0;
            state.setCurrentRound(state.getCurrentRound() + 1);
            LOG.info("Round {} started", state.getCurrentRound());
            for (ITurnListener listener : listeners) {
                listener.onRoundStarted(state.getCurrentRound());
            }
        }
        state.setCurrentTurnIndex(next);

        long factionId = state.getFactionAt(next);
        resetSquadActions(factionId);
        LOG.debug("Turn passed to faction {} ('{}')", factionId, factions.getFactionName(factionId));
        fireFactionTurnStarted(factionId, state.getCurrentRound());
    }

    /**
     * Ends the running combat immediately, going through resolution.
     *
     * @throws CombatStateException if no combat is active.
     */
    public void endCombat() throws CombatStateException {
        long turnEntity = CombatQueries.findTurnStateEntity(store);
        TurnState state = requireActive(turnEntity);
        resolve(turnEntity, state);
    }

    /**
     * Ends the turn if auto-advance is enabled and every squad of the current faction is
     * exhausted. Factions without squads are passed over the same way.
     *
     * @return {@code true} if the turn was passed at least once.
     * @throws CombatStateException if the combat state is inconsistent.
     */
    public boolean advanceIfFactionExhausted() throws CombatStateException {
        if (!autoAdvance || !isCombatActive()) {
            return false;
        }
        boolean advanced = false;
        int guard = 2 * getTurnOrder().length + 1;
        while (isCombatActive() && isFactionExhausted(getCurrentFaction())) {
            if (guard-- == 0) {
                LOG.warn("Every faction is exhausted at the start of its turn, stopping auto-advance in round {}",
                        getCurrentRound());
                break;
            }
            endTurn();
            advanced = true;
        }
        return advanced;
    }

    /**
     * @return {@code true} if the squad belongs to the faction whose turn it is.
     */
    public boolean isSquadAuthorized(long squadId) {
        long current = getCurrentFaction();
        return current != 0L && factions.getFactionOwner(squadId) == current;
    }

    /**
     * @return {@code true} if it is the squad's turn and it has not attacked yet.
     */
    public boolean isSquadActivatable(long squadId) {
        return isSquadAuthorized(squadId) && canSquadAct(squadId);
    }

    /**
     * @return {@code true} if the squad has not used its action this turn.
     */
    public boolean canSquadAct(long squadId) {
        ActionState state = CombatQueries.findActionState(store, squadId);
        return state != null && !state.hasActed();
    }

    /**
     * @return {@code true} if the squad has movement left this turn.
     */
    public boolean canSquadMove(long squadId) {
        ActionState state = CombatQueries.findActionState(store, squadId);
        return state != null && state.getMovementRemaining() > 0;
    }

    /**
     * @throws CombatStateException if the squad has no action state.
     */
    public void markSquadAsActed(long squadId) throws CombatStateException {
        requireActionState(squadId).setHasActed(true);
    }

    /**
     * @throws CombatStateException if the squad has no action state.
     */
    public void markSquadAsMoved(long squadId) throws CombatStateException {
        requireActionState(squadId).setHasMoved(true);
    }

    /**
     * Reduces the squad's remaining movement, flooring it at zero.
     *
     * @param squadId The squad.
     * @param amount Cells moved, not negative.
     * @return The remaining movement afterwards.
     * @throws CombatStateException if the squad has no action state.
     */
    public int decrementMovementRemaining(long squadId, int amount) throws CombatStateException {
        if (amount < 0) {
            throw new IllegalArgumentException("Movement decrement must not be negative: " + amount);
        }
        ActionState state = requireActionState(squadId);
        state.setMovementRemaining(Math.max(0, state.getMovementRemaining() - amount));
        return state.getMovementRemaining();
    }

    /**
     * @return {@code true} if the squad has acted and cannot move; squads without a budget count as exhausted.
     */
    public boolean isSquadExhausted(long squadId) {
        ActionState state = CombatQueries.findActionState(store, squadId);
        return state == null || state.isExhausted();
    }

    /**
     * @return {@code true} if every squad of the faction is exhausted (vacuously so for no squads).
     */
    public boolean isFactionExhausted(long factionId) {
        LongList squads = factions.getFactionSquads(factionId);
        for (int i = 0; i < squads.size(); i++) {
            if (!isSquadExhausted(squads.getLong(i))) {
                return false;
            }
        }
        return true;
    }

    public Optional<ActionState> getActionState(long squadId) {
        return Optional.ofNullable(CombatQueries.findActionState(store, squadId));
    }

    private ActionState requireActionState(long squadId) throws CombatStateException {
        ActionState state = CombatQueries.findActionState(store, squadId);
        if (state == null) {
            throw new CombatStateException("No action state for squad " + squadId, squadId, 0L);
        }
        return state;
    }

    private TurnState requireActive(long turnEntity) throws CombatStateException {
        TurnState state = turnEntity == 0L ? null : store.get(turnEntity, TurnState.class);
        if (state == null || state.getPhase() != CombatPhase.COMBAT_ACTIVE) {
            throw new CombatStateException("No active combat");
        }
        return state;
    }

    private void resolve(long turnEntity, TurnState state) {
        state.setPhase(CombatPhase.COMBAT_RESOLVING);
        firePhaseChanged(CombatPhase.COMBAT_ACTIVE, CombatPhase.COMBAT_RESOLVING);

        for (long factionId : state.getTurnOrder()) {
            LongList squads = factions.getFactionSquads(factionId);
            for (int i = 0; i < squads.size(); i++) {
                store.detach(squads.getLong(i), ActionState.class);
            }
        }
        state.setCombatActive(false);
        state.setPhase(CombatPhase.COMBAT_INACTIVE);
        store.destroyEntity(turnEntity);
        LOG.info("Combat ended after {} round(s)", state.getCurrentRound());
        firePhaseChanged(CombatPhase.COMBAT_RESOLVING, CombatPhase.COMBAT_INACTIVE);
    }

    private void firePhaseChanged(CombatPhase from, CombatPhase to) {
        for (ITurnListener listener : listeners) {
            listener.onPhaseChanged(from, to);
        }
    }

    private void fireFactionTurnStarted(long factionId, int round) {
        for (ITurnListener listener : listeners) {
            listener.onFactionTurnStarted(factionId, round);
        }
    }
}
