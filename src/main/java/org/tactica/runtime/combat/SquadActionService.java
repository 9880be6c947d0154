package org.tactica.runtime.combat;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tactica.runtime.action.ActionKind;
import org.tactica.runtime.action.AttackAction;
import org.tactica.runtime.action.MovementAction;
import org.tactica.runtime.action.PlayerAction;
import org.tactica.runtime.action.PlayerActionBehavior;
import org.tactica.runtime.model.ActionState;
import org.tactica.runtime.model.AttackResult;
import org.tactica.runtime.model.MoveResult;
import org.tactica.runtime.scheduling.ActionController;
import org.tactica.runtime.scheduling.ActionQueue;
import org.tactica.runtime.scheduling.SubmissionResult;
import org.tactica.runtime.spatial.GridPosition;
import org.tactica.runtime.spatial.PositionIndex;
import org.tactica.runtime.spi.IAttackRangeProvider;
import org.tactica.runtime.spi.IAttackResolver;
import org.tactica.runtime.spi.ICombatOutcomeListener;
import org.tactica.runtime.spi.ITurnListener;

import com.typesafe.config.Config;

import it.unimi.dsi.fastutil.longs.Long2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;

/**
 * Entry point for combat resolution: turns squad orders into scheduled actions and executes them.
 * <p>
 * Every squad gets one {@link ActionQueue}, created on its first order and registered with the
 * {@link ActionController}. Orders are accepted only from squads of the current faction that still
 * have the matching budget; otherwise they are {@link SubmissionResult#REJECTED}. Attacks must
 * also target an enemy squad within the attacker's range. Budgets and range are checked again
 * when the action runs, since the state may have changed in between.
 * <p>
 * Outcomes are reported to {@link ICombatOutcomeListener}s as {@link AttackResult} and
 * {@link MoveResult} values.
 *
 * <h2>Configuration</h2>
 * <pre>{@code
 * scheduler {
 *   initial-action-points = 100
 *   movement-cost-per-tile = 1
 *   attack-cost = 10
 * }
 * }</pre>
 */
public class SquadActionService implements ITurnListener {

    private static final Logger LOG = LoggerFactory.getLogger(SquadActionService.class);

    private final TurnManager turns;
    private final FactionManager factions;
    private final SquadMovementSystem movement;
    private final ActionController controller;
    private final PositionIndex positionIndex;
    private final IAttackResolver attackResolver;
    private final IAttackRangeProvider attackRanges;

    private final int initialActionPoints;
    private final int movementCostPerTile;
    private final int attackCost;

    private final Long2ObjectLinkedOpenHashMap<ActionQueue> queuesBySquad = new Long2ObjectLinkedOpenHashMap<>();
    private final List<ICombatOutcomeListener> outcomeListeners = new ArrayList<>();

    /**
     * @param turns The turn state machine.
     * @param factions Faction and squad records.
     * @param movement Squad movement.
     * @param controller The scheduler executing queued actions.
     * @param positionIndex The combat grid.
     * @param attackResolver Applies attacks.
     * @param attackRanges How far each squad can strike.
     * @param schedulerConfig The {@code scheduler} configuration block.
     */
    public SquadActionService(TurnManager turns, FactionManager factions, SquadMovementSystem movement,
                              ActionController controller, PositionIndex positionIndex,
                              IAttackResolver attackResolver, IAttackRangeProvider attackRanges,
                              Config schedulerConfig) {
        this.turns = turns;
        this.factions = factions;
        this.movement = movement;
        this.controller = controller;
        this.positionIndex = positionIndex;
        this.attackResolver = attackResolver;
        this.attackRanges = attackRanges;
        this.initialActionPoints = schedulerConfig.getInt("initial-action-points");
        this.movementCostPerTile = schedulerConfig.getInt("movement-cost-per-tile");
        this.attackCost = schedulerConfig.getInt("attack-cost");
        if (movementCostPerTile <= 0 || attackCost <= 0) {
            throw new IllegalArgumentException("Action costs must be positive (movement-cost-per-tile="
                    + movementCostPerTile + ", attack-cost=" + attackCost + ")");
        }
    }

    public void addOutcomeListener(ICombatOutcomeListener listener) {
        outcomeListeners.add(listener);
    }

    /**
     * Returns the squad's queue, creating it on first use, and makes sure it is registered with
     * the controller.
     *
     * @param squadId The squad.
     * @return Its queue.
     */
    public ActionQueue queueFor(long squadId) {
        ActionQueue queue = queuesBySquad.get(squadId);
        if (queue == null) {
            queue = new ActionQueue(squadId, initialActionPoints);
            queuesBySquad.put(squadId, queue);
        }
        controller.addActionQueue(queue);
        return queue;
    }

    public Optional<ActionQueue> findQueue(long squadId) {
        return Optional.ofNullable(queuesBySquad.get(squadId));
    }

    /**
     * Orders a squad to move to a cell.
     *
     * @param squadId The squad.
     * @param target The destination.
     * @return {@link SubmissionResult#REJECTED} if it is not the squad's turn, the destination is its
     *         current cell, or the destination is farther than its remaining movement.
     */
    public SubmissionResult submitMove(long squadId, GridPosition target) {
        if (!turns.isSquadAuthorized(squadId) || !turns.canSquadMove(squadId)) {
            return SubmissionResult.REJECTED;
        }
        GridPosition current = positionIndex.positionOf(squadId);
        if (current == null || current.equals(target)) {
            return SubmissionResult.REJECTED;
        }
        int distance = current.chebyshevDistance(target);
        int movementRemaining = turns.getActionState(squadId).map(ActionState::getMovementRemaining).orElse(0);
        if (distance > movementRemaining) {
            LOG.debug("Move of squad {} to {} rejected: need {}, have {}", squadId, target, distance,
                    movementRemaining);
            return SubmissionResult.REJECTED;
        }
        MovementAction action = new MovementAction(squadId, positionIndex,
                target.x() - current.x(), target.y() - current.y(), this::performMove);
        return queueFor(squadId).addAction(action, distance * movementCostPerTile, ActionKind.MOVEMENT);
    }

    /**
     * Orders a squad to attack an enemy squad.
     *
     * @param attackerId The attacking squad.
     * @param defenderId The target squad.
     * @param kind {@link ActionKind#ATTACK}, {@link ActionKind#MELEE_ATTACK} or {@link ActionKind#RANGED_ATTACK}.
     * @return {@link SubmissionResult#REJECTED} if it is not the attacker's turn, it already acted,
     *         the target is not an enemy squad, or the target is out of range.
     */
    public SubmissionResult submitAttack(long attackerId, long defenderId, ActionKind kind) {
        if (kind != ActionKind.ATTACK && kind != ActionKind.MELEE_ATTACK && kind != ActionKind.RANGED_ATTACK) {
            throw new IllegalArgumentException("Not an attack kind: " + kind);
        }
        Optional<String> problem = checkAttack(attackerId, defenderId);
        if (problem.isPresent()) {
            LOG.debug("Attack {} -> {} rejected: {}", attackerId, defenderId, problem.get());
            return SubmissionResult.REJECTED;
        }
        AttackAction action = new AttackAction(attackerId, defenderId, this::performAttack);
        return queueFor(attackerId).addAction(action, attackCost, kind);
    }

    /**
     * Tells why an attack is not possible right now.
     *
     * @param attackerId The attacking squad.
     * @param defenderId The target.
     * @return The reason the attack would fail, or empty if it is valid.
     */
    public Optional<String> checkAttack(long attackerId, long defenderId) {
        if (!turns.isSquadActivatable(attackerId)) {
            return Optional.of("Squad " + attackerId + " cannot act");
        }
        long defenderFaction = factions.getFactionOwner(defenderId);
        if (defenderFaction == 0L) {
            return Optional.of("Target " + defenderId + " is not a squad on the map");
        }
        if (defenderFaction == factions.getFactionOwner(attackerId)) {
            return Optional.of("Cannot attack a squad of the own faction");
        }
        GridPosition attackerPos = positionIndex.positionOf(attackerId);
        GridPosition defenderPos = positionIndex.positionOf(defenderId);
        if (attackerPos == null || defenderPos == null) {
            return Optional.of("Attacker or target is not on the map");
        }
        int distance = attackerPos.chebyshevDistance(defenderPos);
        int range = attackRanges.getAttackRange(attackerId);
        if (distance > range) {
            return Optional.of("Target out of range: " + distance + " tiles away, max range " + range);
        }
        return Optional.empty();
    }

    /**
     * Lists the enemy squads a squad can currently reach.
     *
     * @param squadId The squad.
     * @return Enemy squads within its attack range; empty if it is not on the map.
     */
    public LongList getSquadsInRange(long squadId) {
        LongArrayList result = new LongArrayList();
        GridPosition pos = positionIndex.positionOf(squadId);
        long ownFaction = factions.getFactionOwner(squadId);
        if (pos == null || ownFaction == 0L) {
            return result;
        }
        LongList nearby = positionIndex.getEntitiesInRadius(pos, attackRanges.getAttackRange(squadId));
        for (int i = 0; i < nearby.size(); i++) {
            long owner = factions.getFactionOwner(nearby.getLong(i));
            if (owner != 0L && owner != ownFaction) {
                result.add(nearby.getLong(i));
            }
        }
        return result;
    }

    /**
     * Queues an arbitrary player action for a squad of the current faction.
     *
     * @param actorId The acting squad.
     * @param targetId The targeted entity, or {@code 0}.
     * @param dx Horizontal offset of the target cell.
     * @param dy Vertical offset of the target cell.
     * @param kind The deduplication kind.
     * @param cost Action point cost, positive.
     * @param behavior What the action does.
     * @return {@link SubmissionResult#REJECTED} if it is not the actor's turn.
     */
    public SubmissionResult submitPlayerAction(long actorId, long targetId, int dx, int dy, ActionKind kind,
                                               int cost, PlayerActionBehavior behavior) {
        if (!turns.isSquadAuthorized(actorId)) {
            return SubmissionResult.REJECTED;
        }
        PlayerAction action = new PlayerAction(actorId, targetId, positionIndex, dx, dy, behavior);
        return queueFor(actorId).addAction(action, cost, kind);
    }

    /**
     * Executes one scheduled action, then passes the turn if the current faction is exhausted.
     * <p>
     * If the highest-priority queue is empty while others still hold work, empty queues are
     * dropped first. Queues are re-registered on every order, so this cannot lose a queue that is
     * about to receive entries.
     *
     * @return {@code true} if an action was executed.
     * @throws CombatStateException if passing the turn fails.
     */
    public boolean step() throws CombatStateException {
        boolean executed = controller.executeFirst();
        if (!executed && controller.hasPendingActions()) {
            controller.cleanController();
            executed = controller.executeFirst();
        }
        if (executed) {
            turns.advanceIfFactionExhausted();
        }
        return executed;
    }

    /**
     * Drops a squad's queue, e.g. after it was destroyed.
     *
     * @param squadId The squad.
     */
    public void forgetSquad(long squadId) {
        ActionQueue queue = queuesBySquad.remove(squadId);
        if (queue != null) {
            controller.handleOf(queue).ifPresent(controller::removeActionQueue);
        }
    }

    /**
     * Discards orders left over from the previous faction's turn.
     */
    @Override
    public void onFactionTurnStarted(long factionId, int round) {
        for (Long2ObjectMap.Entry<ActionQueue> entry : queuesBySquad.long2ObjectEntrySet()) {
            ActionQueue queue = entry.getValue();
            if (queue.numOfActions() > 0 && factions.getFactionOwner(entry.getLongKey()) != factionId) {
                LOG.debug("Discarding {} stale action(s) of squad {}", queue.numOfActions(), entry.getLongKey());
                queue.clear();
            }
        }
    }

    private void performMove(long squadId, PositionIndex map, int dx, int dy) {
        GridPosition current = map.positionOf(squadId);
        if (current == null) {
            publish(MoveResult.failure(squadId, null, "Squad " + squadId + " is not on the map"));
            return;
        }
        GridPosition target = current.offset(dx, dy);
        if (!turns.isSquadAuthorized(squadId)) {
            publish(MoveResult.failure(squadId, target, "Not the turn of squad " + squadId));
            return;
        }
        try {
            int cost = movement.moveSquad(squadId, target);
            int remaining = turns.getActionState(squadId).map(ActionState::getMovementRemaining).orElse(0);
            publish(MoveResult.success(squadId, target, cost, remaining));
        } catch (CombatStateException e) {
            LOG.debug("Move of squad {} to {} failed: {}", squadId, target, e.getMessage());
            publish(MoveResult.failure(squadId, target, e.getMessage()));
        }
    }

    private void performAttack(long attackerId, long defenderId) {
        Optional<String> problem = checkAttack(attackerId, defenderId);
        if (problem.isPresent()) {
            publish(AttackResult.failure(attackerId, defenderId, problem.get()));
            return;
        }
        long defenderFaction = factions.getFactionOwner(defenderId);
        IAttackResolver.Outcome outcome = attackResolver.resolve(attackerId, defenderId);
        try {
            turns.markSquadAsActed(attackerId);
            if (outcome.defenderDestroyed()) {
                factions.removeSquadFromFaction(defenderFaction, defenderId);
                forgetSquad(defenderId);
                LOG.info("Squad {} destroyed by squad {}", defenderId, attackerId);
            }
        } catch (CombatStateException e) {
            LOG.warn("Attack bookkeeping failed for {} -> {}: {}", attackerId, defenderId, e.getMessage());
            publish(AttackResult.failure(attackerId, defenderId, e.getMessage()));
            return;
        }
        publish(AttackResult.success(attackerId, defenderId, outcome.damageDealt(), outcome.defenderDestroyed()));
    }

    private void publish(MoveResult result) {
        for (ICombatOutcomeListener listener : outcomeListeners) {
            listener.onMoveResolved(result);
        }
    }

    private void publish(AttackResult result) {
        for (ICombatOutcomeListener listener : outcomeListeners) {
            listener.onAttackResolved(result);
        }
    }
}
