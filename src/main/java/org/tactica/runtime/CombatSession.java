package org.tactica.runtime;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tactica.runtime.combat.CombatStateException;
import org.tactica.runtime.combat.FactionManager;
import org.tactica.runtime.combat.SquadActionService;
import org.tactica.runtime.combat.SquadMovementSystem;
import org.tactica.runtime.combat.TurnManager;
import org.tactica.runtime.model.CombatPhase;
import org.tactica.runtime.scheduling.ActionController;
import org.tactica.runtime.scheduling.CleanupPolicy;
import org.tactica.runtime.spatial.PositionIndex;
import org.tactica.runtime.spi.IAttackRangeProvider;
import org.tactica.runtime.spi.IAttackResolver;
import org.tactica.runtime.spi.ICombatEndCondition;
import org.tactica.runtime.spi.IEntityStore;
import org.tactica.runtime.spi.IMovementSpeedProvider;
import org.tactica.runtime.spi.IRandomProvider;
import org.tactica.runtime.spi.ITurnListener;
import org.tactica.runtime.store.SeededRandomProvider;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Owns everything one combat needs: the position index, the action controller, the faction and
 * turn managers and the squad action service. All of them are wired from the {@code tactica}
 * configuration block.
 * <p>
 * The session drives the scheduler one step at a time and applies the queue cleanup policy at
 * round boundaries. With {@link CleanupPolicy#BETWEEN_ROUNDS} empty queues are dropped whenever
 * a new round starts; with {@link CleanupPolicy#MANUAL} the caller decides.
 * <p>
 * Not thread-safe. Close the session to end a running combat and release its state.
 */
public class CombatSession implements ITurnListener, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(CombatSession.class);

    private final PositionIndex positionIndex = new PositionIndex();
    private final ActionController controller = new ActionController();
    private final FactionManager factions;
    private final TurnManager turns;
    private final SquadMovementSystem movement;
    private final SquadActionService actions;

    private final CleanupPolicy cleanupPolicy;
    private final boolean resetActionPointsEachRound;
    private final int initialActionPoints;

    /**
     * Creates a session whose turn order randomness comes from {@code combat.shuffle-seed}
     * ({@code 0} means a time-based seed).
     *
     * @param config The {@code tactica} configuration block.
     * @param store The entity store holding squads and combat records.
     * @param attackResolver Applies attacks.
     */
    public CombatSession(Config config, IEntityStore store, IAttackResolver attackResolver) {
        this(config, store, attackResolver, randomFrom(config.getConfig("combat")));
    }

    /**
     * @param config The {@code tactica} configuration block.
     * @param store The entity store holding squads and combat records.
     * @param attackResolver Applies attacks.
     * @param random Randomness for the turn order.
     */
    public CombatSession(Config config, IEntityStore store, IAttackResolver attackResolver, IRandomProvider random) {
        Config combatConfig = config.getConfig("combat");
        Config schedulerConfig = config.getConfig("scheduler");

        this.cleanupPolicy = combatConfig.getEnum(CleanupPolicy.class, "cleanup-policy");
        this.resetActionPointsEachRound = schedulerConfig.getBoolean("reset-action-points-each-round");
        this.initialActionPoints = schedulerConfig.getInt("initial-action-points");

        ICombatEndCondition endCondition = PluginFactory.create(combatConfig.getConfig("end-condition"),
                ICombatEndCondition.class);
        IMovementSpeedProvider speeds = PluginFactory.create(movementSpeedConfig(combatConfig),
                IMovementSpeedProvider.class);
        IAttackRangeProvider ranges = PluginFactory.create(combatConfig.getConfig("attack-range"),
                IAttackRangeProvider.class);

        this.factions = new FactionManager(store, positionIndex);
        this.turns = new TurnManager(store, factions, speeds, random, endCondition,
                combatConfig.getBoolean("auto-advance"));
        this.movement = new SquadMovementSystem(positionIndex, factions, turns);
        this.actions = new SquadActionService(turns, factions, movement, controller, positionIndex,
                attackResolver, ranges, schedulerConfig);

        turns.addTurnListener(this);
        turns.addTurnListener(actions);
        LOG.debug("Combat session created (cleanup={}, end condition={}, speeds={}, ranges={})", cleanupPolicy,
                endCondition.getClass().getSimpleName(), speeds.getClass().getSimpleName(),
                ranges.getClass().getSimpleName());
    }

    private static IRandomProvider randomFrom(Config combatConfig) {
        long seed = combatConfig.getLong("shuffle-seed");
        return seed == 0L ? SeededRandomProvider.unseeded() : new SeededRandomProvider(seed);
    }

    // The plugin's own speed option wins over combat.default-movement-speed.
    private static Config movementSpeedConfig(Config combatConfig) {
        Config plugin = combatConfig.getConfig("movement-speed");
        Config fallback = ConfigFactory.parseMap(Map.of("options.speed", combatConfig.getInt("default-movement-speed")));
        return plugin.withFallback(fallback);
    }

    /**
     * Starts a combat between the given factions.
     *
     * @param factionIds The participating factions, already populated with squads.
     * @throws CombatStateException if a combat is already running.
     */
    public void start(long... factionIds) throws CombatStateException {
        turns.initializeCombat(factionIds);
        turns.advanceIfFactionExhausted();
    }

    /**
     * Executes one scheduled action.
     *
     * @return {@code true} if an action was executed.
     * @throws CombatStateException if passing the turn fails.
     */
    public boolean step() throws CombatStateException {
        return actions.step();
    }

    /**
     * Steps until nothing is left to execute or the step limit is reached.
     *
     * @param maxSteps Upper bound on executed actions.
     * @return The number of actions executed.
     * @throws CombatStateException if passing the turn fails.
     */
    public int runUntilIdle(int maxSteps) throws CombatStateException {
        int executed = 0;
        while (executed < maxSteps && step()) {
            executed++;
        }
        if (executed == maxSteps && controller.hasPendingActions()) {
            LOG.warn("Step limit {} reached with actions still pending", maxSteps);
        }
        return executed;
    }

    /**
     * Passes the turn to the next faction.
     *
     * @throws CombatStateException if no combat is active.
     */
    public void endTurn() throws CombatStateException {
        turns.endTurn();
        turns.advanceIfFactionExhausted();
    }

    @Override
    public void onRoundStarted(int round) {
        if (cleanupPolicy == CleanupPolicy.BETWEEN_ROUNDS) {
            controller.cleanController();
        }
        if (resetActionPointsEachRound) {
            controller.resetActionPoints(initialActionPoints);
        }
    }

    @Override
    public void onPhaseChanged(CombatPhase from, CombatPhase to) {
        if (to == CombatPhase.COMBAT_INACTIVE) {
            controller.resetQueues();
        }
    }

    /**
     * Ends a running combat and drops all scheduling and map state.
     */
    @Override
    public void close() {
        if (turns.isCombatActive()) {
            try {
                turns.endCombat();
            } catch (CombatStateException e) {
                LOG.warn("Failed to end combat while closing session: {}", e.getMessage());
            }
        }
        controller.clear();
        positionIndex.clear();
    }

    public PositionIndex getPositionIndex() {
        return positionIndex;
    }

    public ActionController getController() {
        return controller;
    }

    public FactionManager getFactions() {
        return factions;
    }

    public TurnManager getTurns() {
        return turns;
    }

    public SquadMovementSystem getMovement() {
        return movement;
    }

    public SquadActionService getActions() {
        return actions;
    }

    public CleanupPolicy getCleanupPolicy() {
        return cleanupPolicy;
    }
}
