package org.tactica.test.utils;

import org.tactica.runtime.CombatSession;
import org.tactica.runtime.action.MovementAction;
import org.tactica.runtime.spi.IAttackResolver;
import org.tactica.runtime.spi.IEntityStore;
import org.tactica.runtime.spi.IRandomProvider;
import org.tactica.runtime.store.SeededRandomProvider;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Shared fixtures for combat tests. Configuration is inline so tests do not depend on
 * {@code reference.conf}.
 */
public final class CombatTestUtils {

    private CombatTestUtils() {}

    /**
     * @return A complete {@code tactica} block: speed 3, 100 action points, movement cost 1 per
     *         tile, attack cost 10, melee attack range, auto-advance on, cleanup between rounds.
     */
    public static Config defaultConfig() {
        return ConfigFactory.parseString("""
                combat {
                  default-movement-speed = 3
                  shuffle-seed = 42
                  cleanup-policy = BETWEEN_ROUNDS
                  auto-advance = true
                  end-condition {
                    className = "org.tactica.runtime.combat.impl.LastFactionStanding"
                    options { minimum-factions = 2 }
                  }
                  movement-speed {
                    className = "org.tactica.runtime.combat.impl.FixedMovementSpeed"
                    options {}
                  }
                  attack-range {
                    className = "org.tactica.runtime.combat.impl.FixedAttackRange"
                    options { range = 1 }
                  }
                }
                scheduler {
                  initial-action-points = 100
                  movement-cost-per-tile = 1
                  attack-cost = 10
                  reset-action-points-each-round = true
                }
                trace { max-steps = 1000 }
                """);
    }

    /**
     * @param overrides HOCON overriding parts of {@link #defaultConfig()}.
     * @return The merged block.
     */
    public static Config configWith(String overrides) {
        return ConfigFactory.parseString(overrides).withFallback(defaultConfig()).resolve();
    }

    public static CombatSession createSession(IEntityStore store, IAttackResolver resolver) {
        return new CombatSession(defaultConfig(), store, resolver, deterministicRandom());
    }

    /**
     * @return A provider whose every draw is {@code 0}, so the turn order shuffle is predictable:
     *         for {@code [a, b]} it yields {@code [b, a]}.
     */
    public static IRandomProvider zeroRandom() {
        return new SeededRandomProvider(0L) {
            @Override
            public int nextInt(int bound) {
                return 0;
            }
        };
    }

    public static IRandomProvider deterministicRandom() {
        return new SeededRandomProvider(42L);
    }

    /**
     * @param actorId The actor.
     * @return A movement action with no behavior, executing as a no-op.
     */
    public static MovementAction noopMove(long actorId) {
        return new MovementAction(actorId, null, 0, 0, null);
    }
}
