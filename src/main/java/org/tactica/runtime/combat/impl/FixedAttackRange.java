package org.tactica.runtime.combat.impl;

import org.tactica.runtime.spi.IAttackRangeProvider;

import com.typesafe.config.Config;

/**
 * Gives every squad the same attack range.
 * <p>
 * Configuration options:
 * <ul>
 *   <li>{@code range}: Cells, melee reach being 1 (default: 1)</li>
 * </ul>
 */
public class FixedAttackRange implements IAttackRangeProvider {

    public static final int DEFAULT_RANGE = 1;

    private final int range;

    public FixedAttackRange(Config options) {
        this.range = options.hasPath("range") ? options.getInt("range") : DEFAULT_RANGE;
        if (range < 1) {
            throw new IllegalArgumentException("Attack range must be at least 1, got " + range);
        }
    }

    @Override
    public int getAttackRange(long squadId) {
        return range;
    }
}
