package org.tactica.runtime.combat.impl;

import org.tactica.runtime.spi.IMovementSpeedProvider;

import com.typesafe.config.Config;

/**
 * Gives every squad the same movement budget per turn.
 * <p>
 * Configuration options:
 * <ul>
 *   <li>{@code speed}: Cells per turn (default: 3)</li>
 * </ul>
 */
public class FixedMovementSpeed implements IMovementSpeedProvider {

    public static final int DEFAULT_SPEED = 3;

    private final int speed;

    public FixedMovementSpeed(Config options) {
        this.speed = options.hasPath("speed") ? options.getInt("speed") : DEFAULT_SPEED;
        if (speed < 0) {
            throw new IllegalArgumentException("Movement speed must not be negative, got " + speed);
        }
    }

    @Override
    public int getMovementSpeed(long squadId) {
        return speed;
    }
}
