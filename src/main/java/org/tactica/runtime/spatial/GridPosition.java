package org.tactica.runtime.spatial;

/**
 * A discrete cell on the combat grid.
 *
 * @param x Column.
 * @param y Row.
 */
public record GridPosition(int x, int y) {

    /**
     * Chebyshev distance, i.e. the number of 8-directional steps between two cells.
     *
     * @param other The other cell.
     * @return {@code max(|dx|, |dy|)}, saturated at {@link Integer#MAX_VALUE}.
     */
    public int chebyshevDistance(GridPosition other) {
        long distance = Math.max(Math.abs((long) x - other.x), Math.abs((long) y - other.y));
        return (int) Math.min(distance, Integer.MAX_VALUE);
    }

    /**
     * @param dx Horizontal offset.
     * @param dy Vertical offset.
     * @return The cell at the given offset from this one.
     */
    public GridPosition offset(int dx, int dy) {
        return new GridPosition(x + dx, y + dy);
    }

    /**
     * Packs this position into a single long key (x in the high word, y in the low word).
     *
     * @return The packed key.
     */
    public long pack() {
        return ((long) x << 32) | (y & 0xFFFFFFFFL);
    }

    /**
     * Inverse of {@link #pack()}.
     *
     * @param key A key produced by {@link #pack()}.
     * @return The unpacked position.
     */
    public static GridPosition unpack(long key) {
        return new GridPosition((int) (key >> 32), (int) key);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
