package com.seshlog.common.model;

/**
 * Eight-point compass rose used for the cardinal form of wave and wind directions.
 */
public enum CompassDirection {
    N, NE, E, SE, S, SW, W, NW;

    private static final int SECTOR_DEGREES = 45;

    /**
     * Maps a bearing in degrees onto its compass sector. Each sector starts at its
     * own bearing, so 0..44 is N, 45..89 is NE and so on. Values outside 0..359
     * wrap around.
     */
    public static CompassDirection fromDegrees(int degrees) {
        int normalized = Math.floorMod(degrees, 360);
        return values()[(normalized / SECTOR_DEGREES) % values().length];
    }
}
