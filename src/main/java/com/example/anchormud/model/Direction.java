package com.example.anchormud.model;

/**
 * Room exit directions.
 */
public enum Direction {
    NORTH("north", "n"),
    EAST("east", "e"),
    SOUTH("south", "s"),
    WEST("west", "w"),
    UP("up", "u"),
    DOWN("down", "d");

    private final String name;
    private final String alias;

    Direction(String name, String alias) {
        this.name = name;
        this.alias = alias;
    }

    public String getName() { return name; }

    public String getAlias() { return alias; }

    public Direction opposite() {
        switch (this) {
            case NORTH: return SOUTH;
            case SOUTH: return NORTH;
            case EAST: return WEST;
            case WEST: return EAST;
            case UP: return DOWN;
            default: return UP;
        }
    }

    /**
     * Parse a direction from its full name or single-letter alias.
     * @return the direction, or null if unrecognized
     */
    public static Direction fromString(String str) {
        if (str == null) return null;
        String s = str.trim().toLowerCase();
        for (Direction d : values()) {
            if (d.name.equals(s) || d.alias.equals(s)) return d;
        }
        return null;
    }
}
