package org.dxworks.markframe.model;

public enum Alignment {
    LEFT,
    RIGHT,
    CENTER,
    DEFAULT;

    /**
     * Maps the colons of a table delimiter cell to an alignment.
     */
    public static Alignment fromColons(boolean left, boolean right) {
        if (left && right) return CENTER;
        if (left) return LEFT;
        if (right) return RIGHT;
        return DEFAULT;
    }
}
