/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.lens;

/**
 * Thrown when coordinate arrays passed to a profile do not describe the same
 * number of points.
 * <p>
 * This is a caller error and is raised before any evaluation takes place.
 * Numeric domain problems never throw; they surface as NaN or infinite values.
 * </p>
 */
public class ShapeMismatchException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final int xLength;
    private final int yLength;

    /**
     * Creates a shape mismatch exception.
     * @param xLength Number of x coordinates (-1 if missing)
     * @param yLength Number of y coordinates (-1 if missing)
     */
    public ShapeMismatchException(int xLength, int yLength) {
        super(describe(xLength, yLength));
        this.xLength = xLength;
        this.yLength = yLength;
    }

    private static String describe(int xLength, int yLength) {
        if (xLength < 0 || yLength < 0) {
            return "Coordinate arrays must not be null (x: " + lengthOf(xLength) + ", y: " + lengthOf(yLength) + ")";
        }
        return "Coordinate arrays must have equal length (x: " + xLength + ", y: " + yLength + ")";
    }

    private static String lengthOf(int length) {
        return length < 0 ? "null" : String.valueOf(length);
    }

    /**
     * Gets the length of the x coordinate array.
     * @return Length, or -1 if the array was null
     */
    public int getXLength() {
        return xLength;
    }

    /**
     * Gets the length of the y coordinate array.
     * @return Length, or -1 if the array was null
     */
    public int getYLength() {
        return yLength;
    }
}
