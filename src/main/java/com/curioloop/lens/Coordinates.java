/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.lens;

/**
 * Sky-plane coordinate helpers shared by the lens profiles.
 */
public final class Coordinates {

    private Coordinates() {}

    /**
     * Converts Cartesian to polar coordinates.
     * @param x x-coordinate
     * @param y y-coordinate
     * @return {@code {r, phi}} with {@code phi = atan2(y, x)}
     */
    public static double[] toPolar(double x, double y) {
        return new double[]{Math.hypot(x, y), Math.atan2(y, x)};
    }

    /**
     * Converts polar to Cartesian coordinates.
     * @param r Radius
     * @param phi Polar angle in radians
     * @return {@code {x, y}}
     */
    public static double[] toCartesian(double r, double phi) {
        return new double[]{r * Math.cos(phi), r * Math.sin(phi)};
    }

    /**
     * Expresses a point in a frame rotated counter-clockwise by {@code angle}.
     * @param x x-coordinate
     * @param y y-coordinate
     * @param angle Frame rotation in radians
     * @return {@code {x cos + y sin, -x sin + y cos}}
     */
    public static double[] rotate(double x, double y, double angle) {
        double cos = Math.cos(angle);
        double sin = Math.sin(angle);
        return new double[]{x * cos + y * sin, -x * sin + y * cos};
    }

    /**
     * Verifies that two coordinate arrays describe the same points.
     * @param x x-coordinates
     * @param y y-coordinates
     * @return Number of points
     * @throws ShapeMismatchException if an array is null or lengths differ
     */
    public static int checkShape(double[] x, double[] y) {
        int nx = x == null ? -1 : x.length;
        int ny = y == null ? -1 : y.length;
        if (nx < 0 || ny < 0 || nx != ny) {
            throw new ShapeMismatchException(nx, ny);
        }
        return nx;
    }
}
