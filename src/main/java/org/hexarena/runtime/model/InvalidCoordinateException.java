package org.hexarena.runtime.model;

/**
 * Thrown when a cube coordinate violates {@code q + r + s == 0}.
 */
public class InvalidCoordinateException extends IllegalArgumentException {

    public InvalidCoordinateException(int q, int r, int s) {
        super("Invalid hex coordinate (" + q + ", " + r + ", " + s + "): q + r + s must equal 0");
    }
}
