package io.satnet.topology;

import lombok.Value;

/**
 * Cartesian vector, kilometres for positions and kilometres per second for velocities.
 */
@Value
public class Vector3 {
    public static final Vector3 ZERO = new Vector3(0, 0, 0);

    double x;
    double y;
    double z;

    public double distance(Vector3 other) {
        var dx = x - other.x;
        var dy = y - other.y;
        var dz = z - other.z;

        return Math.sqrt(dx * dx + dy * dy + dz * dz);
    }

    public Vector3 add(Vector3 other) {
        return new Vector3(x + other.x, y + other.y, z + other.z);
    }

    public Vector3 scale(double factor) {
        return new Vector3(x * factor, y * factor, z * factor);
    }
}
