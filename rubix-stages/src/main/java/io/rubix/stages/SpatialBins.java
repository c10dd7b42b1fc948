package io.rubix.stages;

import io.rubix.core.config.RubixConfig;
import io.rubix.core.context.ArrayAttribute;
import io.rubix.core.exception.ConfigurationException;
import java.util.Arrays;

/// Square spatial grid of `sbin x sbin` spaxels spanning `[-fov/2, fov/2]` on both
/// the x and y axes.
///
/// Edges are shared by both axes. A particle at `(x, y)` falls into column `i` when
/// `edges[i] <= x < edges[i + 1]`; positions outside the grid are clipped to the
/// nearest border spaxel by {@link #assign} and reported as outside by {@link #contains}.
public final class SpatialBins {

    static final String FOV = "telescope/fov";
    static final String SBIN = "telescope/sbin";

    private final double fov;
    private final int sbin;
    private final double[] edges;

    private SpatialBins(double fov, int sbin) {
        this.fov = fov;
        this.sbin = sbin;
        this.edges = new double[sbin + 1];
        double step = fov / sbin;
        for (int i = 0; i <= sbin; i++) {
            edges[i] = -fov / 2 + i * step;
        }
        edges[sbin] = fov / 2;
    }

    /// Creates the grid described by `telescope/fov` and `telescope/sbin`.
    ///
    /// @param config full configuration, not null
    /// @return spatial grid, never null
    /// @throws ConfigurationException if `fov` is missing or not positive, or `sbin` is
    ///     missing or below 1
    public static SpatialBins fromConfig(RubixConfig config) throws ConfigurationException {
        double fov = config.requireDouble(FOV);
        if (!(fov > 0) || Double.isInfinite(fov)) {
            throw new ConfigurationException(FOV + " must be a positive number, got " + fov);
        }
        int sbin = config.requireInt(SBIN);
        if (sbin < 1) {
            throw new ConfigurationException(SBIN + " must be >= 1, got " + sbin);
        }
        return of(fov, sbin);
    }

    public static SpatialBins of(double fov, int sbin) {
        return new SpatialBins(fov, sbin);
    }

    public double fov() {
        return fov;
    }

    public int binsPerAxis() {
        return sbin;
    }

    /// @return the `sbin + 1` edges in ascending order, as a one-column attribute
    public ArrayAttribute edges() {
        return ArrayAttribute.of(edges);
    }

    /// Returns the flat spaxel index `x + sbin * y` of a position, clipping both axis
    /// indices to `[0, sbin - 1]`.
    ///
    /// @param x position along the first axis
    /// @param y position along the second axis
    /// @return flat spaxel index in `[0, sbin * sbin - 1]`
    public int assign(double x, double y) {
        return axisIndex(x) + sbin * axisIndex(y);
    }

    /// @return whether `(x, y)` lies inside the grid, borders included
    public boolean contains(double x, double y) {
        return x >= edges[0] && x <= edges[sbin] && y >= edges[0] && y <= edges[sbin];
    }

    // Number of edges <= value, minus one, clipped
    private int axisIndex(double value) {
        int insertion = Arrays.binarySearch(edges, value);
        int atOrBelow;
        if (insertion >= 0) {
            while (insertion + 1 < edges.length && edges[insertion + 1] == value) {
                insertion++;
            }
            atOrBelow = insertion + 1;
        } else {
            atOrBelow = -insertion - 1;
        }
        return Math.max(0, Math.min(sbin - 1, atOrBelow - 1));
    }

    @Override
    public String toString() {
        return "SpatialBins{fov=" + fov + ", sbin=" + sbin + "}";
    }
}
