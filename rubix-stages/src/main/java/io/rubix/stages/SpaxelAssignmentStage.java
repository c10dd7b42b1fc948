package io.rubix.stages;

import static io.rubix.stages.ParticleTypes.COORDS;

import io.rubix.core.config.RubixConfig;
import io.rubix.core.context.ArrayAttribute;
import io.rubix.core.context.Component;
import io.rubix.core.exception.ConfigurationException;
import io.rubix.core.stage.AttributeContract;
import io.rubix.core.stage.StageDefinition;
import io.rubix.core.stage.StageFactory;
import io.rubix.core.stage.StageLogger;
import io.rubix.core.stage.Transform;
import java.util.Set;

/// Assigns every particle to a square spaxel of the telescope grid.
///
/// Applies to each of `stars` and `gas` that is present and holds `coords`. Writes
/// `pixel_assignment` (flat index `x + sbin * y`, one per particle) and
/// `spatial_bin_edges` (the `sbin + 1` grid edges).
///
/// ### Configuration
/// - `telescope/pixel_type`: must be `square`
/// - `telescope/fov`: field of view in coordinate units, > 0
/// - `telescope/sbin`: spaxels per axis, >= 1
///
/// @see SpatialBins for the binning rule
public final class SpaxelAssignmentStage implements StageFactory {

    public static final String NAME = "spaxel_assignment";

    static final String PIXEL_TYPE = "telescope/pixel_type";
    static final String PIXEL_ASSIGNMENT = "pixel_assignment";
    static final String SPATIAL_BIN_EDGES = "spatial_bin_edges";

    private static final AttributeContract CONTRACT =
            AttributeContract.builder()
                    .writes(ParticleTypes.STARS, PIXEL_ASSIGNMENT, SPATIAL_BIN_EDGES)
                    .writes(ParticleTypes.GAS, PIXEL_ASSIGNMENT, SPATIAL_BIN_EDGES)
                    .build();

    public static StageDefinition definition() {
        return new StageDefinition(NAME, new SpaxelAssignmentStage(), CONTRACT);
    }

    @Override
    public Transform create(RubixConfig config, StageLogger log) throws ConfigurationException {
        config.requireOneOf(PIXEL_TYPE, Set.of("square"));
        SpatialBins bins = SpatialBins.fromConfig(config);
        ArrayAttribute edges = bins.edges();
        log.debug(() -> "Spatial grid " + bins);

        return context -> {
            for (String type : ParticleTypes.SUPPORTED) {
                Component component = context.component(type).orElse(null);
                if (component == null || !component.has(COORDS)) {
                    continue;
                }
                component.put(PIXEL_ASSIGNMENT, assign(bins, component.require(COORDS)));
                component.put(SPATIAL_BIN_EDGES, edges);
                log.debug(() -> "Assigned " + component.particleCount() + " " + type + " particles");
            }
            return context;
        };
    }

    static ArrayAttribute assign(SpatialBins bins, ArrayAttribute coords) {
        if (coords.width() < 2) {
            throw new IllegalStateException(
                    "coords must have at least 2 columns, got " + coords.width());
        }
        double[] pixels = new double[coords.rows()];
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] = bins.assign(coords.get(i, 0), coords.get(i, 1));
        }
        return ArrayAttribute.of(pixels);
    }
}
