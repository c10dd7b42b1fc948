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
import java.util.List;

/// Masks particles that fall outside the telescope aperture.
///
/// For every component in `data/args/particle_type`, writes `mask` (1 inside the grid,
/// 0 outside, borders inside) and zeroes the rows of outside particles in each of
/// {@link #MASKED_ATTRIBUTES} that is present. `coords` and `velocity` are left as they are.
///
/// Reads `telescope/fov` and `telescope/sbin` to rebuild the same grid as
/// {@link SpaxelAssignmentStage}.
public final class ApertureFilterStage implements StageFactory {

    public static final String NAME = "filter_particles";

    /// Attributes zeroed for particles outside the aperture.
    public static final List<String> MASKED_ATTRIBUTES =
            List.of("mass", "age", "metallicity", SpaxelAssignmentStage.PIXEL_ASSIGNMENT);

    static final String MASK = "mask";

    private static final AttributeContract CONTRACT = contract();

    public static StageDefinition definition() {
        return new StageDefinition(NAME, new ApertureFilterStage(), CONTRACT);
    }

    private static AttributeContract contract() {
        AttributeContract.Builder builder = AttributeContract.builder();
        for (String type : ParticleTypes.SUPPORTED) {
            builder.writes(type, MASK);
            builder.writes(type, MASKED_ATTRIBUTES.toArray(new String[0]));
        }
        return builder.build();
    }

    @Override
    public Transform create(RubixConfig config, StageLogger log) throws ConfigurationException {
        SpatialBins bins = SpatialBins.fromConfig(config);
        List<String> types = ParticleTypes.require(config);

        return context -> {
            for (String type : types) {
                Component component = context.require(type);
                double[] mask = mask(bins, component.require(COORDS));
                for (String attribute : MASKED_ATTRIBUTES) {
                    if (component.has(attribute)) {
                        component.put(attribute, applyMask(component.require(attribute), mask));
                    }
                }
                component.put(MASK, ArrayAttribute.of(mask));
                if (log.isDebugEnabled()) {
                    long inside = 0;
                    for (double m : mask) {
                        inside += (long) m;
                    }
                    log.debug(type + ": " + inside + " of " + mask.length + " particles inside aperture");
                }
            }
            return context;
        };
    }

    static double[] mask(SpatialBins bins, ArrayAttribute coords) {
        double[] mask = new double[coords.rows()];
        for (int i = 0; i < mask.length; i++) {
            mask[i] = bins.contains(coords.get(i, 0), coords.get(i, 1)) ? 1 : 0;
        }
        return mask;
    }

    static ArrayAttribute applyMask(ArrayAttribute values, double[] mask) {
        if (values.rows() != mask.length) {
            throw new IllegalStateException(
                    "Attribute has " + values.rows() + " rows, mask has " + mask.length);
        }
        double[] data = values.toArray();
        int width = values.width();
        for (int row = 0; row < mask.length; row++) {
            if (mask[row] == 0) {
                for (int col = 0; col < width; col++) {
                    data[row * width + col] = 0;
                }
            }
        }
        return ArrayAttribute.ofRows(width, data);
    }
}
