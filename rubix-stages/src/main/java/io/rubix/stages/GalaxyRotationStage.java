package io.rubix.stages;

import static io.rubix.stages.ParticleTypes.COORDS;
import static io.rubix.stages.ParticleTypes.VELOCITY;

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
import java.util.Set;

/// Rotates particle coordinates and velocities by fixed Euler angles.
///
/// ### Configuration
/// | Key                         | Meaning                                                |
/// |-----------------------------|--------------------------------------------------------|
/// | `galaxy/rotation/type`      | `face-on` (0, 0, 0) or `edge-on` (90, 0, 0)            |
/// | `galaxy/rotation/alpha`     | rotation about x in degrees, required without `type`   |
/// | `galaxy/rotation/beta`      | rotation about y in degrees, required without `type`   |
/// | `galaxy/rotation/gamma`     | rotation about z in degrees, required without `type`   |
/// | `data/args/particle_type`   | components to rotate, subset of `stars`, `gas`         |
///
/// `type` takes precedence over explicit angles. The rotation matrix is
/// `R = Rz(gamma) * Ry(beta) * Rx(alpha)` applied to each particle as a column vector.
///
/// ### Contracts
/// - **Precondition**: every configured component holds `coords` and `velocity`, both of
///   width 3; otherwise the stage fails when it runs
/// - **Postcondition**: vector lengths are preserved; no other attribute is touched
public final class GalaxyRotationStage implements StageFactory {

    public static final String NAME = "rotate_galaxy";

    static final String ROTATION = "galaxy/rotation";
    static final String FACE_ON = "face-on";
    static final String EDGE_ON = "edge-on";

    private static final AttributeContract CONTRACT =
            AttributeContract.builder()
                    .writes(ParticleTypes.STARS, COORDS, VELOCITY)
                    .writes(ParticleTypes.GAS, COORDS, VELOCITY)
                    .build();

    public static StageDefinition definition() {
        return new StageDefinition(NAME, new GalaxyRotationStage(), CONTRACT);
    }

    @Override
    public Transform create(RubixConfig config, StageLogger log) throws ConfigurationException {
        double[] angles = angles(config);
        List<String> types = ParticleTypes.require(config);
        double[][] matrix = rotationMatrix(angles[0], angles[1], angles[2]);
        log.debug(() -> "Rotation matrix prepared for " + types);

        return context -> {
            log.info(
                    "Rotating galaxy with alpha="
                            + angles[0]
                            + ", beta="
                            + angles[1]
                            + ", gamma="
                            + angles[2]);
            for (String type : types) {
                Component component = context.require(type);
                component.put(COORDS, rotate(matrix, type, COORDS, component.require(COORDS)));
                component.put(
                        VELOCITY, rotate(matrix, type, VELOCITY, component.require(VELOCITY)));
            }
            return context;
        };
    }

    /// Resolves the Euler angles from `galaxy/rotation`.
    ///
    /// @param config full configuration, not null
    /// @return `{alpha, beta, gamma}` in degrees, never null
    /// @throws ConfigurationException if the section is missing, `type` is not one of
    ///     `face-on`/`edge-on`, or, without `type`, any angle is missing
    static double[] angles(RubixConfig config) throws ConfigurationException {
        config.section(ROTATION);
        if (config.contains(ROTATION + "/type")) {
            String type = config.requireOneOf(ROTATION + "/type", Set.of(FACE_ON, EDGE_ON));
            return FACE_ON.equals(type) ? new double[] {0, 0, 0} : new double[] {90, 0, 0};
        }
        double[] angles = new double[3];
        String[] keys = {"alpha", "beta", "gamma"};
        for (int i = 0; i < keys.length; i++) {
            if (!config.contains(ROTATION + "/" + keys[i])) {
                throw new ConfigurationException(
                        keys[i] + " not provided in " + ROTATION + ", set either type or all angles");
            }
            angles[i] = config.requireDouble(ROTATION + "/" + keys[i]);
        }
        return angles;
    }

    /// Builds `Rz(gamma) * Ry(beta) * Rx(alpha)`.
    ///
    /// @param alpha rotation about x in degrees
    /// @param beta rotation about y in degrees
    /// @param gamma rotation about z in degrees
    /// @return row-major 3x3 matrix, never null
    public static double[][] rotationMatrix(double alpha, double beta, double gamma) {
        double a = Math.toRadians(alpha);
        double b = Math.toRadians(beta);
        double g = Math.toRadians(gamma);
        double[][] rx = {{1, 0, 0}, {0, Math.cos(a), -Math.sin(a)}, {0, Math.sin(a), Math.cos(a)}};
        double[][] ry = {{Math.cos(b), 0, Math.sin(b)}, {0, 1, 0}, {-Math.sin(b), 0, Math.cos(b)}};
        double[][] rz = {{Math.cos(g), -Math.sin(g), 0}, {Math.sin(g), Math.cos(g), 0}, {0, 0, 1}};
        return multiply(rz, multiply(ry, rx));
    }

    private static double[][] multiply(double[][] left, double[][] right) {
        double[][] result = new double[3][3];
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                for (int k = 0; k < 3; k++) {
                    result[i][j] += left[i][k] * right[k][j];
                }
            }
        }
        return result;
    }

    static ArrayAttribute rotate(
            double[][] matrix, String component, String attribute, ArrayAttribute vectors) {
        if (vectors.width() != 3) {
            throw new IllegalStateException(
                    component + "." + attribute + " must have width 3, got " + vectors.width());
        }
        double[] in = vectors.toArray();
        double[] out = new double[in.length];
        for (int row = 0; row < vectors.rows(); row++) {
            int base = row * 3;
            for (int i = 0; i < 3; i++) {
                out[base + i] =
                        matrix[i][0] * in[base]
                                + matrix[i][1] * in[base + 1]
                                + matrix[i][2] * in[base + 2];
            }
        }
        return ArrayAttribute.ofRows(3, out);
    }
}
