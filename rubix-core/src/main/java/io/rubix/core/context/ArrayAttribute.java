package io.rubix.core.context;

import java.util.Arrays;
import java.util.Objects;

/// Array-valued particle attribute stored row-major as a flat `double[]`.
///
/// Each row describes one particle; `width` is the number of values per row
/// (1 for scalars per particle such as mass, 3 for coordinates or velocities).
/// The shape `(rows, width)` is part of the structural key used by the
/// compiled pipeline form.
///
/// ### Contracts
/// - **Invariant**: `values.length % width == 0`, `width >= 1`
/// - **Invariant**: equality is bitwise on the array contents, so `NaN` equals `NaN`
///   and `-0.0` differs from `0.0`
///
/// @implNote Immutable. The backing array is copied on the way in and out, so
/// context copies share attribute instances.
public final class ArrayAttribute {

    private final double[] values;
    private final int width;

    private ArrayAttribute(double[] values, int width) {
        if (width < 1) {
            throw new IllegalArgumentException("width must be >= 1, got " + width);
        }
        if (values.length % width != 0) {
            throw new IllegalArgumentException(
                    "values length " + values.length + " is not a multiple of width " + width);
        }
        this.values = values;
        this.width = width;
    }

    /// Creates a one-value-per-particle attribute.
    ///
    /// @param values per-particle values, not null
    /// @return new attribute, never null
    public static ArrayAttribute of(double... values) {
        Objects.requireNonNull(values, "values must not be null");
        return new ArrayAttribute(values.clone(), 1);
    }

    /// Creates a multi-valued attribute from row-major values.
    ///
    /// @param width values per particle, must be >= 1
    /// @param values row-major values, length must be a multiple of `width`, not null
    /// @return new attribute, never null
    public static ArrayAttribute ofRows(int width, double... values) {
        Objects.requireNonNull(values, "values must not be null");
        return new ArrayAttribute(values.clone(), width);
    }

    /// Creates a multi-valued attribute from a two-dimensional array.
    ///
    /// @param rows one array per particle, all of equal non-zero length, not null
    /// @return new attribute, never null
    /// @throws IllegalArgumentException if rows are ragged or empty
    public static ArrayAttribute ofRows(double[][] rows) {
        Objects.requireNonNull(rows, "rows must not be null");
        if (rows.length == 0) {
            throw new IllegalArgumentException("rows must not be empty");
        }
        int width = rows[0].length;
        double[] flat = new double[rows.length * width];
        for (int i = 0; i < rows.length; i++) {
            if (rows[i].length != width) {
                throw new IllegalArgumentException(
                        "row " + i + " has length " + rows[i].length + ", expected " + width);
            }
            System.arraycopy(rows[i], 0, flat, i * width, width);
        }
        return new ArrayAttribute(flat, width);
    }

    /// Creates a zero-filled attribute.
    ///
    /// @param rows number of particles, must be >= 0
    /// @param width values per particle, must be >= 1
    /// @return new attribute, never null
    public static ArrayAttribute zeros(int rows, int width) {
        return new ArrayAttribute(new double[rows * width], width);
    }

    public int rows() {
        return values.length / width;
    }

    public int width() {
        return width;
    }

    public int size() {
        return values.length;
    }

    /// @param row particle index
    /// @param column value index within the row
    /// @return the value at the given position
    public double get(int row, int column) {
        if (column < 0 || column >= width) {
            throw new IndexOutOfBoundsException("column " + column + " outside width " + width);
        }
        return values[row * width + column];
    }

    /// @param index flat row-major index
    /// @return the value at the given position
    public double get(int index) {
        return values[index];
    }

    /// Returns a copy of the row-major values.
    ///
    /// @return fresh array, never null
    public double[] toArray() {
        return values.clone();
    }

    /// Returns a copy of one particle's values.
    ///
    /// @param row particle index
    /// @return fresh array of length `width`, never null
    public double[] row(int row) {
        return Arrays.copyOfRange(values, row * width, (row + 1) * width);
    }

    /// Returns the shape of this attribute as `{rows, width}`.
    ///
    /// @return fresh two-element array, never null
    public int[] shape() {
        return new int[] {rows(), width};
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArrayAttribute)) return false;
        ArrayAttribute that = (ArrayAttribute) o;
        return width == that.width && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(values) + width;
    }

    @Override
    public String toString() {
        return "ArrayAttribute{rows=" + rows() + ", width=" + width + "}";
    }
}
