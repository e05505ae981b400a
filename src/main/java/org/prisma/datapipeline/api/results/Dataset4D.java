package org.prisma.datapipeline.api.results;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Dense float32 array indexed by (peak, frame, azimuth, measurement), plus the two side
 * sequences that give the frame and azimuth axes their meaning.
 * <p>
 * Missing values are {@code NaN}. The shape is fixed at construction; the only way to grow it is
 * {@link #withMeasurement(String, float[])}, which returns a new dataset with one more column.
 * <p>
 * All values live in one Java array, so a dataset holds at most {@link #MAX_CELLS} values
 * across all four axes. Use {@link #requireCapacity(int, int, int, int)} to reject a larger shape
 * before any work is done.
 * <p>
 * <b>Thread safety:</b> not thread-safe. Concurrent writes to different frame positions are
 * safe because they touch disjoint index ranges of the backing array, which is how the result
 * reducer uses it.
 */
public final class Dataset4D {

    /** Largest array length every current JVM allocates. */
    public static final long MAX_CELLS = Integer.MAX_VALUE - 8;

    private final int peaks;
    private final int frames;
    private final int azimuths;
    private final List<String> columns;
    private final float[] data;
    private final int[] frameNumbers;
    private final double[] azimuthAngles;

    /**
     * Creates a dataset filled with {@code NaN}.
     *
     * @param peaks         number of peaks.
     * @param frameNumbers  global frame index for every frame-axis position.
     * @param azimuthAngles bin centre for every azimuth-axis position.
     * @param columns       measurement column names.
     */
    public Dataset4D(int peaks, int[] frameNumbers, double[] azimuthAngles, List<String> columns) {
        this(peaks, frameNumbers, azimuthAngles, columns,
            filledWithNaN((long) peaks * frameNumbers.length * azimuthAngles.length * columns.size()));
    }

    /**
     * Wraps existing values.
     *
     * @param peaks         number of peaks.
     * @param frameNumbers  global frame index for every frame-axis position.
     * @param azimuthAngles bin centre for every azimuth-axis position.
     * @param columns       measurement column names.
     * @param data          values in (peak, frame, azimuth, measurement) C-order; not copied.
     */
    public Dataset4D(int peaks, int[] frameNumbers, double[] azimuthAngles, List<String> columns, float[] data) {
        long expected = (long) peaks * frameNumbers.length * azimuthAngles.length * columns.size();
        if (data.length != expected) {
            throw new IllegalArgumentException("Data length " + data.length + " does not match shape " + expected);
        }
        this.peaks = peaks;
        this.frames = frameNumbers.length;
        this.azimuths = azimuthAngles.length;
        this.columns = List.copyOf(columns);
        this.data = data;
        this.frameNumbers = frameNumbers.clone();
        this.azimuthAngles = azimuthAngles.clone();
    }

    /**
     * @param peaks        number of peaks.
     * @param frames       number of frames.
     * @param azimuths     number of azimuth bins.
     * @param measurements number of measurement columns.
     * @return the number of values the shape holds.
     * @throws IllegalArgumentException if the shape exceeds {@link #MAX_CELLS}.
     */
    public static long requireCapacity(int peaks, int frames, int azimuths, int measurements) {
        long cells = (long) peaks * frames * azimuths * measurements;
        if (cells > MAX_CELLS) {
            throw new IllegalArgumentException(peaks + " peaks x " + frames + " frames x " + azimuths
                + " azimuth bins x " + measurements + " columns is " + cells + " values, more than the "
                + MAX_CELLS + " one dataset can hold");
        }
        return cells;
    }

    private static float[] filledWithNaN(long size) {
        if (size > MAX_CELLS) {
            throw new IllegalArgumentException("Dataset of " + size + " values exceeds " + MAX_CELLS);
        }
        float[] values = new float[(int) size];
        Arrays.fill(values, Float.NaN);
        return values;
    }

    public int peaks() {
        return peaks;
    }

    public int frames() {
        return frames;
    }

    public int azimuths() {
        return azimuths;
    }

    public int measurements() {
        return columns.size();
    }

    public List<String> columns() {
        return columns;
    }

    /**
     * @param column a measurement column name.
     * @return its position on the measurement axis.
     * @throws IllegalArgumentException if the column does not exist.
     */
    public int columnIndex(String column) {
        int index = columns.indexOf(column);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown measurement column '" + column + "', have " + columns);
        }
        return index;
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public int[] frameNumbers() {
        return frameNumbers.clone();
    }

    public double[] azimuthAngles() {
        return azimuthAngles.clone();
    }

    public int index(int peak, int frame, int azimuth, int measurement) {
        return ((peak * frames + frame) * azimuths + azimuth) * columns.size() + measurement;
    }

    public float get(int peak, int frame, int azimuth, int measurement) {
        return data[index(peak, frame, azimuth, measurement)];
    }

    public void set(int peak, int frame, int azimuth, int measurement, float value) {
        data[index(peak, frame, azimuth, measurement)] = value;
    }

    /**
     * @return the backing array in (peak, frame, azimuth, measurement) C-order.
     */
    public float[] data() {
        return data;
    }

    /**
     * Copies a frame worker's azimuth-major block into one frame position.
     *
     * @param frame  frame-axis position.
     * @param result the block; its measurement count must not exceed this dataset's.
     */
    public void putFrame(int frame, FrameResult result) {
        if (result.azimuths() != azimuths || result.peaks() != peaks || result.measurements() > columns.size()) {
            throw new IllegalArgumentException("Frame block " + result.azimuths() + "x" + result.peaks() + "x"
                + result.measurements() + " does not fit dataset " + azimuths + "x" + peaks + "x" + columns.size());
        }
        for (int p = 0; p < peaks; p++) {
            for (int a = 0; a < azimuths; a++) {
                for (int m = 0; m < result.measurements(); m++) {
                    data[index(p, frame, a, m)] = result.value(a, p, m);
                }
            }
        }
    }

    /**
     * Copies one frame position from another dataset with the same peak and azimuth axes.
     * Columns are matched by name; columns the source lacks are left untouched.
     *
     * @param frame       target frame-axis position.
     * @param source      the source dataset.
     * @param sourceFrame frame-axis position in the source.
     */
    public void copyFrame(int frame, Dataset4D source, int sourceFrame) {
        if (source.peaks != peaks || source.azimuths != azimuths) {
            throw new IllegalArgumentException("Source dataset has " + source.peaks + "x" + source.azimuths
                + " peaks x azimuths, expected " + peaks + "x" + azimuths);
        }
        if (source.columns.equals(columns)) {
            int run = azimuths * columns.size();
            for (int p = 0; p < peaks; p++) {
                System.arraycopy(source.data, source.index(p, sourceFrame, 0, 0), data, index(p, frame, 0, 0), run);
            }
            return;
        }
        for (int m = 0; m < columns.size(); m++) {
            int sm = source.columns.indexOf(columns.get(m));
            if (sm < 0) {
                continue;
            }
            for (int p = 0; p < peaks; p++) {
                for (int a = 0; a < azimuths; a++) {
                    data[index(p, frame, a, m)] = source.data[source.index(p, sourceFrame, a, sm)];
                }
            }
        }
    }

    /**
     * Extracts one measurement column.
     *
     * @param column column name.
     * @return values in (peak, frame, azimuth) C-order.
     */
    public float[] column(String column) {
        int m = columnIndex(column);
        float[] values = new float[peaks * frames * azimuths];
        int stride = columns.size();
        for (int i = 0; i < values.length; i++) {
            values[i] = data[i * stride + m];
        }
        return values;
    }

    /**
     * Returns a dataset with an additional measurement column, or with the column replaced if it
     * already exists.
     *
     * @param column column name.
     * @param values values in (peak, frame, azimuth) C-order.
     * @return the extended dataset.
     */
    public Dataset4D withMeasurement(String column, float[] values) {
        int cells = peaks * frames * azimuths;
        if (values.length != cells) {
            throw new IllegalArgumentException("Column has " + values.length + " values, expected " + cells);
        }
        if (hasColumn(column)) {
            Dataset4D copy = copy();
            int m = columnIndex(column);
            for (int i = 0; i < cells; i++) {
                copy.data[i * columns.size() + m] = values[i];
            }
            return copy;
        }
        List<String> extended = new ArrayList<>(columns);
        extended.add(column);
        int oldStride = columns.size();
        int newStride = extended.size();
        float[] grown = new float[cells * newStride];
        for (int i = 0; i < cells; i++) {
            System.arraycopy(data, i * oldStride, grown, i * newStride, oldStride);
            grown[i * newStride + oldStride] = values[i];
        }
        return new Dataset4D(peaks, frameNumbers, azimuthAngles, extended, grown);
    }

    /**
     * @return an independent copy.
     */
    public Dataset4D copy() {
        return new Dataset4D(peaks, frameNumbers, azimuthAngles, columns, data.clone());
    }

    /**
     * @return the number of (peak, frame, azimuth) cells.
     */
    public int cellCount() {
        return peaks * frames * azimuths;
    }

    /**
     * @param column column name.
     * @return the number of cells whose value in that column is {@code NaN}.
     */
    public int missingCount(String column) {
        int m = columnIndex(column);
        int missing = 0;
        int stride = columns.size();
        for (int i = 0; i < cellCount(); i++) {
            if (Float.isNaN(data[i * stride + m])) {
                missing++;
            }
        }
        return missing;
    }
}
