package org.prisma.datapipeline.api.results;

import java.util.List;

/**
 * Names of the measurement axis.
 */
public final class MeasurementColumns {

    public static final String POSITION = "pos";
    public static final String AREA = "area";
    public static final String SIGMA = "sigma";
    public static final String GAMMA = "gamma";
    public static final String D_SPACING = "d";
    public static final String STRAIN = "strain";
    public static final String ABS_STRAIN = "abs strain";

    /** Columns produced by the frame worker, in storage order. */
    public static final List<String> BASE = List.of(POSITION, AREA, SIGMA, GAMMA, D_SPACING);

    private MeasurementColumns() {
    }

    /**
     * @param column a measurement column name.
     * @return the name of its frame-to-frame difference column.
     */
    public static String delta(String column) {
        return "delta " + column;
    }
}
