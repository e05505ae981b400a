package org.prisma.datapipeline.api.job;

import java.util.Locale;

/**
 * Experiment stage a recipe was recorded in.
 */
public enum Stage {
    BEF,
    AFT,
    CONT,
    DELT,
    DELTDSPACING;

    /**
     * Parses a stage label case-insensitively.
     *
     * @param value the label from the recipe.
     * @return the stage.
     * @throws IllegalArgumentException if the label is not a known stage.
     */
    public static Stage parse(String value) {
        return Stage.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
