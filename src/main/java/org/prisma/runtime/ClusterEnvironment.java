package org.prisma.runtime;

import java.util.List;
import java.util.Map;

/**
 * Multi-node launch context read from the environment set by MPI launchers.
 *
 * @param rank   raw rank value, or {@code null}
 * @param size   raw size value, or {@code null}
 * @param jobKey batch job identifier shared by all ranks of one launch
 */
public record ClusterEnvironment(String rank, String size, String jobKey) {

    static final List<String> RANK_VARIABLES = List.of(
        "PMI_RANK", "OMPI_COMM_WORLD_RANK", "MV2_COMM_WORLD_RANK", "PMIX_RANK", "MPI_LOCALRANKID");
    static final List<String> SIZE_VARIABLES = List.of(
        "PMI_SIZE", "OMPI_COMM_WORLD_SIZE", "MV2_COMM_WORLD_SIZE", "PMIX_SIZE");
    static final List<String> JOB_VARIABLES = List.of("PBS_JOBID", "SLURM_JOB_ID", "PRISMA_JOB_KEY");

    /** Minimum ranks for a distributed run: coordinator, submitter, one worker. */
    public static final int MIN_SIZE = 3;

    public static ClusterEnvironment detect(Map<String, String> environment) {
        String jobKey = first(environment, JOB_VARIABLES);
        return new ClusterEnvironment(first(environment, RANK_VARIABLES), first(environment, SIZE_VARIABLES),
            jobKey == null ? "local" : jobKey.replaceAll("[^A-Za-z0-9._-]", "_"));
    }

    /**
     * @return true if any launcher variable is set.
     */
    public boolean isPresent() {
        return rank != null || size != null;
    }

    /**
     * @return the parsed rank.
     * @throws IllegalStateException if the rank is absent or not a non-negative integer.
     */
    public int parsedRank() {
        return parse("rank", rank);
    }

    /**
     * @return the parsed size.
     * @throws IllegalStateException if the size is absent or not a non-negative integer.
     */
    public int parsedSize() {
        return parse("size", size);
    }

    private static int parse(String what, String value) {
        if (value == null) {
            throw new IllegalStateException("launch context has no " + what);
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < 0) {
                throw new IllegalStateException("negative " + what + " " + parsed);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalStateException(what + " '" + value + "' is not a number");
        }
    }

    private static String first(Map<String, String> environment, List<String> names) {
        for (String name : names) {
            String value = environment.get(name);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
