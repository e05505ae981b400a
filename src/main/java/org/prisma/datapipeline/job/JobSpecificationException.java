package org.prisma.datapipeline.job;

/**
 * Thrown when a job specification is malformed. Always names the offending field so the
 * recipe author can fix it without reading a stack trace.
 */
public class JobSpecificationException extends RuntimeException {

    private final String field;

    /**
     * @param field   the recipe key that failed validation.
     * @param message what is wrong with it.
     */
    public JobSpecificationException(String field, String message) {
        super("Invalid job specification field '" + field + "': " + message);
        this.field = field;
    }

    /**
     * @param field   the recipe key that failed validation.
     * @param message what is wrong with it.
     * @param cause   the underlying parse error.
     */
    public JobSpecificationException(String field, String message, Throwable cause) {
        super("Invalid job specification field '" + field + "': " + message, cause);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
