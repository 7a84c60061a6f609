package work.lcod.summation.runtime;

/**
 * Construction-time bug in a specification or a disagreement between booking and filling.
 * Not recoverable: the aggregation state is undefined once this is thrown.
 */
public final class SpecificationException extends RuntimeException {
    public static final String ILLEGAL_STEP = "illegal_step";
    public static final String BOOKING_MISMATCH = "booking_mismatch";
    public static final String MISSING_HISTOGRAM = "missing_histogram";
    public static final String COUNTER_CONFLICT = "counter_conflict";

    private final String code;

    public SpecificationException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
