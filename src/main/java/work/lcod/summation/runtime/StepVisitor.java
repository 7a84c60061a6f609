package work.lcod.summation.runtime;

/**
 * Callback for {@link SummationSpecification#walk}. Returning {@code false} stops the walk.
 */
@FunctionalInterface
public interface StepVisitor {
    boolean visit(int index, SummationStep step);
}
