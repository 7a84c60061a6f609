package work.lcod.summation.runtime;

import work.lcod.summation.table.Table;

/**
 * Offline transform plugged into a specification through a CUSTOM step.
 */
@FunctionalInterface
public interface CustomStep {
    void apply(SummationStep step, Table table);
}
