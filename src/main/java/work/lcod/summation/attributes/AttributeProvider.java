package work.lcod.summation.attributes;

import java.util.List;
import java.util.Map;
import work.lcod.summation.table.Column;
import work.lcod.summation.table.Values;

/**
 * Maps sample contexts to categorical keys and describes the columns it knows about.
 *
 * <p>Implementations are shared between managers: they must be read-only once
 * {@link #load(Map)} returned.
 */
public interface AttributeProvider {
    /**
     * Writes the values of {@code columns} for {@code context} into {@code out}, in the order of
     * {@code columns}. Columns that cannot be resolved for the context are written as
     * {@link Values#UNDEFINED}. The result depends only on the arguments.
     */
    void extractColumns(List<Column> columns, SampleContext context, Values out);

    default Values extractColumns(List<Column> columns, SampleContext context) {
        var out = new Values();
        extractColumns(columns, context, out);
        return out;
    }

    String prettyName(Column column);

    double minValue(Column column);

    double maxValue(Column column);

    default ValueFormat valueFormat(Column column) {
        return ValueFormat.PLAIN;
    }

    /** Every context a sample can come from; used to enumerate the booking domain. */
    List<SampleContext> allContexts();

    boolean loaded();

    void load(Map<String, Object> setup);
}
