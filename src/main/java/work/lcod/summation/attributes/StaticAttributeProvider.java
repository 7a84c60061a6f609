package work.lcod.summation.attributes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import work.lcod.summation.table.Column;
import work.lcod.summation.table.Values;

/**
 * Attribute provider backed by an explicit module table, as declared in a configuration file.
 *
 * <p>Each column either looks its value up in the module's attributes or takes it straight
 * from the sample context (module id, column, row).
 */
public final class StaticAttributeProvider implements AttributeProvider {
    private static final Logger logger = LogManager.getLogger(StaticAttributeProvider.class);

    public enum Source {
        ATTRIBUTE,
        MODULE,
        COL,
        ROW;

        public static Source from(String value) {
            if (value == null || value.isBlank()) {
                return ATTRIBUTE;
            }
            try {
                return Source.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                throw new IllegalArgumentException("Unsupported column source: " + value);
            }
        }
    }

    public record ColumnDefinition(Column column, String name, double min, double max, ValueFormat format, Source source) {
        public ColumnDefinition {
            Objects.requireNonNull(column, "column");
            name = name == null ? column.id() : name;
            format = format == null ? ValueFormat.PLAIN : format;
            source = source == null ? Source.ATTRIBUTE : source;
        }
    }

    private final Map<Column, ColumnDefinition> columns;
    private final Map<Long, Map<Column, Integer>> modules;
    private final List<SampleContext> contexts;
    private volatile boolean loaded;

    private StaticAttributeProvider(Map<Column, ColumnDefinition> columns, Map<Long, Map<Column, Integer>> modules) {
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
        this.modules = Collections.unmodifiableMap(new LinkedHashMap<>(modules));
        var all = new ArrayList<SampleContext>(modules.size());
        for (Long moduleId : modules.keySet()) {
            all.add(SampleContext.ofModule(moduleId));
        }
        this.contexts = Collections.unmodifiableList(all);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public void extractColumns(List<Column> requested, SampleContext context, Values out) {
        Map<Column, Integer> attributes = modules.get(context.moduleId());
        for (int i = 0; i < requested.size(); i++) {
            Column column = requested.get(i);
            out.put(column, resolve(column, context, attributes));
        }
    }

    private int resolve(Column column, SampleContext context, Map<Column, Integer> attributes) {
        ColumnDefinition definition = columns.get(column);
        Source source = definition == null ? Source.ATTRIBUTE : definition.source();
        switch (source) {
            case MODULE:
                return context.hasStableIdentity() ? moduleValue(column, context.moduleId()) : Values.UNDEFINED;
            case COL:
                return context.col();
            case ROW:
                return context.row();
            default:
                if (attributes == null) {
                    return Values.UNDEFINED;
                }
                Integer value = attributes.get(column);
                return value == null ? Values.UNDEFINED : value;
        }
    }

    private static int moduleValue(Column column, long moduleId) {
        if (moduleId < Integer.MIN_VALUE || moduleId > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(
                "Module id " + moduleId + " does not fit the integer value of column " + column.id()
            );
        }
        return (int) moduleId;
    }

    @Override
    public String prettyName(Column column) {
        ColumnDefinition definition = columns.get(column);
        return definition == null ? column.id() : definition.name();
    }

    @Override
    public double minValue(Column column) {
        return definition(column).min();
    }

    @Override
    public double maxValue(Column column) {
        return definition(column).max();
    }

    @Override
    public ValueFormat valueFormat(Column column) {
        ColumnDefinition definition = columns.get(column);
        return definition == null ? ValueFormat.PLAIN : definition.format();
    }

    @Override
    public List<SampleContext> allContexts() {
        return contexts;
    }

    @Override
    public boolean loaded() {
        return loaded;
    }

    @Override
    public void load(Map<String, Object> setup) {
        if (loaded) {
            return;
        }
        loaded = true;
        logger.debug("Attribute provider loaded: {} columns, {} modules", columns.size(), modules.size());
    }

    public Map<Column, ColumnDefinition> columns() {
        return columns;
    }

    private ColumnDefinition definition(Column column) {
        ColumnDefinition definition = columns.get(column);
        if (definition == null) {
            throw new IllegalArgumentException("Column not declared: " + column);
        }
        return definition;
    }

    public static final class Builder {
        private final Map<Column, ColumnDefinition> columns = new LinkedHashMap<>();
        private final Map<Long, Map<Column, Integer>> modules = new LinkedHashMap<>();

        public Builder column(String id, String name, double min, double max) {
            return column(new ColumnDefinition(Column.of(id), name, min, max, ValueFormat.PLAIN, Source.ATTRIBUTE));
        }

        public Builder column(ColumnDefinition definition) {
            columns.put(definition.column(), definition);
            return this;
        }

        public Builder module(long moduleId, Map<String, Integer> attributes) {
            if (moduleId == SampleContext.NO_MODULE) {
                throw new IllegalArgumentException("Module id " + SampleContext.NO_MODULE + " is reserved");
            }
            var values = new LinkedHashMap<Column, Integer>();
            attributes.forEach((key, value) -> values.put(Column.of(key), value));
            modules.put(moduleId, values);
            return this;
        }

        public StaticAttributeProvider build() {
            return new StaticAttributeProvider(columns, modules);
        }
    }
}
