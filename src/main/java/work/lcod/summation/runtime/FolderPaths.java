package work.lcod.summation.runtime;

import java.util.Map;
import java.util.Objects;
import work.lcod.summation.attributes.AttributeProvider;
import work.lcod.summation.table.Column;
import work.lcod.summation.table.Values;

/**
 * Derives the storage folder of a key: {@code <top>/<name>[_<value>]/.../}.
 *
 * <p>Booking and reloading both go through this class, so the result must only depend on the
 * key and the provider's column descriptions.
 */
public final class FolderPaths {
    private static final Map<Integer, String> QUADRANT_CODES = Map.of(
        11, "_mI",
        12, "_mO",
        21, "_pI",
        22, "_pO"
    );

    private final AttributeProvider provider;
    private final String topFolder;

    public FolderPaths(AttributeProvider provider, String topFolder) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.topFolder = topFolder == null ? "" : topFolder;
    }

    public String folder(Values key) {
        var dir = new StringBuilder(topFolder).append('/');
        for (int i = 0; i < key.size(); i++) {
            Column column = key.column(i);
            String name = provider.prettyName(column);
            if (name == null || name.isEmpty()) {
                continue;
            }
            dir.append(name).append(formatValue(column, key.value(i))).append('/');
        }
        return dir.toString();
    }

    public String path(Values key, String name) {
        return folder(key) + name;
    }

    private String formatValue(Column column, int value) {
        if (value == Values.UNDEFINED) {
            return "_UNDEFINED";
        }
        switch (provider.valueFormat(column)) {
            case QUADRANT:
                return QUADRANT_CODES.getOrDefault(value, "");
            case SIGNED:
                if (value > 0) {
                    return "_+" + value;
                }
                return value == 0 ? "" : "_" + value;
            default:
                return value == 0 ? "" : "_" + value;
        }
    }
}
