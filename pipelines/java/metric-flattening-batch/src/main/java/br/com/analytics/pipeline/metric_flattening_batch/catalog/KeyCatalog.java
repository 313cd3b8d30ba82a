package br.com.analytics.pipeline.metric_flattening_batch.catalog;

import br.com.analytics.pipeline.metric_flattening_batch.exception.InvalidCatalogException;
import br.com.analytics.pipeline.metric_flattening_batch.model.MetricKind;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Immutable mapping from metric key to column slot, one ordered key list per {@link MetricKind}.
 * Slot {@code i} of a kind is stored in column {@code <prefix>(i + 1)}.
 */
public final class KeyCatalog {

    public static final int FORMAT_VERSION = 1;

    /**
     * Unicode code point order, which matches the byte order of UTF-8 encoded keys.
     */
    public static final Comparator<String> CODE_POINT_ORDER = (a, b) -> {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            int ca = a.codePointAt(i);
            int cb = b.codePointAt(j);
            if (ca != cb) {
                return Integer.compare(ca, cb);
            }
            i += Character.charCount(ca);
            j += Character.charCount(cb);
        }
        return Integer.compare(a.length() - i, b.length() - j);
    };

    private final DiscoveryScope scope;
    private final Instant generatedAt;
    private final List<String> intKeys;
    private final List<String> floatKeys;
    private final Map<String, Integer> intSlots;
    private final Map<String, Integer> floatSlots;

    public KeyCatalog(DiscoveryScope scope, Instant generatedAt, List<String> orderedIntKeys, List<String> orderedFloatKeys) {
        this.scope = Objects.requireNonNull(scope, "scope");
        this.generatedAt = Objects.requireNonNull(generatedAt, "generatedAt");
        this.intKeys = List.copyOf(orderedIntKeys);
        this.floatKeys = List.copyOf(orderedFloatKeys);
        this.intSlots = indexSlots(MetricKind.INT, intKeys);
        this.floatSlots = indexSlots(MetricKind.FLOAT, floatKeys);
    }

    public static KeyCatalog fromDiscoveredKeys(DiscoveryScope scope, Instant generatedAt,
                                                Collection<String> intKeys, Collection<String> floatKeys) {
        return new KeyCatalog(scope, generatedAt, sorted(intKeys), sorted(floatKeys));
    }

    private static List<String> sorted(Collection<String> keys) {
        TreeSet<String> ordered = new TreeSet<>(CODE_POINT_ORDER);
        ordered.addAll(keys);
        return List.copyOf(ordered);
    }

    private static Map<String, Integer> indexSlots(MetricKind kind, List<String> keys) {
        Map<String, Integer> slots = new HashMap<>(keys.size() * 2);
        for (int slot = 0; slot < keys.size(); slot++) {
            String key = keys.get(slot);
            if (key.isBlank()) {
                throw new InvalidCatalogException("Blank " + kind + " key at slot " + slot);
            }
            Integer previous = slots.putIfAbsent(key, slot);
            if (previous != null) {
                throw new InvalidCatalogException("Duplicate " + kind + " key '" + key
                        + "' at slots " + previous + " and " + slot);
            }
        }
        return Collections.unmodifiableMap(slots);
    }

    public DiscoveryScope scope() {
        return scope;
    }

    public Instant generatedAt() {
        return generatedAt;
    }

    public List<String> keys(MetricKind kind) {
        return kind == MetricKind.INT ? intKeys : floatKeys;
    }

    public int size(MetricKind kind) {
        return keys(kind).size();
    }

    /**
     * @return the zero-based slot of {@code key}, or -1 when the catalog does not know it
     */
    public int slotOf(MetricKind kind, String key) {
        Integer slot = (kind == MetricKind.INT ? intSlots : floatSlots).get(key);
        return slot == null ? -1 : slot;
    }

    public boolean contains(MetricKind kind, String key) {
        return slotOf(kind, key) >= 0;
    }

    public String columnFor(MetricKind kind, String key) {
        int slot = slotOf(kind, key);
        return slot < 0 ? null : kind.columnName(slot);
    }

    /**
     * Same scope and same key-to-slot assignments, whenever each catalog was generated.
     */
    public boolean sameMapping(KeyCatalog other) {
        return scope.equals(other.scope)
                && intKeys.equals(other.intKeys)
                && floatKeys.equals(other.floatKeys);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        KeyCatalog that = (KeyCatalog) o;
        return scope.equals(that.scope)
                && generatedAt.equals(that.generatedAt)
                && intKeys.equals(that.intKeys)
                && floatKeys.equals(that.floatKeys);
    }

    @Override
    public int hashCode() {
        return Objects.hash(scope, generatedAt, intKeys, floatKeys);
    }

    @Override
    public String toString() {
        return "KeyCatalog{" + scope.sourceTable() + " " + scope.window()
                + ", int=" + intKeys.size() + ", float=" + floatKeys.size() + "}";
    }
}
