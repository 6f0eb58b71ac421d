package org.drakulus.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.List;

/**
 * Immutable {@link IDMapper} backed by a fastutil open hash map.
 * <p>
 * Safe for concurrent reads once constructed.
 */
public class FastUtilIDMapper implements IDMapper {

    private static final int MISSING = -1;

    // label -> dense index, without boxing on lookup
    private final Object2IntOpenHashMap<String> forward;
    private final String[] reverse;

    /**
     * Builds the mapper from labels in index order.
     *
     * @param labels distinct, non-null labels.
     * @throws IllegalArgumentException on null input, null label or duplicate label.
     */
    public FastUtilIDMapper(List<String> labels) {
        if (labels == null) {
            throw new IllegalArgumentException("Labels cannot be null");
        }
        int size = labels.size();
        this.forward = new Object2IntOpenHashMap<>(size);
        this.forward.defaultReturnValue(MISSING);
        this.reverse = new String[size];

        for (int i = 0; i < size; i++) {
            String label = labels.get(i);
            if (label == null) {
                throw new IllegalArgumentException("Null label at index " + i);
            }
            int previous = forward.put(label, i);
            if (previous != MISSING) {
                throw new IllegalArgumentException("Duplicate label detected: " + label);
            }
            reverse[i] = label;
        }
        this.forward.trim();
    }

    @Override
    public int toInternal(String label) throws UnknownIDException {
        int id = forward.getInt(label);
        if (id == MISSING) {
            throw new UnknownIDException("Vertex label not found: " + label);
        }
        return id;
    }

    @Override
    public String toExternal(int internalId) {
        if (internalId < 0 || internalId >= reverse.length) {
            throw new IndexOutOfBoundsException("Internal ID out of bounds: " + internalId);
        }
        return reverse[internalId];
    }

    @Override
    public int indexOf(String label) {
        return label == null ? MISSING : forward.getInt(label);
    }

    @Override
    public boolean containsExternal(String label) {
        return label != null && forward.containsKey(label);
    }

    @Override
    public int size() {
        return reverse.length;
    }
}
