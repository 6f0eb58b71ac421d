package org.drakulus.core.id;

import lombok.experimental.StandardException;

import java.util.List;

/**
 * Bidirectional mapping between vertex labels and dense integer vertex ids.
 */
public interface IDMapper {

    /**
     * Converts a vertex label to its dense index.
     * @param label The client-facing vertex label.
     * @return The dense index in {@code [0, size)}.
     * @throws UnknownIDException If the label is not mapped.
     */
    int toInternal(String label) throws UnknownIDException;

    /**
     * Converts a dense index back to its vertex label.
     * @param internalId The dense index.
     * @return The vertex label.
     * @throws IndexOutOfBoundsException If the index is invalid.
     */
    String toExternal(int internalId);

    /**
     * Returns the dense index of a label, or {@code -1} when the label is not mapped.
     *
     * @param label vertex label to look up.
     * @return dense index or {@code -1}.
     */
    int indexOf(String label);

    /**
     * Checks whether a label has a mapped dense index.
     *
     * @param label label to test.
     * @return true when the label is present.
     */
    boolean containsExternal(String label);

    /**
     * Returns number of mapped labels.
     *
     * @return total mapping size.
     */
    int size();

    /**
     * Exception thrown when a vertex label cannot be found in the mapping.
     */
    @StandardException
    class UnknownIDException extends RuntimeException {
    }

    /**
     * Creates the default immutable mapper. Label at position {@code i} gets index {@code i}.
     *
     * @param labels distinct labels in index order.
     * @return An immutable IDMapper instance.
     */
    static IDMapper createImmutable(List<String> labels) {
        return new FastUtilIDMapper(labels);
    }
}
