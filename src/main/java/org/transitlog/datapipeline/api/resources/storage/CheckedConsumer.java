package org.transitlog.datapipeline.api.resources.storage;

/**
 * A consumer that can throw checked exceptions.
 * <p>
 * Used by the streaming scans of the store and of partition files so that callbacks can
 * write to a partition (which throws {@link java.io.IOException}) without wrapping.
 *
 * @param <T> the type of the input to the operation
 */
@FunctionalInterface
public interface CheckedConsumer<T> {

    /**
     * Performs this operation on the given argument.
     *
     * @param t the input argument
     * @throws Exception if the operation fails
     */
    void accept(T t) throws Exception;
}
