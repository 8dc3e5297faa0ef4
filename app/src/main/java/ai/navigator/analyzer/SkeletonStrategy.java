package ai.navigator.analyzer;

import ai.navigator.exception.ParseException;

/**
 * Turns file content into a skeleton. Implementations must be pure: the same {@code (fileName, content)} always
 * yields an equal result, and no state is shared between calls on different threads.
 */
@FunctionalInterface
public interface SkeletonStrategy {

    /**
     * @param fileName file name used in the skeleton header only
     * @param content raw file bytes
     * @throws ParseException if the content cannot be processed
     */
    Skeleton extract(String fileName, byte[] content);
}
