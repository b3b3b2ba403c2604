package org.pragmatica.dfmt.chunk;

/**
 * Scoped acquisition of builder or parser state. Closing the guard restores the state that was
 * current when it was acquired; use it with try-with-resources.
 */
@FunctionalInterface
public interface Guard extends AutoCloseable {
    @Override
    void close();
}
