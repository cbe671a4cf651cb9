package com.bbthechange.carshare.util;

import com.bbthechange.carshare.exception.VersionConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Read-modify-write loop over a compare-and-set repository update.
 *
 * Each attempt reloads the item, so the mutation always sees current state and may throw
 * a domain exception (for example a conflict) to stop without writing anything.
 */
public final class OptimisticRetry {

    private static final Logger logger = LoggerFactory.getLogger(OptimisticRetry.class);

    public static final int MAX_RETRIES = 5;

    private OptimisticRetry() {
        // Utility class
    }

    public static <T> T update(String description, Supplier<T> loader, Consumer<T> mutation, UnaryOperator<T> writer) {
        for (int attempt = 1; attempt <= MAX_RETRIES; attempt++) {
            T current = loader.get();
            mutation.accept(current);
            try {
                return writer.apply(current);
            } catch (VersionConflictException e) {
                logger.debug("Version conflict updating {} (attempt {}/{}): {}", description, attempt, MAX_RETRIES, e.getMessage());
            }
        }
        logger.warn("Max retries exceeded updating {} after {} attempts", description, MAX_RETRIES);
        throw new VersionConflictException("Failed to update " + description + " after " + MAX_RETRIES
                + " attempts due to concurrent modifications");
    }
}
