package com.axiom.gateway.infrastructure.persistence;

import com.axiom.gateway.domain.error.PersistenceException;
import java.util.function.Supplier;
import org.springframework.dao.DataAccessException;

/** Translates Spring data access failures into the domain's {@link PersistenceException}. */
final class JdbcErrors {

    private JdbcErrors() {
    }

    static <T> T translate(String action, Supplier<T> work) {
        try {
            return work.get();
        } catch (DataAccessException e) {
            throw new PersistenceException("failed to " + action, e);
        }
    }

    static void run(String action, Runnable work) {
        translate(action, () -> {
            work.run();
            return null;
        });
    }
}
