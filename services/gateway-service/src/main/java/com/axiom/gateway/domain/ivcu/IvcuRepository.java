package com.axiom.gateway.domain.ivcu;

import java.util.Optional;
import java.util.UUID;

/** Port for IVCU storage. IVCUs are never deleted. */
public interface IvcuRepository {

    /** Stores a new IVCU together with its ordered parent ids. */
    void insert(Ivcu ivcu);

    /**
     * Persists status, code, model, confidence and update time of an existing IVCU, provided it
     * is still in {@code expectedStatus}.
     *
     * @throws com.axiom.gateway.domain.error.StaleIvcuException if the stored status differs
     */
    void update(Ivcu ivcu, IvcuStatus expectedStatus);

    Optional<Ivcu> findById(UUID id);
}
