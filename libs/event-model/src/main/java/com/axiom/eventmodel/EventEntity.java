package com.axiom.eventmodel;

/**
 * The domain entity an event relates to.
 *
 * @param entityType the kind of entity, e.g. "Ivcu", "ProofCertificate"
 * @param entityId unique identifier of the entity instance
 * @param sequence per-entity ordering hint (e.g. the IVCU version); 0 when not applicable
 */
public record EventEntity(String entityType, String entityId, long sequence) {

    public static EventEntity of(EntityType type, String entityId, long sequence) {
        return new EventEntity(type.value(), entityId, sequence);
    }
}
