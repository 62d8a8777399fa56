package com.axiom.gateway.domain.ivcu;

import java.math.BigDecimal;

/**
 * Status update for a generating IVCU, sent by the workflow engine that runs long generations.
 *
 * @param completed true when generation finished with code, false when it failed
 * @param error failure description, only for failed updates
 */
public record GenerationCallback(boolean completed, String code, BigDecimal cost, String modelId, String error) {

    public static GenerationCallback completed(String code, BigDecimal cost, String modelId) {
        return new GenerationCallback(true, code, cost, modelId, null);
    }

    public static GenerationCallback failed(String error) {
        return new GenerationCallback(false, null, null, null, error);
    }
}
