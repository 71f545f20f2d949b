package com.strata.platform.application.training;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Caller-supplied training parameters. Only {@code schemaId} is mandatory.
 */
public record TrainingRequest(
        String schemaId, String targetColumn, Integer epochs, Double learningRate, Integer batchSize) {

    static final String MODEL_TYPE = "regression";

    /**
     * Body sent to {@code POST /train}; absent hyperparameters are left out.
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> hyperparameters = new LinkedHashMap<>();
        if (targetColumn != null) {
            hyperparameters.put("target_column", targetColumn);
        }
        if (epochs != null) {
            hyperparameters.put("epochs", epochs);
        }
        if (learningRate != null && Double.isFinite(learningRate)) {
            hyperparameters.put("learning_rate", learningRate);
        }
        if (batchSize != null) {
            hyperparameters.put("batch_size", batchSize);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("schema_id", schemaId);
        payload.put("model_type", MODEL_TYPE);
        payload.put("hyperparameters", hyperparameters);
        return payload;
    }
}
