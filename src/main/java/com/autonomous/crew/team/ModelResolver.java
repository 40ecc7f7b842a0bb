package com.autonomous.crew.team;

import java.util.EnumMap;
import java.util.Map;

/**
 * Maps team operation names to a model through their tier.
 */
public class ModelResolver {

    static final Map<String, ModelTier> OPERATION_TIERS = Map.of(
        "soul:evolve", ModelTier.CREATIVE,
        "self:reflect", ModelTier.ANALYTICAL,
        "task:analyze", ModelTier.ANALYTICAL,
        "code:improve", ModelTier.CREATIVE,
        "comms:summarize", ModelTier.ROUTINE,
        "inbox:parse", ModelTier.ROUTINE);

    private final Map<ModelTier, String> models = new EnumMap<>(ModelTier.class);

    public ModelResolver(String creativeModel, String analyticalModel, String routineModel) {
        models.put(ModelTier.CREATIVE, creativeModel);
        models.put(ModelTier.ANALYTICAL, analyticalModel);
        models.put(ModelTier.ROUTINE, routineModel);
    }

    public ModelTier tierFor(String operation) {
        return OPERATION_TIERS.getOrDefault(operation, ModelTier.ANALYTICAL);
    }

    public String resolve(String operation) {
        return models.get(tierFor(operation));
    }
}
