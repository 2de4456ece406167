package com.purchasingpower.brain.knowledge;

import com.purchasingpower.brain.core.GraphEdge;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class EdgeFilter {

    @Singular
    List<String> edgeTypes;

    String sourceEntityId;
    String targetEntityId;

    /** Null means unbounded. */
    Integer limit;

    public boolean matches(GraphEdge edge) {
        if (!edgeTypes.isEmpty() && !edgeTypes.contains(edge.getEdgeType())) {
            return false;
        }
        if (sourceEntityId != null && !sourceEntityId.equals(edge.getSourceEntityId())) {
            return false;
        }
        return targetEntityId == null || targetEntityId.equals(edge.getTargetEntityId());
    }
}
