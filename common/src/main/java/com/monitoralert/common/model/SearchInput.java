package com.monitoralert.common.model;

import java.util.List;
import java.util.Map;

public record SearchInput(List<String> indices, Map<String, Object> query) {

    public SearchInput {
        indices = indices == null ? List.of() : List.copyOf(indices);
        query = query == null ? Map.of() : query;
    }

    /**
     * A monitor without inputs has nothing to search; its triggers see no results.
     */
    public boolean isEmpty() {
        return indices.isEmpty() && query.isEmpty();
    }
}
