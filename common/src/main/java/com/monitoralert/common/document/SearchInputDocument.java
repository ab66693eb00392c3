package com.monitoralert.common.document;

import com.monitoralert.common.model.SearchInput;
import java.util.List;
import java.util.Map;

public record SearchInputDocument(List<String> indices, Map<String, Object> query) {

    static SearchInputDocument from(SearchInput input) {
        return new SearchInputDocument(input.indices(), input.query());
    }

    SearchInput toSearchInput() {
        return new SearchInput(indices, query);
    }
}
