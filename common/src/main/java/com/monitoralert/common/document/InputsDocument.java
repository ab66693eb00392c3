package com.monitoralert.common.document;

import static com.monitoralert.common.document.DocumentFields.required;

import com.monitoralert.common.model.SearchInput;

public record InputsDocument(SearchInputDocument search) {

    static InputsDocument from(SearchInput input) {
        return new InputsDocument(SearchInputDocument.from(input));
    }

    SearchInput toSearchInput() {
        return required(search, "search", "inputs").toSearchInput();
    }
}
