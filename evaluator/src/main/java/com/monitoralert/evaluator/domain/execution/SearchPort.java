package com.monitoralert.evaluator.domain.execution;

import com.monitoralert.common.model.SearchInput;
import java.util.Map;

public interface SearchPort {

    /**
     * Runs the monitor's search. Any runtime exception is treated as an input failure.
     */
    Map<String, Object> query(SearchInput input);
}
