package com.monitoralert.common.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.monitoralert.common.exceptions.ParseException;
import com.monitoralert.common.model.ActionExecutionResult;
import com.monitoralert.common.model.AlertHistoryEntry;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConvertersTest {

    private static final Instant TIME = Instant.parse("2026-03-01T10:00:00Z");

    private final ActionExecutionResultsConverter resultsConverter = new ActionExecutionResultsConverter();
    private final AlertHistoryConverter historyConverter = new AlertHistoryConverter();

    @Test
    void resultsColumnRoundTrip() {
        var results = List.of(new ActionExecutionResult("a1", TIME, 2), ActionExecutionResult.initial("a2"));

        var column = resultsConverter.convertToDatabaseColumn(results);

        assertThat(column).contains("\"action_id\":\"a1\"", "\"last_execution_time\":null");
        assertThat(resultsConverter.convertToEntityAttribute(column)).isEqualTo(results);
    }

    @Test
    void emptyColumnsReadAsEmptyLists() {
        assertThat(resultsConverter.convertToEntityAttribute(null)).isEmpty();
        assertThat(historyConverter.convertToEntityAttribute("")).isEmpty();
        assertThat(resultsConverter.convertToDatabaseColumn(null)).isEqualTo("[]");
    }

    @Test
    void historyColumnRoundTrip() {
        var history = List.of(new AlertHistoryEntry(TIME, "timed out"));

        assertThat(historyConverter.convertToEntityAttribute(historyConverter.convertToDatabaseColumn(history)))
                .isEqualTo(history);
    }

    @Test
    void corruptColumnFailsToParse() {
        assertThatThrownBy(() -> resultsConverter.convertToEntityAttribute("{\"action_id\": 1}"))
                .isInstanceOf(ParseException.class);
    }

    @Test
    void keyedFormKeepsInsertionOrder() {
        var keyed = ActionExecutionResults.byActionId(
                List.of(ActionExecutionResult.initial("b"), ActionExecutionResult.initial("a")));

        assertThat(keyed.keySet()).containsExactly("b", "a");
        assertThat(ActionExecutionResults.asList(keyed)).extracting(ActionExecutionResult::actionId)
                .containsExactly("b", "a");
    }
}
