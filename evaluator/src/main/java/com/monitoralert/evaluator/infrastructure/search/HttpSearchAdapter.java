package com.monitoralert.evaluator.infrastructure.search;

import com.monitoralert.common.model.SearchInput;
import com.monitoralert.evaluator.domain.execution.SearchPort;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

/**
 * Runs monitor searches against the search engine's {@code _search} endpoint.
 */
@Slf4j
public class HttpSearchAdapter implements SearchPort {

    private static final ParameterizedTypeReference<Map<String, Object>> RESPONSE_TYPE =
            new ParameterizedTypeReference<>() {};

    private final RestClient restClient;

    public HttpSearchAdapter(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public Map<String, Object> query(SearchInput input) {
        var path = input.indices().isEmpty() ? "/_search" : "/" + String.join(",", input.indices()) + "/_search";
        log.debug("Searching {} with {}", path, input.query());
        var response = restClient.post()
                .uri(path)
                .contentType(MediaType.APPLICATION_JSON)
                .body(input.query())
                .retrieve()
                .body(RESPONSE_TYPE);
        return response == null ? Map.of() : response;
    }
}
