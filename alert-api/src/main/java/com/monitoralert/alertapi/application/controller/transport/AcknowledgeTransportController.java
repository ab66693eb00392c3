package com.monitoralert.alertapi.application.controller.transport;

import com.monitoralert.alertapi.application.controller.alert.AcknowledgeAlertResponse;
import com.monitoralert.alertapi.application.controller.alert.mapper.AlertResponseMapper;
import com.monitoralert.alertapi.application.service.AlertCommandHandler;
import com.monitoralert.common.codec.RecordInput;
import com.monitoralert.common.transport.AcknowledgeAlertRequest;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Node-to-node acknowledge endpoint taking the binary {@link AcknowledgeAlertRequest}.
 */
@RestController
@RequiredArgsConstructor
public class AcknowledgeTransportController {

    private final AlertCommandHandler commandHandler;
    private final AlertResponseMapper mapper;

    @PostMapping(path = "/_transport/alerts/acknowledge", consumes = MediaType.APPLICATION_OCTET_STREAM_VALUE)
    public AcknowledgeAlertResponse acknowledge(@RequestBody byte[] body) {
        AcknowledgeAlertRequest request;
        try {
            request = AcknowledgeAlertRequest.readFrom(new RecordInput(body));
        } catch (IOException e) {
            throw new IllegalArgumentException("Malformed acknowledge request: " + e.getMessage(), e);
        }
        return mapper.toResponse(commandHandler.acknowledge(request));
    }
}
