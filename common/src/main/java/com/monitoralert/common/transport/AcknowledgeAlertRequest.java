package com.monitoralert.common.transport;

import com.monitoralert.common.codec.RecordInput;
import com.monitoralert.common.codec.RecordOutput;
import com.monitoralert.common.codec.Writeable;
import java.io.IOException;
import java.util.List;

/**
 * Request to acknowledge a set of alerts of one monitor.
 *
 * <p>Binary layout: {@code [monitorId][vint count][alertId]*[refreshPolicy:byte]}.
 */
public record AcknowledgeAlertRequest(String monitorId, List<String> alertIds, RefreshPolicy refreshPolicy)
        implements Writeable {

    public AcknowledgeAlertRequest {
        if (monitorId == null || monitorId.isBlank()) {
            throw new IllegalArgumentException("monitorId is required");
        }
        alertIds = alertIds == null ? List.of() : List.copyOf(alertIds);
        refreshPolicy = refreshPolicy == null ? RefreshPolicy.NONE : refreshPolicy;
    }

    @Override
    public void writeTo(RecordOutput out) throws IOException {
        out.writeString(monitorId);
        out.writeStringCollection(alertIds);
        out.writeByte(refreshPolicy.id());
    }

    public static AcknowledgeAlertRequest readFrom(RecordInput in) throws IOException {
        var monitorId = in.readString();
        var alertIds = in.readStringList();
        byte policyId = in.readByte();
        try {
            return new AcknowledgeAlertRequest(monitorId, alertIds, RefreshPolicy.fromId(policyId));
        } catch (IllegalArgumentException e) {
            throw new IOException(e.getMessage(), e);
        }
    }
}
