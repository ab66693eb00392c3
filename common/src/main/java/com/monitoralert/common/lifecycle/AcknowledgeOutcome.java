package com.monitoralert.common.lifecycle;

import com.monitoralert.common.model.Alert;
import java.util.List;

/**
 * Result of classifying one acknowledge batch.
 *
 * @param toPersist alerts that moved to ACKNOWLEDGED and still need to be written
 * @param succeeded ids reported as acknowledged, including ones that already were
 * @param failed ids that could not be acknowledged
 */
public record AcknowledgeOutcome(List<Alert> toPersist, List<String> succeeded, List<String> failed) {

    public AcknowledgeOutcome {
        toPersist = List.copyOf(toPersist);
        succeeded = List.copyOf(succeeded);
        failed = List.copyOf(failed);
    }
}
