package com.monitoralert.common.kafka;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class KafkaTopics {

    public static final String ALERT_NOTIFICATIONS = "alert-notifications";
}
