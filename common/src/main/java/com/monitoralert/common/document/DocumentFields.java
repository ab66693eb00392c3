package com.monitoralert.common.document;

import com.monitoralert.common.exceptions.ParseException;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
final class DocumentFields {

    static <T> T required(T value, String field, String context) {
        if (value == null) {
            throw ParseException.missingField(field, context);
        }
        return value;
    }
}
