package com.monitoralert.common.codec;

import java.io.IOException;

/**
 * A record with a fixed binary layout. Field order is part of the wire contract.
 */
public interface Writeable {

    void writeTo(RecordOutput out) throws IOException;

    @FunctionalInterface
    interface Reader<T> {

        T read(RecordInput in) throws IOException;
    }
}
