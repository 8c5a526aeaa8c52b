package com.signalwatch.service.core.broadcast;

import com.signalwatch.service.core.model.StreamableRecord;
import java.io.IOException;

/**
 * Write side of one live subscriber connection. A push that throws is taken as a disconnect: the
 * hub drops the subscriber and never retries.
 */
public interface RecordSink {

    void push(StreamableRecord record) throws IOException;

    /** Releases the underlying connection. Called once, when the subscriber is removed. */
    void close();
}
