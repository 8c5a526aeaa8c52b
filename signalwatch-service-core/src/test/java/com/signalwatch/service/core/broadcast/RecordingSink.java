package com.signalwatch.service.core.broadcast;

import com.signalwatch.service.core.model.StreamableRecord;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/** In-memory sink that keeps everything pushed to it, optionally failing every push. */
class RecordingSink implements RecordSink {

    private final List<StreamableRecord> received = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final boolean failing;

    RecordingSink() {
        this(false);
    }

    RecordingSink(boolean failing) {
        this.failing = failing;
    }

    static RecordingSink failing() {
        return new RecordingSink(true);
    }

    @Override
    public void push(StreamableRecord record) throws IOException {
        if (failing) {
            throw new IOException("connection reset");
        }
        received.add(record);
    }

    @Override
    public void close() {
        closed.set(true);
    }

    List<StreamableRecord> received() {
        return received;
    }

    boolean isClosed() {
        return closed.get();
    }
}
