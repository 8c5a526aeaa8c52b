package com.signalwatch.controller.rest.stream;

import com.signalwatch.service.core.broadcast.RecordSink;
import com.signalwatch.service.core.model.StreamableRecord;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

/** Writes pre-framed SSE text to one open HTTP response. */
@Slf4j
class SseRecordSink implements RecordSink {

    static final MediaType FRAME_TYPE = new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8);

    private final String subscriberId;
    private final ResponseBodyEmitter emitter;
    private final SseFrames frames;

    SseRecordSink(String subscriberId, ResponseBodyEmitter emitter, SseFrames frames) {
        this.subscriberId = subscriberId;
        this.emitter = emitter;
        this.frames = frames;
    }

    @Override
    public void push(StreamableRecord record) throws IOException {
        write(frames.emission(record));
    }

    void write(String frame) throws IOException {
        emitter.send(frame, FRAME_TYPE);
    }

    @Override
    public void close() {
        try {
            emitter.complete();
        } catch (RuntimeException ex) {
            log.debug("Stream {} already finished: {}", subscriberId, ex.toString());
        }
    }
}
