package com.signalwatch.controller.admin;

import com.signalwatch.service.core.retention.HistoryRetentionJob;
import com.signalwatch.service.core.support.DurationParser;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Operator endpoints. */
@RestController
@RequestMapping("/admin")
@Slf4j
public class AdminController {

    private final HistoryRetentionJob retention;

    public AdminController(HistoryRetentionJob retention) {
        this.retention = retention;
    }

    /**
     * Purges history older than {@code olderThan} (e.g. {@code 7d}, {@code 12h}, {@code P1D}); the
     * configured retention age applies when it is omitted. Source state and statistics are kept.
     */
    @PostMapping("/retention/run")
    public Map<String, Object> runRetention(@RequestParam(required = false) String olderThan) {
        Duration age = olderThan == null || olderThan.isBlank()
                ? retention.defaultMaxAge()
                : DurationParser.parse(olderThan);
        log.info("Admin retention run requested olderThan={}", age);
        int removed = retention.purge(age);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "completed");
        body.put("olderThan", age.toString());
        body.put("removed", removed);
        return body;
    }
}
