package org.surff.handlers;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.surff.pool.ThreadPool;
import org.surff.utils.JsonUtil;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON body for {@code GET /health}.
 * Returns  -  basic app info,
 *          -  uptime,
 *          -  worker pool counters.
 */
public class HealthRoute {

    private final ThreadPool pool;
    private final Instant startedAt;

    /**
     * @param startedAt when the server started; uptime is counted from here
     */
    public HealthRoute(ThreadPool pool, Instant startedAt) {
        this.pool = pool;
        this.startedAt = startedAt;
    }

    public byte[] body() throws JsonProcessingException {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("app", "surff");
        response.put("uptime_seconds", Duration.between(startedAt, Instant.now()).toSeconds());
        response.put("timestamp", Instant.now());
        response.put("pool_closed", pool.isClosed());
        response.put("pool", pool.stats());
        return JsonUtil.mapper().writeValueAsBytes(response);
    }
}
