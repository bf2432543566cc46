package org.carball.queryopt.model.query;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Cached handle for a hot statement.
 */
@Data
@NoArgsConstructor
public class PreparedHandle {
    private String queryId;
    private String query;
    private Instant createdAt;
    private Instant lastUsed;
    private long useCount;

    public PreparedHandle(String queryId, String query, Instant createdAt) {
        this.queryId = queryId;
        this.query = query;
        this.createdAt = createdAt;
        this.lastUsed = createdAt;
        this.useCount = 1;
    }

    public void touch(Instant now) {
        useCount++;
        lastUsed = now;
    }

    public PreparedHandle copy() {
        PreparedHandle copy = new PreparedHandle(queryId, query, createdAt);
        copy.setLastUsed(lastUsed);
        copy.setUseCount(useCount);
        return copy;
    }
}
