package org.carball.queryopt.model.analysis;

public record MemoryEstimate(
        long bytes,
        double mb
) {

    public static MemoryEstimate ofBytes(long bytes) {
        return new MemoryEstimate(bytes, Math.round(bytes / 1024.0 / 1024.0 * 100.0) / 100.0);
    }
}
