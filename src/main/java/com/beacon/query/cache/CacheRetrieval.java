package com.beacon.query.cache;

/**
 * Payload and status returned by {@link QueryCache#retrieve(String, boolean)}.
 * The payload is {@code null} on a key miss.
 */
public final class CacheRetrieval {
    
    private static final CacheRetrieval KEY_MISS = new CacheRetrieval(null, RetrieveStatus.KEY_MISS);
    
    private final byte[] data;
    private final RetrieveStatus status;
    
    public CacheRetrieval(byte[] data, RetrieveStatus status) {
        this.data = data;
        this.status = status;
    }
    
    public static CacheRetrieval hit(byte[] data) {
        return new CacheRetrieval(data, RetrieveStatus.HIT);
    }
    
    public static CacheRetrieval keyMiss() {
        return KEY_MISS;
    }
    
    public byte[] getData() {
        return data;
    }
    
    public RetrieveStatus getStatus() {
        return status;
    }
    
    public boolean hasData() {
        return data != null && data.length > 0;
    }
}
