package com.example.driftmonitor.kv;

import java.time.Duration;
import java.util.Optional;

public interface KvClient {
    Optional<String> get(String key);
    /** @return true when the key did not exist and now holds {@code value} */
    boolean setIfAbsent(String key, String value, Duration ttl);
}
