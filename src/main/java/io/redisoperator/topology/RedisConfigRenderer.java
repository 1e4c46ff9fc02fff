package io.redisoperator.topology;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

import static io.redisoperator.config.Constants.DATA_MOUNT_PATH;
import static io.redisoperator.config.Constants.REDIS_PORT;

/**
 * Renders redis.conf from layered directive maps. Later layers win; output is sorted by key.
 */
public class RedisConfigRenderer {

    public static final Map<String, String> BASE_DEFAULTS;

    static {
        Map<String, String> defaults = new LinkedHashMap<>();
        defaults.put("bind", "0.0.0.0");
        defaults.put("port", String.valueOf(REDIS_PORT));
        defaults.put("dir", DATA_MOUNT_PATH);
        defaults.put("protected-mode", "no");
        defaults.put("tcp-backlog", "511");
        defaults.put("tcp-keepalive", "300");
        defaults.put("timeout", "0");
        defaults.put("databases", "16");
        defaults.put("save", "900 1 300 10 60 10000");
        defaults.put("stop-writes-on-bgsave-error", "yes");
        defaults.put("rdbcompression", "yes");
        defaults.put("rdbchecksum", "yes");
        defaults.put("dbfilename", "dump.rdb");
        defaults.put("appendonly", "yes");
        defaults.put("appendfsync", "everysec");
        defaults.put("maxmemory-policy", "allkeys-lru");
        BASE_DEFAULTS = Collections.unmodifiableMap(defaults);
    }

    @SafeVarargs
    public final Map<String, String> merge(Map<String, String>... layers) {
        Map<String, String> merged = new TreeMap<>();
        for (Map<String, String> layer : layers) {
            if (layer != null) {
                merged.putAll(layer);
            }
        }
        return merged;
    }

    public String render(Map<String, String> directives) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> entry : new TreeMap<>(directives).entrySet()) {
            sb.append(entry.getKey()).append(' ').append(entry.getValue()).append('\n');
        }
        return sb.toString();
    }
}
