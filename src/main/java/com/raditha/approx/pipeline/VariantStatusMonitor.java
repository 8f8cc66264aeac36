package com.raditha.approx.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Logs each variant's progress, once per change of status.
 */
public class VariantStatusMonitor implements StatusListener {

    private static final Logger logger = LoggerFactory.getLogger(VariantStatusMonitor.class);

    private final Map<String, String> lastStatus = new ConcurrentHashMap<>();

    @Override
    public void onStatus(String variantId, String message) {
        String previous = lastStatus.put(variantId, message);
        if (!message.equals(previous)) {
            logger.info("[{}] {}", variantId, message);
        }
    }

    public Map<String, String> snapshot() {
        return Map.copyOf(lastStatus);
    }
}
