package dev.pekelund.wastelog.analyzer;

import java.util.Map;
import org.slf4j.MDC;
import org.springframework.util.StringUtils;

/**
 * Populates MDC entries so log lines emitted while ingesting one photo share the same image hash
 * and processing stage.
 */
final class WasteProcessingMdc {

    static final String KEY_IMAGE_HASH = "waste.imageHash";
    static final String KEY_STAGE = "waste.stage";

    private WasteProcessingMdc() {
    }

    static Context open() {
        return new Context();
    }

    static void attachImageHash(String imageHash) {
        putIfHasText(KEY_IMAGE_HASH, imageHash);
    }

    static void setStage(String stage) {
        putIfHasText(KEY_STAGE, stage);
    }

    private static void putIfHasText(String key, String value) {
        if (StringUtils.hasText(value)) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    static final class Context implements AutoCloseable {

        private final Map<String, String> previous;

        private Context() {
            this.previous = MDC.getCopyOfContextMap();
        }

        @Override
        public void close() {
            if (previous == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        }
    }
}
