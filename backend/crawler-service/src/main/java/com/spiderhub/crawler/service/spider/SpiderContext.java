package com.spiderhub.crawler.service.spider;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Per-job parameters handed to a spider and to the item pipeline.
 */
public record SpiderContext(
        String taskId,
        String spiderName,
        Map<String, Object> kwargs,
        int maxItems
) {
    public static final String MAX_ITEMS_KWARG = "max_items";

    public SpiderContext {
        kwargs = kwargs == null ? Map.of() : kwargs;
    }

    public String getString(String key, String defaultValue) {
        Object value = kwargs.get(key);
        return value == null ? defaultValue : value.toString();
    }

    public long getLong(String key, long defaultValue) {
        Object value = kwargs.get(key);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Long.parseLong(text.strip());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("kwarg '" + key + "' is not a number: " + text, e);
            }
        }
        return defaultValue;
    }

    /**
     * A kwarg that may be given as a list or as a comma separated string.
     */
    public List<String> getStringList(String key, List<String> defaultValue) {
        Object value = kwargs.get(key);
        if (value == null) {
            return defaultValue;
        }
        List<String> result = new ArrayList<>();
        if (value instanceof Collection<?> values) {
            for (Object v : values) {
                if (v != null && !v.toString().isBlank()) {
                    result.add(v.toString().strip());
                }
            }
        } else {
            for (String part : value.toString().split(",")) {
                if (!part.isBlank()) {
                    result.add(part.strip());
                }
            }
        }
        return result.isEmpty() ? defaultValue : result;
    }
}
