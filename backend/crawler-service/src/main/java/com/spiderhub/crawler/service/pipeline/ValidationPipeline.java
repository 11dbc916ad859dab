package com.spiderhub.crawler.service.pipeline;

import com.spiderhub.crawler.service.spider.SpiderContext;

import java.util.Map;

/**
 * Drops items without a usable http(s) url.
 */
public class ValidationPipeline implements ItemPipeline {

    @Override
    public Map<String, Object> process(Map<String, Object> item, SpiderContext context) {
        Object url = item.get("url");
        if (url == null || url.toString().isBlank()) {
            throw new DropItemException("Missing url field");
        }
        String value = url.toString();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            throw new DropItemException("Invalid url: " + value);
        }
        return item;
    }
}
