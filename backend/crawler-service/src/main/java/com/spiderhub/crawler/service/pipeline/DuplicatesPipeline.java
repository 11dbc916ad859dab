package com.spiderhub.crawler.service.pipeline;

import com.spiderhub.crawler.service.spider.SpiderContext;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.Map;
import java.util.Set;

/**
 * 같은 작업 안에서 url:title 지문이 같은 아이템을 제거
 */
public class DuplicatesPipeline implements ItemPipeline {

    private final Set<String> seen = new HashSet<>();

    @Override
    public Map<String, Object> process(Map<String, Object> item, SpiderContext context) {
        String fingerprint = fingerprint(item);
        if (!seen.add(fingerprint)) {
            throw new DropItemException("Duplicate item: " + item.get("url"));
        }
        return item;
    }

    static String fingerprint(Map<String, Object> item) {
        String key = item.getOrDefault("url", "") + ":" + item.getOrDefault("title", "");
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(key.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
