package com.spiderhub.crawler.service.spider;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Spider 빈을 이름으로 조회
 */
@Component
@Slf4j
public class SpiderRegistry {

    private final Map<String, Spider> spiders;

    public SpiderRegistry(List<Spider> spiders) {
        Map<String, Spider> byName = new TreeMap<>();
        for (Spider spider : spiders) {
            Spider previous = byName.putIfAbsent(spider.getName(), spider);
            if (previous != null) {
                throw new IllegalStateException("Duplicate spider name: " + spider.getName()
                        + " (" + previous.getClass().getName() + ", " + spider.getClass().getName() + ")");
            }
        }
        this.spiders = Collections.unmodifiableMap(byName);
        log.info("Registered spiders: {}", this.spiders.keySet());
    }

    public Optional<Spider> find(String name) {
        return Optional.ofNullable(spiders.get(name));
    }

    public boolean contains(String name) {
        return name != null && spiders.containsKey(name);
    }

    public Set<String> getNames() {
        return spiders.keySet();
    }
}
