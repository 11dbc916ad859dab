package com.spiderhub.crawler.service.pipeline;

import com.spiderhub.crawler.service.spider.SpiderContext;

import java.util.Map;

/**
 * One stage of the item pipeline. A stage either returns the (possibly
 * modified) item or throws {@link DropItemException}.
 *
 * Instances are created per job and may keep per-job state.
 */
public interface ItemPipeline {

    Map<String, Object> process(Map<String, Object> item, SpiderContext context);
}
