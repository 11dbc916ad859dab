package com.spiderhub.crawler.service;

import com.spiderhub.crawler.service.runtime.RecordSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * 크롤 엔진이 넘겨준 레코드 배치를 저장하고 작업의 아이템 수를 갱신한다.
 * 저장이 실패하면 예외가 엔진으로 전파되어 작업이 FAILED 로 기록된다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CrawlResultIngestService implements RecordSink {

    private final ResultStore resultStore;
    private final TaskRegistry taskRegistry;

    @Override
    public void deliver(String taskId, List<Map<String, Object>> records) {
        if (records == null || records.isEmpty()) {
            return;
        }
        resultStore.append(taskId, records);
        if (!taskRegistry.recordItems(taskId, records.size())) {
            log.warn("Stored {} records for a task the registry no longer knows: taskId={}", records.size(), taskId);
        }
    }
}
