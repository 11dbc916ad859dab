package com.spiderhub.crawler.service.pipeline;

/**
 * 아이템을 저장하지 않고 버릴 때 사용. 작업 자체는 계속 진행된다.
 */
public class DropItemException extends RuntimeException {

    public DropItemException(String message) {
        super(message, null, false, false);
    }
}
