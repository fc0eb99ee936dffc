package com.ryuqq.fanout.adapter.runner;

import com.ryuqq.fanout.core.model.Region;
import org.slf4j.MDC;

/**
 * 팬아웃 전용 MDC 키 관리.
 */
final class FanOutMdc {

    static final String BATCH_ID = "fanout.batchId";
    static final String REGION = "fanout.region";

    private FanOutMdc() {}

    static void setBatch(String batchId) {
        MDC.put(BATCH_ID, batchId);
    }

    static void setTask(String batchId, Region region) {
        MDC.put(BATCH_ID, batchId);
        MDC.put(REGION, region.getName());
    }

    static void clear() {
        MDC.remove(BATCH_ID);
        MDC.remove(REGION);
    }
}
