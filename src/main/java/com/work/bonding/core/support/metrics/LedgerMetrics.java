package com.work.bonding.core.support.metrics;

/**
 * 可观测性端口（不强依赖 Micrometer/Prometheus）。
 * 核心路径只调用接口，业务/平台可通过自定义 Bean 接入具体实现。
 */
public interface LedgerMetrics {

    /**
     * @param operation 操作名，如 slash / addBond
     * @param result    ok 或异常类名
     */
    default void operation(String operation, String result) {
    }
}
