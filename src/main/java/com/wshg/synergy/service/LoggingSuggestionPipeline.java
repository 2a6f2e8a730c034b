package com.wshg.synergy.service;

import com.wshg.synergy.domain.DevicePath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 默认下游：只记录日志。接入真正的建议服务时用 @Primary 的 {@link SuggestionPipeline} Bean 替换。
 */
@Slf4j
@Component
public class LoggingSuggestionPipeline implements SuggestionPipeline {

    static final int LOG_LIMIT = 20;

    @Override
    public void submit(List<DevicePath> paths) {
        if (paths == null || paths.isEmpty()) {
            log.info("[链路建议] 本次无候选链路");
            return;
        }
        log.info("[链路建议] 候选链路数={}", paths.size());
        paths.stream().limit(LOG_LIMIT).forEach(p -> log.info("[链路建议] {}", p));
    }
}
