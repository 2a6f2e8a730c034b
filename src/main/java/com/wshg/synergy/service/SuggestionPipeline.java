package com.wshg.synergy.service;

import com.wshg.synergy.domain.DevicePath;

import java.util.List;

/**
 * 自动化建议下游：接收已排序的候选链路。
 */
public interface SuggestionPipeline {

    void submit(List<DevicePath> paths);
}
