package com.wshg.synergy.exception;

/**
 * 单个设备无法生成描述文本，跳过并计数。
 */
public class DescriptorBuildException extends SynergyException {

    public DescriptorBuildException(String message) {
        super(message);
    }
}
