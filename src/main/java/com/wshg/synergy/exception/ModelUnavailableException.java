package com.wshg.synergy.exception;

/**
 * 向量模型无法加载或批量向量化中途失败。对一次生成运行是致命的，不能用零向量代替。
 */
public class ModelUnavailableException extends SynergyException {

    public ModelUnavailableException(String message) {
        super(message);
    }

    public ModelUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
