package com.wshg.synergy.exception;

/**
 * 链路发现核心的异常基类。
 */
public class SynergyException extends RuntimeException {

    public SynergyException(String message) {
        super(message);
    }

    public SynergyException(String message, Throwable cause) {
        super(message, cause);
    }
}
