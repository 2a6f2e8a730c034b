package com.wshg.synergy.exception;

/**
 * 设备目录拉取失败，整次运行中止并向上抛出。
 */
public class CatalogUnavailableException extends SynergyException {

    public CatalogUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
