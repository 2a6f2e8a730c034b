package com.wshg.synergy.exception;

/**
 * 向量缓存读写失败（单条粒度），由调用方跳过并计数。
 */
public class StorageException extends SynergyException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
