package com.carohub.gameservice.pool.domain;

/**
 * 没有健康且有剩余容量的服务器；调用方稍后可重试。
 */
public class PoolUnavailableException extends RuntimeException {

    public PoolUnavailableException(String message) {
        super(message);
    }
}
