package com.riskengine.exception;

/**
 * Result cache backend failure. Recovered locally by computing without the cache.
 */
public class CacheException extends BaseException {

    public CacheException(String message, Throwable cause) {
        super(ErrorCode.CACHE_ERROR, message, cause);
    }
}
