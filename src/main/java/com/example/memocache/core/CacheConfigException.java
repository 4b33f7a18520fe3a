package com.example.memocache.core;

/**
 * Invalid engine or store configuration, raised before any cache is created.
 */
public class CacheConfigException extends IllegalArgumentException {

    public CacheConfigException(String message) {
        super(message);
    }
}
