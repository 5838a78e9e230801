package com.streamfirst.shush.domain;

/**
 * A selector matched nothing in the inventory while strict resolution was requested.
 */
public class ResolutionException extends RuntimeException {

    private final String selector;

    public ResolutionException(String selector, String message) {
        super(message);
        this.selector = selector;
    }

    public String getSelector() {
        return selector;
    }
}
