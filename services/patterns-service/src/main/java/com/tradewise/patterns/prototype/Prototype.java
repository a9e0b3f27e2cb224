package com.tradewise.patterns.prototype;

/**
 * An object that can produce an independent deep copy of itself.
 */
public interface Prototype<T> {

    T deepClone();
}
