package com.github.nlayna.transferengine.model;

/**
 * Current connectivity as reported by the external connectivity monitor.
 */
public enum NetworkClass {
    LOCAL,
    UNMETERED,
    METERED,
    OFFLINE
}
