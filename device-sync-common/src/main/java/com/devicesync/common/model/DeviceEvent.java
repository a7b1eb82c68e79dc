package com.devicesync.common.model;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Lifecycle event kinds carried on the {@code device} topic.
 *
 * Written on the wire by symbolic name, never by ordinal, so constants can be
 * reordered without breaking producers and consumers running different builds.
 */
public enum DeviceEvent {

    @JsonProperty("Registered")
    REGISTERED,

    @JsonProperty("Deleted")
    DELETED,

    /**
     * Any kind this build does not know about. Only produced by the decoder;
     * consumers log and skip it.
     */
    @JsonProperty("Unknown")
    @JsonEnumDefaultValue
    UNKNOWN
}
