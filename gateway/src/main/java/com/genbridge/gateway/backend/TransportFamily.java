package com.genbridge.gateway.backend;

/**
 * Which {@link BackendAdapter} a capability talks through.
 *
 * CLIENT_LIBRARY: typed client returning structured reply objects.
 * REST:           direct authenticated HTTP call returning JSON.
 */
public enum TransportFamily {
    CLIENT_LIBRARY,
    REST
}
