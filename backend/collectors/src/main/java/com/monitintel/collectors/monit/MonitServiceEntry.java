package com.monitintel.collectors.monit;

/**
 * One {@code <service>} element: name, status code, and the element rendered as JSON.
 */
public record MonitServiceEntry(String name, int status, String payload) {
}
