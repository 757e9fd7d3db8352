package com.warden.dispatch.api;

/**
 * A message observed on some channel, matched against event-triggered routines.
 */
public record IncomingEventRequest(String channel, String text) {
}
