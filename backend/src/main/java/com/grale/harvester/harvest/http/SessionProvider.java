package com.grale.harvester.harvest.http;

/**
 * Executes one outbound request. Timeouts, retries and client certificates belong to
 * the implementation; callers only see the final outcome of the call.
 */
public interface SessionProvider {

    SessionResponse execute(RequestSpec spec);
}
