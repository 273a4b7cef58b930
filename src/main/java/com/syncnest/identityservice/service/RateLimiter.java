package com.syncnest.identityservice.service;

/**
 * Sliding-window admission control per key (client IP, account email, ...).
 */
public interface RateLimiter {

    /**
     * Records an attempt for {@code key} if the trailing window still has room.
     *
     * @return true when admitted; a rejected attempt is not recorded
     */
    boolean admit(String key);

    /** Attempts still available for {@code key} in the current window. Does not record anything. */
    int remaining(String key);

    int maxRequests();
}
