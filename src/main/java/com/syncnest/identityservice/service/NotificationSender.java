package com.syncnest.identityservice.service;

import com.syncnest.identityservice.model.NotificationTemplate;

import java.util.Map;

/**
 * Fire-and-forget outbound notifications. Implementations never throw to the caller.
 */
public interface NotificationSender {

    void send(NotificationTemplate template, String recipient, Map<String, Object> context);
}
