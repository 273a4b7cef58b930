package com.syncnest.identityservice.serviceImpl;

import com.syncnest.identityservice.config.AsyncConfig;
import com.syncnest.identityservice.model.NotificationTemplate;
import com.syncnest.identityservice.service.NotificationSender;
import com.syncnest.identityservice.utils.EmailTemplate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class MailNotificationSender implements NotificationSender {

    private final JavaMailSender mailSender;
    private final EmailTemplate emailTemplate;

    @Override
    @Async(AsyncConfig.NOTIFICATION_EXECUTOR)
    public void send(NotificationTemplate template, String recipient, Map<String, Object> context) {
        try {
            mailSender.send(emailTemplate.render(template, recipient, context));
            log.debug("Sent {} mail", template);
        } catch (MailException ex) {
            log.warn("Failed to send {} mail: {}", template, ex.getMessage());
        }
    }
}
