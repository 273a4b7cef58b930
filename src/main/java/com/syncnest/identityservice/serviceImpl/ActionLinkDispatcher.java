package com.syncnest.identityservice.serviceImpl;

import com.syncnest.identityservice.config.AsyncConfig;
import com.syncnest.identityservice.entity.ActionTokenPurpose;
import com.syncnest.identityservice.entity.User;
import com.syncnest.identityservice.model.NotificationTemplate;
import com.syncnest.identityservice.service.ActionTokenService;
import com.syncnest.identityservice.service.CredentialStore;
import com.syncnest.identityservice.service.NotificationSender;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Account lookup, token issue and mail for reset and verification requests. Runs on the
 * notification executor so the request thread does the same work whether or not the
 * address belongs to an eligible account.
 */
@Slf4j
@Component
public class ActionLinkDispatcher {

    private final CredentialStore credentialStore;
    private final ActionTokenService actionTokenService;
    private final NotificationSender notificationSender;
    private final TransactionTemplate transactionTemplate;
    private final long resetTtlMinutes;
    private final long verificationTtlMinutes;

    public ActionLinkDispatcher(CredentialStore credentialStore,
                                ActionTokenService actionTokenService,
                                NotificationSender notificationSender,
                                TransactionTemplate transactionTemplate,
                                @Value("${app.action-token.reset-ttl-minutes:60}") long resetTtlMinutes,
                                @Value("${app.action-token.verification-ttl-minutes:1440}") long verificationTtlMinutes) {
        this.credentialStore = credentialStore;
        this.actionTokenService = actionTokenService;
        this.notificationSender = notificationSender;
        this.transactionTemplate = transactionTemplate;
        this.resetTtlMinutes = resetTtlMinutes;
        this.verificationTtlMinutes = verificationTtlMinutes;
    }

    @Async(AsyncConfig.NOTIFICATION_EXECUTOR)
    public void dispatch(ActionTokenPurpose purpose, String normalizedEmail) {
        Optional<Map<String, Object>> issued = transactionTemplate.execute(status ->
                credentialStore.findByEmail(normalizedEmail)
                        .filter(eligibility(purpose))
                        .map(user -> context(user, actionTokenService.issue(user, purpose), purpose)));

        if (issued == null || issued.isEmpty()) {
            log.debug("No {} link sent: account unknown or not eligible", purpose);
            return;
        }
        notificationSender.send(templateFor(purpose), normalizedEmail, issued.get());
    }

    private static Predicate<User> eligibility(ActionTokenPurpose purpose) {
        return purpose == ActionTokenPurpose.PASSWORD_RESET
                ? User::isActive
                : user -> !user.isEmailVerified();
    }

    private static NotificationTemplate templateFor(ActionTokenPurpose purpose) {
        return purpose == ActionTokenPurpose.PASSWORD_RESET
                ? NotificationTemplate.PASSWORD_RESET
                : NotificationTemplate.EMAIL_VERIFICATION;
    }

    private Map<String, Object> context(User user, String token, ActionTokenPurpose purpose) {
        Map<String, Object> context = new HashMap<>();
        context.put("username", user.getUsername());
        context.put("userId", user.getId());
        context.put("token", token);
        context.put("ttlMinutes", purpose == ActionTokenPurpose.PASSWORD_RESET ? resetTtlMinutes : verificationTtlMinutes);
        return context;
    }
}
