package com.factory.stockkeeper.config;

import com.factory.stockkeeper.service.AuditService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.security.authentication.event.AbstractAuthenticationFailureEvent;
import org.springframework.security.authentication.event.AuthenticationSuccessEvent;
import org.springframework.security.core.Authentication;
import org.springframework.security.web.authentication.WebAuthenticationDetails;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Records API sign-ins in the audit trail. The audit reference is the caller's remote address
 * when the request carried one.
 */
@Component
@Slf4j
public class AuthenticationEventListener {

    private final AuditService auditService;

    public AuthenticationEventListener(AuditService auditService) {
        this.auditService = auditService;
    }

    @EventListener
    @Transactional
    public void onSuccess(AuthenticationSuccessEvent event) {
        Authentication authentication = event.getAuthentication();
        auditService.log(authentication.getName(), "LOGIN_SUCCESS", remoteAddress(authentication), null);
    }

    @EventListener
    @Transactional
    public void onFailure(AbstractAuthenticationFailureEvent event) {
        Authentication authentication = event.getAuthentication();
        Object principal = authentication.getPrincipal();
        String attempted = principal instanceof String ? (String) principal : "unknown";
        log.warn("Rejected API login for {}: {}", attempted, event.getException().getMessage());
        auditService.log("SYSTEM", "LOGIN_FAILURE", remoteAddress(authentication),
                "user=" + attempted + ", reason=" + event.getException().getMessage());
    }

    private static String remoteAddress(Authentication authentication) {
        if (authentication.getDetails() instanceof WebAuthenticationDetails) {
            return ((WebAuthenticationDetails) authentication.getDetails()).getRemoteAddress();
        }
        return null;
    }
}
