package com.docqa.rag.security;

import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.security.core.context.SecurityContext;
import reactor.core.publisher.Mono;

/**
 * Resolves the user a request acts for from the authenticated caller.
 */
public final class CallerIdentity {

    /**
     * Granted to trusted services that pass the end user's id along with each request.
     */
    public static final String DELEGATE_AUTHORITY = "ROLE_DELEGATE";

    private CallerIdentity() {
    }

    /**
     * Callers holding {@value #DELEGATE_AUTHORITY} may name any user and default to themselves. Every
     * other caller is bound to its own principal name. Without an authenticated caller the requested id
     * is used as given, and the result is empty when there is none.
     *
     * @throws AccessDeniedException (as an error signal) when a caller names someone else
     */
    public static Mono<String> resolveUserId(String requested) {
        String wanted = requested == null || requested.isBlank() ? null : requested.trim();
        return ReactiveSecurityContextHolder.getContext()
                .mapNotNull(SecurityContext::getAuthentication)
                .filter(Authentication::isAuthenticated)
                .flatMap(authentication -> Mono.fromCallable(() -> bind(authentication, wanted)))
                .switchIfEmpty(Mono.justOrEmpty(wanted));
    }

    public static Mono<String> requireUserId(String requested) {
        return resolveUserId(requested)
                .switchIfEmpty(Mono.error(() -> new IllegalArgumentException("User ID is required")));
    }

    private static String bind(Authentication authentication, String wanted) {
        String caller = authentication.getName();
        if (wanted == null) {
            return caller;
        }
        boolean delegate = authentication.getAuthorities().stream()
                .anyMatch(authority -> DELEGATE_AUTHORITY.equals(authority.getAuthority()));
        if (delegate || wanted.equals(caller)) {
            return wanted;
        }
        throw new AccessDeniedException("Caller " + caller + " may not act for user " + wanted);
    }
}
