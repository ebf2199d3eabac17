package com.docqa.rag.security;

import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.ReactiveAuthenticationManager;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.oauth2.server.resource.authentication.BearerTokenAuthenticationToken;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Authenticates the shared service token. The resulting principal may act for any user.
 */
public class StaticTokenAuthenticationManager implements ReactiveAuthenticationManager {

    private final byte[] expectedToken;
    private final String principal;

    public StaticTokenAuthenticationManager(String expectedToken, String principal) {
        this.expectedToken = expectedToken.getBytes(StandardCharsets.UTF_8);
        this.principal = principal;
    }

    @Override
    public Mono<Authentication> authenticate(Authentication authentication) {
        if (!(authentication instanceof BearerTokenAuthenticationToken bearer)) {
            return Mono.error(new BadCredentialsException("Unsupported authentication token"));
        }

        String token = bearer.getToken();
        if (token == null || !MessageDigest.isEqual(expectedToken, token.getBytes(StandardCharsets.UTF_8))) {
            return Mono.error(new BadCredentialsException("Invalid bearer token"));
        }

        Authentication result = new UsernamePasswordAuthenticationToken(
                principal,
                null,
                AuthorityUtils.createAuthorityList(CallerIdentity.DELEGATE_AUTHORITY)
        );
        return Mono.just(result);
    }
}
