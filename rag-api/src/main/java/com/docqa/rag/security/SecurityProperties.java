package com.docqa.rag.security;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "rag.security")
public class SecurityProperties {

    /**
     * Optional static bearer token used to authenticate requests when configured. JWT validation
     * against the configured issuer applies otherwise.
     */
    private String staticToken;

    /**
     * Principal name of static-token callers. They may act for any user.
     */
    private String staticPrincipal = "rag-service";

    /**
     * JWT claim holding the user id that sessions and documents are recorded under.
     */
    private String userClaim = "sub";

    private String rolesClaim = "roles";

    public String getStaticToken() {
        return staticToken;
    }

    public void setStaticToken(String staticToken) {
        this.staticToken = staticToken;
    }

    public boolean hasStaticToken() {
        return staticToken != null && !staticToken.isBlank();
    }

    public String getStaticPrincipal() {
        return staticPrincipal;
    }

    public void setStaticPrincipal(String staticPrincipal) {
        this.staticPrincipal = staticPrincipal;
    }

    public String getUserClaim() {
        return userClaim;
    }

    public void setUserClaim(String userClaim) {
        this.userClaim = userClaim;
    }

    public String getRolesClaim() {
        return rolesClaim;
    }

    public void setRolesClaim(String rolesClaim) {
        this.rolesClaim = rolesClaim;
    }
}
