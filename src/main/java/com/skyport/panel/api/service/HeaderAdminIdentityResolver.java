package com.skyport.panel.api.service;

import com.skyport.panel.api.model.AdminIdentity;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Reads the identity headers the fronting gateway sets after authenticating the session.
 */
@Component
public class HeaderAdminIdentityResolver implements AdminIdentityResolver {

    static final String USER_ID_HEADER = "X-User-Id";
    static final String USERNAME_HEADER = "X-Username";
    static final String ADMIN_HEADER = "X-User-Admin";

    @Override
    public AdminIdentity resolve(HttpServletRequest request) {
        String userId = request.getHeader(USER_ID_HEADER);
        if (!StringUtils.hasText(userId)) {
            return AdminIdentity.anonymous();
        }
        String username = request.getHeader(USERNAME_HEADER);
        return new AdminIdentity(
                userId.trim(),
                StringUtils.hasText(username) ? username.trim() : "unknown",
                "true".equalsIgnoreCase(request.getHeader(ADMIN_HEADER))
        );
    }
}
