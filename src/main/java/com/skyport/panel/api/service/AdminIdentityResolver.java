package com.skyport.panel.api.service;

import com.skyport.panel.api.model.AdminIdentity;
import jakarta.servlet.http.HttpServletRequest;

/**
 * Supplies the caller identity established by the authentication layer in front of this API.
 */
public interface AdminIdentityResolver {

    AdminIdentity resolve(HttpServletRequest request);
}
