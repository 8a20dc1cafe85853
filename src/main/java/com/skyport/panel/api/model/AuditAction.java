package com.skyport.panel.api.model;

public enum AuditAction {
    REDEPLOY("instance:redeploy"),
    REDEPLOY_FAIL_NOT_FOUND("instance:redeploy_fail:not_found"),
    REDEPLOY_FAIL_INVALID_NODE("instance:redeploy_fail:invalid_node"),
    REDEPLOY_FAIL_CONTAINER_CHECK("instance:redeploy_fail:container_check"),
    REDEPLOY_FAIL_API_ERROR("instance:redeploy_fail:api_error"),
    REDEPLOY_FAIL_DB_UPDATE("instance:redeploy_fail:db_update"),
    UNAUTHORIZED_ADMIN_ACCESS("unauthorized_access:admin_route");

    private final String tag;

    AuditAction(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
