package com.investorportal.backend.modules.audit.domain;

public enum AuditAction {
    REGISTER,
    LOGIN,
    TOKEN_REFRESH,
    LOGOUT,
    LOGOUT_ALL,
    USER_ACTIVATED,
    USER_DEACTIVATED,
    ROLE_CREATED,
    ROLE_UPDATED,
    ROLE_DEACTIVATED,
    ROLE_ASSIGNED,
    ROLE_REVOKED,
    PERMISSION_CREATED,
    PERMISSION_UPDATED,
    PERMISSION_DEACTIVATED,
    PERMISSION_ASSIGNED,
    PERMISSION_REVOKED
}
