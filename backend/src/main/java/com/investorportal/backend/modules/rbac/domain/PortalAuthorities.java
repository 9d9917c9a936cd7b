package com.investorportal.backend.modules.rbac.domain;

/**
 * Role and permission names referenced by route policies. The catalog itself lives in the database.
 */
public final class PortalAuthorities {

    public static final String ROLE_ADMIN = "ADMIN";
    public static final String ROLE_INVESTOR = "INVESTOR";
    public static final String ROLE_USER = "USER";

    public static final String VIEW_USER = "VIEW_USER";
    public static final String UPDATE_USER = "UPDATE_USER";
    public static final String CREATE_ROLE = "CREATE_ROLE";
    public static final String VIEW_ROLE = "VIEW_ROLE";
    public static final String UPDATE_ROLE = "UPDATE_ROLE";
    public static final String DELETE_ROLE = "DELETE_ROLE";
    public static final String ASSIGN_ROLE = "ASSIGN_ROLE";
    public static final String REVOKE_ROLE = "REVOKE_ROLE";
    public static final String CREATE_PERMISSION = "CREATE_PERMISSION";
    public static final String VIEW_PERMISSION = "VIEW_PERMISSION";
    public static final String UPDATE_PERMISSION = "UPDATE_PERMISSION";
    public static final String DELETE_PERMISSION = "DELETE_PERMISSION";
    public static final String VIEW_SYSTEM_METRICS = "VIEW_SYSTEM_METRICS";

    private PortalAuthorities() {
    }
}
