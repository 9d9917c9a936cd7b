package com.investorportal.backend.modules.rbac.domain;

public enum PermissionMatch {
    ALL,
    ANY
}
