package com.investorportal.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Well-formed request that the kernel refuses on business grounds, e.g. deactivating the default role.
 */
public class ValidationProblemException extends ProblemException {

    public ValidationProblemException(String code, String detail) {
        super(HttpStatus.BAD_REQUEST, code, detail);
    }
}
