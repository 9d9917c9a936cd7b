package com.investorportal.backend.global.error;

import org.springframework.http.HttpStatus;

public class NotFoundProblemException extends ProblemException {

    public NotFoundProblemException(String code, String detail) {
        super(HttpStatus.NOT_FOUND, code, detail);
    }
}
