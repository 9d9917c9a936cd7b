package com.investorportal.backend.global.error;

import org.springframework.http.HttpStatus;

public class ConflictProblemException extends ProblemException {

    public ConflictProblemException(String code, String detail) {
        super(HttpStatus.CONFLICT, code, detail);
    }
}
