package com.clinicmate.backend.modules.auth.application;

import com.clinicmate.backend.global.error.ProblemException;

public class AuthException extends ProblemException {

    private final AuthErrorCode errorCode;

    public AuthException(AuthErrorCode errorCode) {
        this(errorCode, errorCode.defaultMessage());
    }

    public AuthException(AuthErrorCode errorCode, String detail) {
        super(errorCode.status(), errorCode.name(), detail);
        this.errorCode = errorCode;
    }

    public AuthException(AuthErrorCode errorCode, Throwable cause) {
        super(errorCode.status(), errorCode.name(), errorCode.defaultMessage(), cause);
        this.errorCode = errorCode;
    }

    public AuthErrorCode getErrorCode() {
        return errorCode;
    }
}
