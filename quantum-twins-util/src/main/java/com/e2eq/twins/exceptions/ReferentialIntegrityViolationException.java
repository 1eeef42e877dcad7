package com.e2eq.twins.exceptions;

public class ReferentialIntegrityViolationException extends TwinsException {
    protected String referringClass;
    protected String referringId;

    public ReferentialIntegrityViolationException(String message) {
        super(ErrorKind.REFERENTIAL_INTEGRITY, message);
    }

    public ReferentialIntegrityViolationException(String message, Throwable cause) {
        super(ErrorKind.REFERENTIAL_INTEGRITY, message, cause);
    }

    public ReferentialIntegrityViolationException(String message, String referringClass, String referringId) {
        super(ErrorKind.REFERENTIAL_INTEGRITY, message);
        this.referringClass = referringClass;
        this.referringId = referringId;
    }

    public String getReferringClass() {
        return referringClass;
    }

    public String getReferringId() {
        return referringId;
    }
}
