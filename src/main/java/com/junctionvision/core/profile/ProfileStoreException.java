package com.junctionvision.core.profile;

public class ProfileStoreException extends RuntimeException {
    public ProfileStoreException(String message) {
        super(message);
    }

    public ProfileStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
