package com.example.cratebridge.common.exception;

/**
 * Failure that makes a whole requested operation impossible. Failures local to one track or one document entry
 * are recorded on the track or in the skip report instead.
 */
public class LibraryException extends RuntimeException {

    public static final String INPUT_MISSING = "INPUT_MISSING";
    public static final String DOCUMENT_MALFORMED = "DOCUMENT_MALFORMED";
    public static final String TARGET_UNWRITABLE = "TARGET_UNWRITABLE";
    public static final String UNSUPPORTED_FORMAT = "UNSUPPORTED_FORMAT";
    public static final String NOT_PLAYABLE = "NOT_PLAYABLE";
    public static final String INVALID_STATE = "INVALID_STATE";

    private final String code;
    private final String userAction;

    public LibraryException(String code, String message) {
        this(code, message, null, null);
    }

    public LibraryException(String code, String message, String userAction) {
        this(code, message, userAction, null);
    }

    public LibraryException(String code, String message, String userAction, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.userAction = userAction;
    }

    public static LibraryException inputMissing(String what, Object path) {
        return new LibraryException(INPUT_MISSING, what + " does not exist: " + path,
                "Check the path and try again");
    }

    public String getCode() {
        return code;
    }

    public String getUserAction() {
        return userAction;
    }
}
