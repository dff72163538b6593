package io.github.crmrecords;

/**
 * Exception thrown by crm-record-helper. Carries a http-like status code and a string error code.
 *
 * <ul>
 *     <li>400 ValidationError: missing required field, unknown field, wrong value type, invalid link, empty natural key</li>
 *     <li>404 NotFound: the target record of read / update / delete does not exist</li>
 *     <li>410 StaleReference: write attempted on a record which has been deleted</li>
 *     <li>500 BackingStoreError: opaque failure from the record store, with the original exception as cause</li>
 * </ul>
 */
public class RecordException extends RuntimeException {

    static final long serialVersionUID = 1L;

    public static final int SC_VALIDATION_ERROR = 400;
    public static final int SC_NOT_FOUND = 404;
    public static final int SC_STALE_REFERENCE = 410;
    public static final int SC_BACKING_STORE_ERROR = 500;

    public static final String VALIDATION_ERROR = "ValidationError";
    public static final String NOT_FOUND = "NotFound";
    public static final String STALE_REFERENCE = "StaleReference";
    public static final String BACKING_STORE_ERROR = "BackingStoreError";

    /**
     * http status code
     */
    int statusCode;

    /**
     * String error code. e.g. ValidationError / NotFound / etc
     */
    String code;

    /**
     * Constructor using statusCode and message
     *
     * @param statusCode http status code
     * @param code       string error code
     * @param message    detail message
     */
    public RecordException(int statusCode, String code, String message) {
        super(message);
        this.statusCode = statusCode;
        this.code = code;
    }

    /**
     * Constructor using statusCode and message
     *
     * @param statusCode http status code
     * @param code       string error code
     * @param message    detail message
     * @param cause      cause exception
     */
    public RecordException(int statusCode, String code, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.code = code;
    }

    public static RecordException validationError(String message) {
        return new RecordException(SC_VALIDATION_ERROR, VALIDATION_ERROR, message);
    }

    public static RecordException notFound(String message) {
        return new RecordException(SC_NOT_FOUND, NOT_FOUND, message);
    }

    public static RecordException staleReference(String message) {
        return new RecordException(SC_STALE_REFERENCE, STALE_REFERENCE, message);
    }

    /**
     * Wrap an unexpected failure of a record store. The cause is kept unchanged.
     *
     * @param cause original exception
     * @return RecordException(500 BackingStoreError)
     */
    public static RecordException backingStoreError(Throwable cause) {
        return new RecordException(SC_BACKING_STORE_ERROR, BACKING_STORE_ERROR,
                BACKING_STORE_ERROR + ": " + cause.getMessage(), cause);
    }

    /**
     * Get the exception's status code. e.g. 400 / 404 / 410 / 500
     *
     * @return status code of exception.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Get the string code e.g. ValidationError / NotFound / etc
     *
     * @return code for exception
     */
    public String getCode() {
        return code;
    }

    public boolean isValidationError() {
        return statusCode == SC_VALIDATION_ERROR;
    }

    public boolean isNotFound() {
        return statusCode == SC_NOT_FOUND;
    }

    public boolean isStaleReference() {
        return statusCode == SC_STALE_REFERENCE;
    }

    @Override
    public String toString() {
        return String.format("RecordException(%d %s): %s", statusCode, code, getMessage());
    }
}
