package dev.yeying.interviewer.exception;

import io.r2dbc.spi.R2dbcException;
import org.springframework.dao.DataAccessException;

/**
 * The backing store failed; the surrounding transaction has been rolled back.
 */
public class StorageFailureException extends ResumeTreeException {

    public StorageFailureException(String operation, Throwable cause) {
        super(ResumeTreeErrorKind.STORAGE_FAILURE, "Storage failure during " + operation, cause);
    }

    /**
     * Whether the throwable was raised by the database layer.
     */
    public static boolean isStoreError(Throwable error) {
        return error instanceof DataAccessException || error instanceof R2dbcException;
    }
}
