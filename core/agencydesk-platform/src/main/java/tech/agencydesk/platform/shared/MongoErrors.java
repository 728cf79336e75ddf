package tech.agencydesk.platform.shared;

import com.mongodb.ErrorCategory;
import com.mongodb.MongoCommandException;
import com.mongodb.MongoExecutionTimeoutException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoSocketReadTimeoutException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.MongoWriteException;

/**
 * Classification of MongoDB driver failures shared by the repositories and their metrics.
 */
public final class MongoErrors {

    public static final int DUPLICATE_KEY_ERROR = 11000;

    private MongoErrors() {
    }

    /**
     * A unique index rejected the write. Single writes report it as a write error,
     * findAndModify reports it as a command error.
     */
    public static boolean isDuplicateKey(Throwable e) {
        if (e instanceof MongoWriteException writeException) {
            return writeException.getError().getCategory() == ErrorCategory.DUPLICATE_KEY;
        }
        if (e instanceof MongoCommandException commandException) {
            return commandException.getErrorCode() == DUPLICATE_KEY_ERROR;
        }
        return false;
    }

    /**
     * Metric tag for a failed store call.
     */
    public static String classify(Throwable e) {
        if (isDuplicateKey(e)) {
            return "duplicate_key";
        }
        if (e instanceof MongoTimeoutException
            || e instanceof MongoExecutionTimeoutException
            || e instanceof MongoSocketReadTimeoutException) {
            return "timeout";
        }
        if (e instanceof MongoSocketException) {
            return "connection";
        }
        if (e instanceof MongoWriteException) {
            return "write";
        }
        if (e instanceof IllegalArgumentException) {
            return "invalid_argument";
        }
        return "internal";
    }
}
