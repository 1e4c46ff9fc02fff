package io.redisoperator.exceptions;

/**
 * The pass ran past its deadline. Writes committed before the checkpoint stay.
 */
public class DeadlineExceededException extends TransientPlatformException {

    public DeadlineExceededException(String message) {
        super(message);
    }

    @Override
    public String getReason() {
        return "DeadlineExceeded";
    }
}
