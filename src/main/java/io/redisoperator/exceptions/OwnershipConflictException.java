package io.redisoperator.exceptions;

/**
 * A child this object wants to write already belongs to another topology object.
 * Retrying cannot help until one of the two objects is renamed or deleted.
 */
public class OwnershipConflictException extends UnrecoverableException {

    public OwnershipConflictException(String message) {
        super(message);
    }

    @Override
    public String getReason() {
        return "OwnershipConflict";
    }
}
