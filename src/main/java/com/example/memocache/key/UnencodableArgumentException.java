package com.example.memocache.key;

public class UnencodableArgumentException extends RuntimeException {

    private final int position;
    private final Class<?> argumentType;

    public UnencodableArgumentException(int position, Class<?> argumentType) {
        super("Argument " + position + " of type " + argumentType.getName()
            + " has no stable key representation");
        this.position = position;
        this.argumentType = argumentType;
    }

    /** Zero-based position of the offending top-level argument. */
    public int getPosition() {
        return position;
    }

    public Class<?> getArgumentType() {
        return argumentType;
    }
}
