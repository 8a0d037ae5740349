package com.questrail.interactivity.api;

/**
 * Snowflake identity of a user.
 *
 * @param value raw snowflake
 */
public record UserId(long value)
{
    public static UserId of(long value) {
        return new UserId(value);
    }

    @Override
    public String toString() {
        return Long.toUnsignedString(value);
    }
}
