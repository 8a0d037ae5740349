package com.questrail.interactivity.pages;

/**
 * How {@link PageGenerator} cuts a long text into pages.
 */
public enum SplitType
{
    /** Fixed-size character chunks. */
    CHARACTER,

    /** Fixed number of lines per page. */
    LINE
}
