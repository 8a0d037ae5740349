package com.questrail.interactivity.observability;

import com.questrail.interactivity.api.PaginationAction;
import com.questrail.interactivity.api.RenderTarget;

import java.time.Instant;

/**
 * Record representing one applied navigation action.
 */
public record NavigationEvent(
    Instant timestamp,
    RenderTarget target,
    PaginationAction action,
    int oldIndex,
    int newIndex
) {
    public boolean isIndexChange() {
        return oldIndex != newIndex;
    }
}
