package io.lintsignal.suppression;

import io.lintsignal.mutation.BatchMutation;

/**
 * Edit inserting a suppression marker.
 *
 * @param mutation The edits
 * @param message  Message offered to the user, e.g. "Suppress rule lint/a11y/noAutofocus"
 */
public record SuppressionEdit(BatchMutation mutation, String message) {

    public SuppressionEdit {
        if (mutation == null) {
            throw new IllegalArgumentException("mutation cannot be null");
        }
        message = message != null ? message : "";
    }
}
