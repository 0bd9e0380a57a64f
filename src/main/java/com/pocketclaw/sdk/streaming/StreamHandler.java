package com.pocketclaw.sdk.streaming;

import com.pocketclaw.sdk.models.Message;

/**
 * Handler interface for the output of a {@link ChatStreamReconciler}.
 */
public interface StreamHandler {

    /**
     * Called with the in-progress message each time accepted text grows. Each draft
     * replaces the previous one; all drafts of a turn share the same id.
     *
     * @param draft the current draft
     */
    default void onDraft(Message draft) {}

    /**
     * Called once per completed turn with the finalized message, which replaces the draft.
     *
     * @param message the finalized message
     */
    default void onFinal(Message message) {}

    /**
     * Called when the server reports an error for the turn.
     *
     * @param error the server-supplied error text
     */
    default void onError(String error) {}

    /**
     * Called after the turn is finalized or abandoned and the session has been reset.
     */
    default void onTurnEnd() {}
}
