package com.call_bridge_backend.services.realtime;

import lombok.Builder;
import lombok.Value;

/**
 * Decides the next step when resolving a business's assistant: update the cached id, look the
 * assistant up by name, update the one found, or create a new one.
 *
 * <p>A create is only chosen after a lookup returned nothing usable, so re-running the resolution
 * never duplicates an assistant that already exists remotely.
 */
public final class AssistantSyncDecision {

    public enum Step {
        UPDATE_CACHED,
        LOOKUP_BY_NAME,
        UPDATE_FOUND,
        CREATE,
        FAIL
    }

    /**
     * What has been tried so far.
     */
    @Value
    @Builder(toBuilder = true)
    public static class Progress {
        String cachedId;
        boolean cachedUpdateFailed;
        boolean lookedUp;
        boolean lookupFailed;
        String foundId;
        boolean foundUpdateFailed;
        boolean createFailed;
    }

    private AssistantSyncDecision() {
    }

    public static Step next(Progress progress) {
        if (progress.getCachedId() != null && !progress.isCachedUpdateFailed()) {
            return Step.UPDATE_CACHED;
        }
        if (!progress.isLookedUp()) {
            return Step.LOOKUP_BY_NAME;
        }
        String foundId = progress.getFoundId();
        if (foundId != null) {
            boolean alreadyFailed = progress.isFoundUpdateFailed()
                    || (progress.isCachedUpdateFailed() && foundId.equals(progress.getCachedId()));
            return alreadyFailed ? Step.FAIL : Step.UPDATE_FOUND;
        }
        // never create after a failed lookup
        if (progress.isLookupFailed() || progress.isCreateFailed()) {
            return Step.FAIL;
        }
        return Step.CREATE;
    }
}
