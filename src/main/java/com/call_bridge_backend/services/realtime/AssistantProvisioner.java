package com.call_bridge_backend.services.realtime;

import com.call_bridge_backend.config.VoiceAIConfig;
import com.call_bridge_backend.dto.realtime.AssistantRequest;
import com.call_bridge_backend.exceptions.CallBridgeExceptionHandler.AssistantSyncException;
import com.call_bridge_backend.models.BusinessConfig;
import com.call_bridge_backend.services.realtime.AssistantSyncDecision.Progress;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Makes sure the provider has an up to date assistant for a business and returns its id.
 * Resolved ids are kept in the {@value VoiceAIConfig#ASSISTANT_CACHE} cache per company.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AssistantProvisioner {

    private final VapiApiClient apiClient;
    private final AssistantPayloadFactory payloadFactory;
    private final CacheManager cacheManager;

    public String ensureAssistant(BusinessConfig business) {
        AssistantRequest request = payloadFactory.build(business);
        String name = request.getName();
        Object cacheKey = cacheKey(business);
        Cache cache = cacheManager.getCache(VoiceAIConfig.ASSISTANT_CACHE);

        String cachedId = cache != null && cacheKey != null ? cache.get(cacheKey, String.class) : null;
        if (cachedId == null && business.getAssistantId() != null && !business.getAssistantId().isBlank()) {
            cachedId = business.getAssistantId();
        }

        Progress progress = Progress.builder().cachedId(cachedId).build();
        List<String> errors = new ArrayList<>();

        while (true) {
            AssistantSyncDecision.Step step = AssistantSyncDecision.next(progress);
            switch (step) {
                case UPDATE_CACHED:
                    try {
                        return remember(cache, cacheKey, apiClient.updateAssistant(progress.getCachedId(), request));
                    } catch (RuntimeException e) {
                        log.warn("Updating cached assistant {} for {} failed: {}", progress.getCachedId(), name, e.getMessage());
                        errors.add("Update of assistant " + progress.getCachedId() + " failed: " + e.getMessage());
                        evict(cache, cacheKey);
                        progress = progress.toBuilder().cachedUpdateFailed(true).build();
                    }
                    break;
                case LOOKUP_BY_NAME:
                    try {
                        Optional<String> found = apiClient.findAssistantByName(name);
                        progress = progress.toBuilder().lookedUp(true).foundId(found.orElse(null)).build();
                    } catch (RuntimeException e) {
                        log.warn("Looking up assistant {} failed: {}", name, e.getMessage());
                        errors.add("Lookup of assistant " + name + " failed: " + e.getMessage());
                        progress = progress.toBuilder().lookedUp(true).lookupFailed(true).build();
                    }
                    break;
                case UPDATE_FOUND:
                    try {
                        return remember(cache, cacheKey, apiClient.updateAssistant(progress.getFoundId(), request));
                    } catch (RuntimeException e) {
                        log.warn("Updating assistant {} for {} failed: {}", progress.getFoundId(), name, e.getMessage());
                        errors.add("Update of assistant " + progress.getFoundId() + " failed: " + e.getMessage());
                        progress = progress.toBuilder().foundUpdateFailed(true).build();
                    }
                    break;
                case CREATE:
                    try {
                        return remember(cache, cacheKey, apiClient.createAssistant(request));
                    } catch (RuntimeException e) {
                        log.warn("Creating assistant {} failed: {}", name, e.getMessage());
                        errors.add("Create of assistant " + name + " failed: " + e.getMessage());
                        progress = progress.toBuilder().createFailed(true).build();
                    }
                    break;
                case FAIL:
                    log.error("Could not resolve an assistant for {}: {}", name, errors);
                    throw new AssistantSyncException(errors);
                default:
                    throw new IllegalStateException("Unexpected step " + step);
            }
        }
    }

    private static Object cacheKey(BusinessConfig business) {
        return business.getCompanyId() != null ? business.getCompanyId() : business.getPhoneNumber();
    }

    private static String remember(Cache cache, Object key, String assistantId) {
        if (cache != null && key != null) {
            cache.put(key, assistantId);
        }
        return assistantId;
    }

    private static void evict(Cache cache, Object key) {
        if (cache != null && key != null) {
            cache.evict(key);
        }
    }
}
