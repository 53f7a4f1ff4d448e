package io.github.drompincen.clawguard.runtime.approval;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.drompincen.clawguard.protocol.api.ActionRequest;
import io.github.drompincen.clawguard.runtime.errors.ClawGuardException;

/**
 * Session cache key: the action name plus its arguments serialized with object keys sorted,
 * so argument order never affects a lookup.
 */
public record ApprovalCacheKey(
        String actionName,
        String canonicalArguments
) {
    public static ApprovalCacheKey of(ActionRequest request, ObjectMapper mapper) {
        try {
            Object plain = mapper.convertValue(request.arguments(), Object.class);
            String canonical = mapper.writer()
                    .with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                    .writeValueAsString(plain);
            return new ApprovalCacheKey(request.name(), canonical);
        } catch (JsonProcessingException e) {
            throw new ClawGuardException("Cannot canonicalize arguments of " + request.name(), e);
        }
    }
}
