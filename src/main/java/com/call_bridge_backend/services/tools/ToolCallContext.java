package com.call_bridge_backend.services.tools;

import com.call_bridge_backend.models.BusinessConfig;
import lombok.Builder;
import lombok.Value;

/**
 * The call a tool call was made on, and the business it belongs to.
 */
@Value
@Builder
public class ToolCallContext {
    String callId;
    BusinessConfig business;

    public Long getCompanyId() {
        return business == null ? null : business.getCompanyId();
    }

    public boolean isCalendarEnabled() {
        return business != null && business.isCalendarEnabled();
    }
}
