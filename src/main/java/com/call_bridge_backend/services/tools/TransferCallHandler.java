package com.call_bridge_backend.services.tools;

import com.call_bridge_backend.dto.ToolCall;
import com.call_bridge_backend.dto.ToolResult;
import com.call_bridge_backend.dto.TransferResult;
import com.call_bridge_backend.exceptions.CallBridgeExceptionHandler.ToolArgumentException;
import com.call_bridge_backend.services.CallTransferService;
import com.call_bridge_backend.utils.PhoneNumbers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Transfers the live call to the number the assistant was given. The number is never guessed.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TransferCallHandler implements ToolHandler {

    private final ObjectProvider<CallTransferService> transferService;

    @Override
    public ToolName getToolName() {
        return ToolName.TRANSFER_CALL;
    }

    @Override
    public ToolResult handle(ToolCall call, ToolCallContext context) {
        String rawNumber = call.stringArg("phoneNumber", "phone_number", "number", "to");
        String phoneNumber = PhoneNumbers.normalize(rawNumber)
                .orElseThrow(() -> new ToolArgumentException(
                        rawNumber == null
                                ? "A phone number is required to transfer the call"
                                : "Invalid phone number: " + rawNumber,
                        List.of("phoneNumber")));

        String callSid = call.stringArg("callSid", "call_sid");
        if (callSid == null) {
            callSid = context.getCallId();
        }
        if (callSid == null || callSid.isBlank()) {
            throw new ToolArgumentException("No active call available to transfer", List.of("callSid"));
        }

        CallTransferService service = transferService.getIfAvailable();
        if (service == null) {
            return ToolResult.failure("Call transfer is not configured");
        }

        String reason = call.stringArg("reason");
        log.info("[{}] Transferring call {} to {}", context.getCallId(), callSid, phoneNumber);
        TransferResult result = service.transferCall(callSid, phoneNumber);

        Map<String, Object> data = new LinkedHashMap<>();
        String transferredTo = result != null && result.getTransferredTo() != null ? result.getTransferredTo() : phoneNumber;
        data.put("message", "Call transferred to " + transferredTo);
        data.put("transferredTo", transferredTo);
        data.put("callSid", result != null && result.getCallSid() != null ? result.getCallSid() : callSid);
        if (result != null && result.getStatus() != null) {
            data.put("status", result.getStatus());
        }
        if (reason != null) {
            data.put("reason", reason);
        }
        return ToolResult.success(data);
    }
}
