package com.call_bridge_backend.services;

import com.call_bridge_backend.dto.TransferResult;

public interface CallTransferService {

    TransferResult transferCall(String callId, String phoneNumber);
}
