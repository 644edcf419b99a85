package com.call_bridge_backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolResult {
    private boolean success;
    private Object data;
    private String error;
    private Object details;

    public static ToolResult success(Object data) {
        return new ToolResult(true, data, null, null);
    }

    public static ToolResult failure(String error) {
        return new ToolResult(false, null, error, null);
    }

    public static ToolResult failure(String error, Object details) {
        return new ToolResult(false, null, error, details);
    }
}
