package com.example.rcaengine.gateway;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JSON-RPC 2.0 envelope used on the gateway socket. Codes in the
 * implementation-defined range -32000..-32099 carry RCA errors.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JsonRpcMessage {

    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INVALID_PARAMS = -32602;
    public static final int INTERNAL_ERROR = -32603;
    public static final int INCIDENT_NOT_FOUND = -32004;
    public static final int RCA_RUN_FAILED = -32010;

    @Builder.Default
    private String jsonrpc = "2.0";
    private String id;
    private String method;
    private Object params;
    private Object result;
    private JsonRpcError error;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class JsonRpcError {
        private int code;
        private String message;
    }

    public static JsonRpcMessage success(String id, Object result) {
        return JsonRpcMessage.builder()
                .id(id)
                .result(result)
                .build();
    }

    public static JsonRpcMessage error(String id, int code, String message) {
        return JsonRpcMessage.builder()
                .id(id)
                .error(JsonRpcError.builder().code(code).message(message).build())
                .build();
    }

    public static JsonRpcMessage notification(String method, Object params) {
        return JsonRpcMessage.builder()
                .method(method)
                .params(params)
                .build();
    }
}
