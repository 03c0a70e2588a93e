package com.chaintruth.chain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Extracts {@code result} from a JSON-RPC 2.0 response, turning error objects and garbage into {@link RpcException}.
 */
public final class JsonRpcResponses {

    private JsonRpcResponses() {
    }

    /**
     * The result node; a JSON null result (unknown tx, pending receipt) comes back as a null node, never as an error.
     */
    public static JsonNode result(ObjectMapper objectMapper, String json, String method) {
        if (json == null) {
            throw new RpcException(method + " returned no body");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RpcException("Failed to parse " + method + " response", e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new RpcException(method + " error: " + error);
        }
        JsonNode result = root.path("result");
        if (result.isMissingNode()) {
            throw new RpcException(method + " response has no result");
        }
        return result;
    }
}
