package io.toolhost.server.stdio;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.toolhost.core.exception.ErrorKind;
import io.toolhost.core.exception.ToolHostException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.LinkedHashMap;
import java.util.Map;

/// JSON-RPC 2.0 codec for the stdio tool protocol.
///
/// Creates outgoing messages as single-line JSON strings and turns incoming
/// JSON values into typed {@link JsonRpcMessage}s. Every message travels as
/// one line on the child's stdin or stdout, so serialized output never
/// contains a raw newline.
///
/// ### Message Types
/// - **Request**: has `id`, `method`, `params` - expects a response
/// - **Notification**: has `method`, `params` - no response expected
/// - **Response**: has `id`, `result` or `error`
///
/// @see MessageFramer for line splitting
/// @see StdioConnection for request correlation
/// @see <a href="https://www.jsonrpc.org/specification">JSON-RPC 2.0 Spec</a>
@ApplicationScoped
public class JsonRpc {

    /// JSON-RPC error code for an unknown method.
    public static final int METHOD_NOT_FOUND = -32601;

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE =
            new TypeReference<>() {};

    private final ObjectMapper mapper;
    private final ObjectReader lineReader;

    @Inject
    public JsonRpc(ObjectMapper mapper) {
        this.mapper = mapper;
        this.lineReader = mapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /// Creates a JSON-RPC request (expects a response).
    ///
    /// @param id request identifier for response correlation
    /// @param method the method to invoke (e.g., "tools/call")
    /// @param params method parameters, omitted when null
    /// @return JSON-RPC request line without trailing newline
    public String createRequest(long id, String method, Object params) {
        ObjectNode root = mapper.createObjectNode();
        root.put("jsonrpc", "2.0");
        root.put("id", id);
        root.put("method", method);
        if (params != null) {
            root.set("params", mapper.valueToTree(params));
        }
        return root.toString();
    }

    /// Creates a JSON-RPC notification (no response expected).
    ///
    /// @param method the method to invoke
    /// @param params method parameters, omitted when null
    /// @return JSON-RPC notification line without trailing newline
    public String createNotification(String method, Object params) {
        ObjectNode root = mapper.createObjectNode();
        root.put("jsonrpc", "2.0");
        root.put("method", method);
        if (params != null) {
            root.set("params", mapper.valueToTree(params));
        }
        return root.toString();
    }

    /// Creates a success response to a provider-initiated request.
    ///
    /// @param id the provider's request id, echoed verbatim
    /// @param result the result data
    /// @return JSON-RPC response line without trailing newline
    public String createResponse(JsonNode id, Object result) {
        ObjectNode root = mapper.createObjectNode();
        root.put("jsonrpc", "2.0");
        root.set("id", id);
        root.set("result", mapper.valueToTree(result));
        return root.toString();
    }

    /// Creates an error response to a provider-initiated request.
    ///
    /// @param id the provider's request id, echoed verbatim
    /// @param code error code
    /// @param message error message
    /// @return JSON-RPC error response line without trailing newline
    public String createErrorResponse(JsonNode id, int code, String message) {
        ObjectNode root = mapper.createObjectNode();
        root.put("jsonrpc", "2.0");
        root.set("id", id);
        ObjectNode error = root.putObject("error");
        error.put("code", code);
        error.put("message", message);
        return root.toString();
    }

    /// Parses one protocol line as a JSON value.
    ///
    /// @param line the line without its terminating newline
    /// @return the parsed value, never null
    /// @throws ToolHostException of kind MALFORMED_MESSAGE if the line is not exactly one
    ///     JSON value
    public JsonNode parse(String line) {
        try {
            JsonNode node = lineReader.readTree(line);
            if (node == null || node.isMissingNode()) {
                throw ToolHostException.malformed("Empty protocol line");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new ToolHostException(
                    ErrorKind.MALFORMED_MESSAGE,
                    "Not a JSON value: " + e.getOriginalMessage(),
                    e);
        }
    }

    /// Decides which kind of JSON-RPC message a decoded value is.
    ///
    /// @param node decoded JSON value, not null
    /// @return the typed message, never null
    /// @throws ToolHostException of kind MALFORMED_MESSAGE if the value is no valid message
    public JsonRpcMessage classify(JsonNode node) {
        if (!node.isObject()) {
            throw ToolHostException.malformed("Message is not a JSON object");
        }

        JsonNode idNode = node.get("id");
        boolean hasId = idNode != null && !idNode.isNull();
        JsonNode methodNode = node.get("method");

        if (methodNode != null) {
            if (!methodNode.isTextual()) {
                throw ToolHostException.malformed("Message method is not a string");
            }
            JsonNode params = node.get("params");
            return hasId
                    ? new JsonRpcMessage.Request(idNode, methodNode.asText(), params)
                    : new JsonRpcMessage.Notification(methodNode.asText(), params);
        }

        JsonNode errorNode = node.get("error");
        if (errorNode != null && !errorNode.isNull()) {
            return new JsonRpcMessage.Response(idNode, null, parseError(errorNode));
        }
        if (node.has("result")) {
            if (!hasId) {
                throw ToolHostException.malformed("Result response without id");
            }
            return new JsonRpcMessage.Response(idNode, node.get("result"), null);
        }
        throw ToolHostException.malformed("Message has neither method, result nor error");
    }

    /// Converts a JSON object into an insertion-ordered map of plain Java values.
    ///
    /// @param node JSON value, may be null
    /// @return map view of an object node, empty for null or non-object values
    public Map<String, Object> toMap(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        return mapper.convertValue(node, MAP_TYPE);
    }

    private JsonRpcMessage.RpcError parseError(JsonNode errorNode) {
        if (!errorNode.isObject()) {
            return new JsonRpcMessage.RpcError(-1, errorNode.asText(), null);
        }
        int code = errorNode.path("code").asInt(-1);
        JsonNode message = errorNode.get("message");
        return new JsonRpcMessage.RpcError(
                code, message != null ? message.asText() : null, errorNode.get("data"));
    }
}
