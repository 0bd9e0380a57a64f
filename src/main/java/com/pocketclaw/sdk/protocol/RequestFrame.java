package com.pocketclaw.sdk.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Client to server request: {@code {type:"req", id, method, params?}}.
 *
 * <p>Empty params (absent, JSON null, {@code {}} or {@code []}) are normalized to
 * no params at all, so the {@code params} key is omitted on the wire.</p>
 */
@JsonPropertyOrder({"type", "id", "method", "params"})
public class RequestFrame {

    public static final String TYPE = "req";

    @JsonProperty("type")
    private final String type = TYPE;

    @JsonProperty("id")
    private final String id;

    @JsonProperty("method")
    private final String method;

    @JsonProperty("params")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private final JsonNode params;

    public RequestFrame(String id, String method, JsonNode params) {
        this.id = id;
        this.method = method;
        this.params = isEmpty(params) ? null : params;
    }

    public RequestFrame(String id, String method) {
        this(id, method, null);
    }

    public String getType() {
        return type;
    }

    public String getId() {
        return id;
    }

    public String getMethod() {
        return method;
    }

    public JsonNode getParams() {
        return params;
    }

    private static boolean isEmpty(JsonNode params) {
        return params == null
                || params.isNull()
                || params.isMissingNode()
                || (params.isContainerNode() && params.size() == 0);
    }

    @Override
    public String toString() {
        return "RequestFrame{" +
                "id='" + id + '\'' +
                ", method='" + method + '\'' +
                '}';
    }
}
