package energy.server.orchestration;

import io.vertx.core.json.JsonObject;

/**
 * Outcome of a tool call: either a success with meta and payload keys, or a
 * failure with an error message. Never both.
 */
public class ResponseEnvelope {

    private final JsonObject meta;
    private final JsonObject payload;
    private final String error;

    private ResponseEnvelope(JsonObject meta, JsonObject payload, String error) {
        this.meta = meta;
        this.payload = payload;
        this.error = error;
    }

    public static ResponseEnvelope success(JsonObject meta, JsonObject payload) {
        return new ResponseEnvelope(meta.copy(), payload.copy(), null);
    }

    public static ResponseEnvelope failure(String error) {
        return new ResponseEnvelope(null, null, error == null ? "Unknown error" : error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public String getError() {
        return error;
    }

    public JsonObject toJson() {
        if (!isSuccess()) {
            return new JsonObject().put("error", error);
        }
        JsonObject json = new JsonObject().put("meta", meta.copy());
        payload.copy().forEach(e -> json.put(e.getKey(), e.getValue()));
        return json;
    }

    @Override
    public String toString() {
        return toJson().encode();
    }
}
