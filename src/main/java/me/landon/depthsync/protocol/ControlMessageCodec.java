package me.landon.depthsync.protocol;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

public final class ControlMessageCodec {
    private final Gson gson = new Gson();

    public String encode(ControlMessage.DepthRequest request) {
        JsonObject json = new JsonObject();
        json.addProperty(ProtocolConstants.REQUEST_TIME_FIELD, request.timeMs());
        return gson.toJson(json);
    }

    /**
     * Parses an inbound text message.
     *
     * @throws JsonParseException if the text is not a JSON object
     */
    public ControlMessage decode(String text) {
        JsonElement element = JsonParser.parseString(text);

        if (!element.isJsonObject()) {
            throw new JsonParseException("Control message is not a JSON object");
        }

        JsonObject json = element.getAsJsonObject();

        if (json.has(ProtocolConstants.REQUEST_TIME_FIELD)) {
            try {
                return new ControlMessage.DepthRequest(
                        json.get(ProtocolConstants.REQUEST_TIME_FIELD).getAsLong());
            } catch (UnsupportedOperationException | IllegalStateException ex) {
                throw new JsonParseException("Invalid time_ms value", ex);
            } catch (IllegalArgumentException ex) {
                throw new JsonParseException(ex.getMessage(), ex);
            }
        }

        String type = stringField(json, ProtocolConstants.CONTROL_TYPE_FIELD);

        if (ProtocolConstants.CONTROL_TYPE_ERROR.equals(type)) {
            return new ControlMessage.ServerError(
                    stringField(json, ProtocolConstants.CONTROL_MESSAGE_FIELD));
        }

        return new ControlMessage.Unrecognized(type);
    }

    private static String stringField(JsonObject json, String field) {
        JsonElement value = json.get(field);

        if (value == null || value.isJsonNull()) {
            return "";
        }

        return value.isJsonPrimitive() ? value.getAsString() : value.toString();
    }
}
