package com.componenttrace.core.inspector;

import com.componenttrace.core.session.TracerSession;
import com.componenttrace.core.session.TracerSessions;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.annotations.SerializedName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * JSON request router in front of the per-session {@link InspectorService}s.
 *
 * <p>A request looks like {@code {"session": "s1", "method": "getEventsSince", "args": {"after_id": 40}}}.
 * The reply is {@code {"ok": true, "result": ...}} or {@code {"ok": false, "error": "..."}}.
 * {@code listSessions} is the only method that needs no session.
 */
public final class InspectorEndpoint {

    private static final Logger log = LoggerFactory.getLogger(InspectorEndpoint.class);

    private final TracerSessions sessions;
    private final Gson gson;

    public InspectorEndpoint(TracerSessions sessions) {
        this(sessions, new Gson());
    }

    public InspectorEndpoint(TracerSessions sessions, Gson gson) {
        this.sessions = sessions;
        this.gson = gson;
    }

    public String handle(String requestJson) {
        JsonObject request;
        try {
            JsonElement parsed = JsonParser.parseString(requestJson);
            if (!parsed.isJsonObject()) return error("Request must be a JSON object");
            request = parsed.getAsJsonObject();
        } catch (JsonParseException e) {
            return error("Malformed request: " + e.getMessage());
        }

        String method = string(request, "method");
        if (method == null) return error("Missing method");
        JsonObject args = request.has("args") && request.get("args").isJsonObject()
            ? request.getAsJsonObject("args")
            : new JsonObject();

        if ("listSessions".equals(method)) {
            return ok(sessions.sessions().stream().map(TracerSession::id).sorted().toList());
        }

        String sessionId = string(request, "session");
        Optional<TracerSession> session = sessionId != null ? sessions.find(sessionId) : Optional.empty();
        if (session.isEmpty()) return error("Unknown session: " + sessionId);

        try {
            return dispatch(session.get().inspector(), method, args);
        } catch (IllegalArgumentException e) {
            return error(e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Inspector request {} failed for session {}", method, sessionId, e);
            return error("Request failed: " + method);
        }
    }

    private String dispatch(InspectorService inspector, String method, JsonObject args) {
        switch (method) {
            case "startRecording":
                inspector.startRecording();
                return ok(inspector.getState());
            case "stopRecording":
                inspector.stopRecording();
                return ok(inspector.getState());
            case "clearEvents":
                inspector.clearEvents();
                return ok(inspector.getState());
            case "setMaxEvents":
                return ok(Map.of("max_events", inspector.setMaxEvents(intArg(args, "max_events"))));
            case "getState":
                return ok(inspector.getState());
            case "getAllComponents":
                return ok(inspector.getAllComponents());
            case "getComponent": {
                int id = intArg(args, "component_id");
                return inspector.getComponent(id)
                    .map(this::ok)
                    .orElseGet(() -> error("Component not found: " + id));
            }
            case "getSubtree":
                return ok(inspector.getSubtree(intArg(args, "component_id")));
            case "getCounts":
                return ok(inspector.getCounts());
            case "getEvents":
                return ok(inspector.getEvents());
            case "getEventsSince":
                return ok(inspector.getEventsSince(longArg(args, "after_id")));
            case "getEventsInRange":
                return ok(inspector.getEventsInRange(doubleArg(args, "start_ms"), doubleArg(args, "end_ms")));
            case "getEventsForComponent":
                return ok(inspector.getEventsForComponent(intArg(args, "component_id")));
            case "getBatches":
                return ok(inspector.getBatches());
            case "getRankedComponents":
                return ok(inspector.getRankedComponents());
            default:
                return error("Unknown method: " + method);
        }
    }

    private String ok(Object result) {
        Reply reply = new Reply();
        reply.ok = true;
        reply.result = gson.toJsonTree(result);
        return gson.toJson(reply);
    }

    private String error(String message) {
        Reply reply = new Reply();
        reply.ok = false;
        reply.error = message;
        return gson.toJson(reply);
    }

    private static String string(JsonObject object, String key) {
        JsonElement value = object.get(key);
        return value != null && value.isJsonPrimitive() ? value.getAsString() : null;
    }

    private static int intArg(JsonObject args, String key) {
        return numberArg(args, key).intValue();
    }

    private static long longArg(JsonObject args, String key) {
        return numberArg(args, key).longValue();
    }

    private static double doubleArg(JsonObject args, String key) {
        return numberArg(args, key).doubleValue();
    }

    private static Number numberArg(JsonObject args, String key) {
        JsonElement value = args.get(key);
        if (value == null || !value.isJsonPrimitive() || !value.getAsJsonPrimitive().isNumber()) {
            throw new IllegalArgumentException("Missing numeric argument: " + key);
        }
        return value.getAsNumber();
    }

    static class Reply {
        @SerializedName("ok")     boolean ok;
        @SerializedName("result") JsonElement result;
        @SerializedName("error")  String error;
    }

    /** Builds a request string for callers that talk to the endpoint in-process. */
    public static String request(String session, String method, Map<String, ?> args) {
        JsonObject request = new JsonObject();
        if (session != null) request.addProperty("session", session);
        request.addProperty("method", method);
        request.add("args", new Gson().toJsonTree(args != null ? args : Map.of()));
        return request.toString();
    }
}
