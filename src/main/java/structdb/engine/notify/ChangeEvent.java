package structdb.engine.notify;

import java.time.Instant;

import com.google.gson.JsonObject;

/**
 * A committed record mutation. The payload is the record as stored (with id
 * and parent_id); for deletions it is the last stored state.
 */
public record ChangeEvent(String structureName,
                          ChangeKind kind,
                          long recordId,
                          JsonObject payload,
                          Instant timestamp) {

    // Events fan out to many subscribers; each gets its own copy of the payload
    @Override
    public JsonObject payload() { return payload.deepCopy(); }
}
