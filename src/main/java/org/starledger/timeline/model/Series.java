package org.starledger.timeline.model;

import com.google.gson.JsonObject;

/**
 * One independent, named history.
 *
 * @param name       The series name.
 * @param schemaName The storage namespace holding the series' data.
 * @param metadata   Descriptive data such as the observer country and galaxy settings.
 */
public record Series(String name, String schemaName, JsonObject metadata) {

    public Series {
        metadata = metadata == null ? new JsonObject() : metadata.deepCopy();
    }

    @Override
    public JsonObject metadata() {
        return metadata.deepCopy();
    }
}
