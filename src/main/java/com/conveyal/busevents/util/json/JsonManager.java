package com.conveyal.busevents.util.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

import java.io.File;
import java.io.IOException;

/**
 * Helper methods for reading and writing the JSON documents of this library (configuration, validation reports).
 * @param <T> the class this manager reads.
 */
public class JsonManager<T> {

    /** Shared mapper for callers that only need tree access or compact serialization. */
    public static final ObjectMapper MAPPER = new ObjectMapper();

    private final ObjectMapper om;
    private final ObjectWriter ow;
    private final Class<T> theClass;

    /**
     * Create a new JsonManager
     * @param theClass The class to create a json manager for (yes, also in the diamonds).
     */
    public JsonManager (Class<T> theClass) {
        this.theClass = theClass;
        this.om = new ObjectMapper();
        om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.ow = om.writer();
    }

    public String writePretty (Object o) throws JsonProcessingException {
        return ow.withDefaultPrettyPrinter().writeValueAsString(o);
    }

    public T read (File file) throws IOException {
        return om.readValue(file, theClass);
    }
}
