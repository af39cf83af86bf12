package org.dxworks.plcframe;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

public class TestUtils {
    public static final ObjectMapper APPROVAL_MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    /** Approved files end with a newline. */
    public static String approvalJson(Object value) throws JsonProcessingException {
        return APPROVAL_MAPPER.writeValueAsString(value) + "\n";
    }
}
