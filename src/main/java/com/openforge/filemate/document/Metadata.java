package com.openforge.filemate.document;

import org.apache.poi.ooxml.POIXMLProperties;

import java.time.ZoneId;
import java.util.Calendar;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Collects document properties, skipping empty values and rendering dates as
 * ISO local date-times.
 */
final class Metadata {

    private final Map<String, String> values = new LinkedHashMap<>();

    /** Core properties shared by every OOXML format. */
    static Map<String, String> ofCoreProperties(POIXMLProperties.CoreProperties core) {
        Metadata metadata = new Metadata();
        if (core != null) {
            metadata.put("title", core.getTitle());
            metadata.put("author", core.getCreator());
            metadata.put("subject", core.getSubject());
            metadata.put("created", core.getCreated());
            metadata.put("modified", core.getModified());
        }
        return metadata.asMap();
    }

    void put(String key, String value) {
        if (value != null && !value.isBlank()) {
            values.put(key, value.strip());
        }
    }

    void put(String key, Date value) {
        if (value != null) {
            values.put(key, value.toInstant().atZone(ZoneId.systemDefault()).toLocalDateTime().toString());
        }
    }

    void put(String key, Calendar value) {
        if (value != null) {
            put(key, value.getTime());
        }
    }

    Map<String, String> asMap() {
        return values;
    }
}
