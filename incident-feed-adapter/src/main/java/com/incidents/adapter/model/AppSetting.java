package com.incidents.adapter.model;

import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Process-wide key/value setting. The key is the document id.
 */
@Document(collection = "app_settings")
public class AppSetting extends BaseDocument {

    /**
     * Key of the timestamp from which closure durations are trusted
     */
    public static final String TRACKING_STARTED_AT = "tracking_started_at";

    private String value;

    public AppSetting() {
        super();
    }

    public String getKey() {
        return getId();
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }
}
