package com.incidents.stats.model.readonly;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Read-only model for process settings written by the feed adapter.
 */
@Document(collection = "app_settings")
public class AppSettingDocument {

    public static final String TRACKING_STARTED_AT = "tracking_started_at";

    @Id
    private String id;

    private String value;

    public String getKey() { return id; }
    public String getValue() { return value; }
}
