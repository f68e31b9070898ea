package com.daoindexer.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Persisted key/value setting. Only one of the value fields is meaningful per key.
 */
@Document(collection = "settings")
@NoArgsConstructor
@Getter
@Setter
public class Setting {

    public static final String MASTER_ADDRESS = "MASTER_ADDRESS";
    public static final String IN_MAINNET = "IN_MAINNET";
    public static final String LAST_SEQNO = "LAST_SEQNO";

    @Id
    private String id;
    private String stringValue;
    private Boolean boolValue;
    private Long longValue;

    public static Setting ofString(String id, String value) {
        Setting s = new Setting();
        s.id = id;
        s.stringValue = value;
        return s;
    }

    public static Setting ofBool(String id, boolean value) {
        Setting s = new Setting();
        s.id = id;
        s.boolValue = value;
        return s;
    }

    public static Setting ofLong(String id, long value) {
        Setting s = new Setting();
        s.id = id;
        s.longValue = value;
        return s;
    }
}
