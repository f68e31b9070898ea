package com.daoindexer.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Supported language: stable {@code hash} key plus display {@code name}. Translations are stored per name.
 */
@Document(collection = "languages")
@NoArgsConstructor
@Getter
@Setter
public class Language {

    @Id
    private String hash;
    private String name;

    public Language(String hash, String name) {
        this.hash = hash;
        this.name = name;
    }

    /** True when {@code value} is this language's hash or name, ignoring case. */
    public boolean matches(String value) {
        return value != null && (value.equalsIgnoreCase(hash) || value.equalsIgnoreCase(name));
    }
}
