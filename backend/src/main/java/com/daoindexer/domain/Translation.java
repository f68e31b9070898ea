package com.daoindexer.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Translation of one text (by content hash) into one language (by language name).
 * Written by the translation worker; {@code translatedText} stays null until it is done.
 */
@Document(collection = "translations")
@CompoundIndex(name = "hash_language", def = "{'hash': 1, 'language': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
public class Translation {

    @Id
    private String id;
    private String hash;
    private String language;
    private String translatedText;
    private Instant timestamp;

    public Translation(String hash, String language, String translatedText) {
        this.hash = hash;
        this.language = language;
        this.translatedText = translatedText;
        this.timestamp = Instant.now();
    }
}
