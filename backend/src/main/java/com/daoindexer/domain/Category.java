package com.daoindexer.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection = "categories")
@NoArgsConstructor
@Getter
@Setter
public class Category {

    @Id
    private String hash;
    private String name;

    public Category(String hash, String name) {
        this.hash = hash;
        this.name = name;
    }
}
