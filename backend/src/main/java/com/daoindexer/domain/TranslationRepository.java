package com.daoindexer.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface TranslationRepository extends MongoRepository<Translation, String> {

    /** Translations of the given hashes into one language (by language name). */
    List<Translation> findByLanguageAndHashIn(String language, Collection<String> hashes);

    Optional<Translation> findFirstByHashAndLanguage(String hash, String language);
}
