package com.daoindexer.snapshot.query;

import com.daoindexer.config.CaffeineConfig;
import com.daoindexer.domain.Translation;
import com.daoindexer.domain.TranslationRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

/**
 * Per-request translation lookups for entities outside the translated active-order lists.
 */
@Service
@RequiredArgsConstructor
public class TranslationLookupService {

    private final TranslationRepository translationRepository;

    /** Translated text for the hash in the language (by name), or null when not translated yet. */
    @Cacheable(cacheNames = CaffeineConfig.TRANSLATION_CACHE, key = "#hash + ':' + #languageName", unless = "#result == null")
    public String findTranslatedText(String hash, String languageName) {
        return translationRepository.findFirstByHashAndLanguage(hash, languageName)
                .map(Translation::getTranslatedText)
                .orElse(null);
    }
}
