package com.daoindexer.snapshot;

import com.daoindexer.domain.Language;
import com.daoindexer.domain.Order;
import com.daoindexer.domain.User;

import java.util.function.BiFunction;

/**
 * Builds translated copies of orders and users. The passed entity is never modified.
 *
 * <p>The lookup receives a content hash and a language name and returns the translated text or null.
 * Translated fields stay null when no translation exists or when the order is already in the target language.
 */
public final class OrderTranslations {

    private OrderTranslations() {
    }

    public static Order translatedCopy(Order order, Language language, BiFunction<String, String, String> lookup) {
        Order copy = new Order(order);
        copy.setNameTranslated(null);
        copy.setDescriptionTranslated(null);
        copy.setTechnicalTaskTranslated(null);
        if (language.matches(order.getLanguage())) {
            return copy;
        }
        String target = language.getName();
        if (order.getNameHash() != null) {
            copy.setNameTranslated(lookup.apply(order.getNameHash(), target));
        }
        if (order.getDescriptionHash() != null) {
            copy.setDescriptionTranslated(lookup.apply(order.getDescriptionHash(), target));
        }
        if (order.getTechnicalTaskHash() != null) {
            copy.setTechnicalTaskTranslated(lookup.apply(order.getTechnicalTaskHash(), target));
        }
        return copy;
    }

    public static User translatedCopy(User user, Language language, BiFunction<String, String, String> lookup) {
        User copy = new User(user);
        copy.setAboutTranslated(null);
        if (user.getAboutHash() != null && !language.matches(user.getLanguage())) {
            copy.setAboutTranslated(lookup.apply(user.getAboutHash(), language.getName()));
        }
        return copy;
    }
}
