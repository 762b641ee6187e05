package com.tyron.nsedit.core.language;

import com.tyron.nsedit.api.language.LanguageSupport;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Routes files to the {@link LanguageSupport} that can handle them.
 */
public final class LanguageRegistry {

    private final ConcurrentHashMap<String, LanguageSupport> languagesById = new ConcurrentHashMap<>();

    public void register(LanguageSupport language) {
        if (language == null) {
            throw new IllegalArgumentException("language is null");
        }
        String id = language.getId();
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("language id is blank");
        }
        languagesById.put(id.trim(), language);
    }

    public void unregister(String languageId) {
        if (languageId == null || languageId.isBlank()) return;
        languagesById.remove(languageId.trim());
    }

    public LanguageSupport getLanguage(String languageId) {
        if (languageId == null || languageId.isBlank()) return null;
        return languagesById.get(languageId.trim());
    }

    /**
     * @return The first registered language that handles {@code fileName}, or null.
     */
    public LanguageSupport findForFile(String fileName) {
        if (fileName == null || fileName.isBlank()) return null;
        for (LanguageSupport language : languagesById.values()) {
            if (language.canHandle(fileName)) {
                return language;
            }
        }
        return null;
    }

    public List<LanguageSupport> getLanguages() {
        return new ArrayList<>(languagesById.values());
    }
}
