package com.warden.security;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Message templates for validation failures, keyed by symbolic id.
 * <p>
 * Templates live in the {@code com.warden.security.messages} resource bundle and use
 * {@link MessageFormat} syntax.
 */
public final class Messages {

    /** Locale used when the host does not ask for another one. */
    public static final Locale DEFAULT_LOCALE = Locale.US;

    private static final String BUNDLE = "com.warden.security.messages";

    private Messages() {
        // utility class
    }

    /**
     * Formats the template for the symbolic id in the default locale.
     */
    public static LocalizedText format(String symbolicId, Object... args) {
        return format(DEFAULT_LOCALE, symbolicId, args);
    }

    /**
     * Formats the template for the symbolic id. Unknown ids yield the id itself.
     *
     * @param locale     the requested locale
     * @param symbolicId the template key (e.g., "InvalidCertificate")
     * @param args       template arguments
     */
    public static LocalizedText format(Locale locale, String symbolicId, Object... args) {
        ResourceBundle bundle = ResourceBundle.getBundle(BUNDLE, locale);
        String template;
        try {
            template = bundle.getString(symbolicId);
        } catch (MissingResourceException e) {
            return new LocalizedText(bundle.getLocale().toLanguageTag(), symbolicId);
        }
        String tag = bundle.getLocale().equals(Locale.ROOT) ? DEFAULT_LOCALE.toLanguageTag()
                : bundle.getLocale().toLanguageTag();
        return new LocalizedText(tag, new MessageFormat(template, locale).format(args));
    }
}
