package dev.pagestack.config;

import java.util.List;
import java.util.Locale;

/**
 * Locales the API error messages are available in.
 */
public final class LocaleConstants {

    private LocaleConstants() {}

    public static final List<Locale> SUPPORTED_LOCALES = List.of(
            Locale.ENGLISH,
            Locale.GERMAN
    );

    public static final Locale DEFAULT_LOCALE = Locale.ENGLISH;
}
