package uk.gegc.livequiz.features.question.application.scoring;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

@Component
public class FreeTextNormalizer {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Trims, strips diacritics, collapses whitespace runs and, unless {@code caseSensitive},
     * lower-cases with {@link Locale#ROOT}.
     */
    public String normalize(String input, boolean caseSensitive) {
        if (input == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(input.trim(), Normalizer.Form.NFD);
        String stripped = COMBINING_MARKS.matcher(decomposed).replaceAll("");
        String collapsed = WHITESPACE.matcher(stripped).replaceAll(" ").trim();
        return caseSensitive ? collapsed : collapsed.toLowerCase(Locale.ROOT);
    }
}
