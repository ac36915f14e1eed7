package work.formgraph.shared;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Machine-name helpers for node keys.
 */
public final class Keys {
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]");
    private static final Pattern UNDERSCORE_RUN = Pattern.compile("_+");
    private static final Pattern IDENTIFIER = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");

    private Keys() {}

    /**
     * Lower-cases the title and folds every run of non-alphanumerics into a single underscore.
     */
    public static String slugify(String title) {
        if (title == null) {
            return "";
        }
        String slug = NON_ALNUM.matcher(title.toLowerCase(Locale.ROOT)).replaceAll("_");
        slug = UNDERSCORE_RUN.matcher(slug).replaceAll("_");
        if (slug.startsWith("_")) {
            slug = slug.substring(1);
        }
        if (slug.endsWith("_")) {
            slug = slug.substring(0, slug.length() - 1);
        }
        return slug;
    }

    /**
     * Returns {@code base} when free, otherwise the first {@code base_N} (N starting at 2) not in {@code taken}.
     */
    public static String disambiguate(String base, Set<String> taken) {
        if (!taken.contains(base)) {
            return base;
        }
        int suffix = 2;
        while (taken.contains(base + "_" + suffix)) {
            suffix++;
        }
        return base + "_" + suffix;
    }

    public static boolean isIdentifier(String key) {
        return key != null && IDENTIFIER.matcher(key).matches();
    }
}
