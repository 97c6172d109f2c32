package com.fintech.reconciliation.domain.iban;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Catalog of SEPA/EEA IBAN formats with detection and validation helpers.
 *
 * Covers 30 countries. Lengths range from 15 (Norway) to 31 (Malta).
 * UK, Switzerland and San Marino issue IBANs but are not part of the catalog.
 *
 * The catalog is built once at class initialisation and never modified, so it is
 * safe to read from any number of matcher threads.
 *
 * Unknown or malformed input is a normal outcome here: lookups return
 * {@link Optional#empty()} or {@code false}, never an exception.
 */
public final class IbanFormatRegistry {

    private static final Map<String, IbanFormat> FORMATS = buildCatalog();

    private static final String COMBINED_PATTERN = FORMATS.values().stream()
            .map(format -> "(?:" + format.fullPattern() + ")")
            .collect(Collectors.joining("|"));

    /** Compiled {@link #combinedPattern()}, case-insensitive. */
    public static final Pattern IBAN_PATTERN = Pattern.compile(COMBINED_PATTERN, Pattern.CASE_INSENSITIVE);

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^A-Z0-9]");

    private IbanFormatRegistry() {
    }

    private static Map<String, IbanFormat> buildCatalog() {
        Map<String, IbanFormat> formats = new LinkedHashMap<>();

        // Southern Europe
        register(formats, "IT", "Italy", 27, "\\d{2}[A-Z]\\d{10}[0-9A-Z]{12}", "IT60X0542811101000000123456");
        register(formats, "ES", "Spain", 24, "\\d{22}", "ES9121000418450200051332");
        register(formats, "PT", "Portugal", 25, "\\d{23}", "PT50000201231234567890154");
        register(formats, "GR", "Greece", 27, "\\d{2}\\d{3}\\d{4}[A-Z0-9]{16}", "GR1601101250000000012300695");
        register(formats, "MT", "Malta", 31, "\\d{2}[A-Z]{4}\\d{5}[A-Z0-9]{18}", "MT84MALT011000012345MTLCAST001S");
        register(formats, "CY", "Cyprus", 28, "\\d{2}\\d{3}\\d{5}[A-Z0-9]{16}", "CY17002001280000001200527600");
        register(formats, "SI", "Slovenia", 19, "\\d{2}\\d{5}\\d{8}\\d{2}", "SI56263300012039086");
        register(formats, "HR", "Croatia", 21, "\\d{19}", "HR1210010051863000160");

        // Western Europe
        register(formats, "FR", "France", 27, "\\d{12}[A-Z0-9]{11}\\d{2}", "FR1420041010050500013M02606");
        register(formats, "DE", "Germany", 22, "\\d{20}", "DE89370400440532013000");
        register(formats, "NL", "Netherlands", 18, "\\d{2}[A-Z]{4}\\d{10}", "NL91ABNA0417164300");
        register(formats, "BE", "Belgium", 16, "\\d{14}", "BE68539007547034");
        register(formats, "LU", "Luxembourg", 20, "\\d{2}\\d{3}[A-Z0-9]{13}", "LU280019400644750000");
        register(formats, "AT", "Austria", 20, "\\d{18}", "AT611904300234573201");
        register(formats, "LI", "Liechtenstein", 21, "\\d{2}\\d{5}[A-Z0-9]{12}", "LI21088100002324013AA");

        // Northern Europe
        register(formats, "IE", "Ireland", 22, "\\d{2}[A-Z]{4}\\d{14}", "IE29AIBK93115212345678");
        register(formats, "DK", "Denmark", 18, "\\d{16}", "DK5000400440116243");
        register(formats, "FI", "Finland", 18, "\\d{16}", "FI2112345600000785");
        register(formats, "SE", "Sweden", 24, "\\d{22}", "SE4550000000058398257466");
        register(formats, "NO", "Norway", 15, "\\d{13}", "NO9386011117947");
        register(formats, "IS", "Iceland", 26, "\\d{24}", "IS140159260076545510730339");

        // Eastern Europe
        register(formats, "PL", "Poland", 28, "\\d{26}", "PL61109010140000071219812874");
        register(formats, "CZ", "Czech Republic", 24, "\\d{22}", "CZ6508000000192000145399");
        register(formats, "SK", "Slovakia", 24, "\\d{22}", "SK3112000000198742637541");
        register(formats, "HU", "Hungary", 28, "\\d{26}", "HU42117730161111101800000000");
        register(formats, "RO", "Romania", 24, "\\d{2}[A-Z]{4}[A-Z0-9]{16}", "RO49AAAA1B31007593840000");
        register(formats, "BG", "Bulgaria", 22, "\\d{2}[A-Z]{4}\\d{14}", "BG80BNBG96611020345678");

        // Baltic states
        register(formats, "EE", "Estonia", 20, "\\d{18}", "EE382200221020145685");
        register(formats, "LV", "Latvia", 21, "\\d{2}[A-Z]{4}[A-Z0-9]{13}", "LV80BANK0000435195001");
        register(formats, "LT", "Lithuania", 20, "\\d{18}", "LT121000011101001000");

        return Collections.unmodifiableMap(formats);
    }

    private static void register(Map<String, IbanFormat> formats, String code, String name,
                                 int length, String pattern, String example) {
        if (formats.putIfAbsent(code, new IbanFormat(code, name, length, pattern, example)) != null) {
            throw new IllegalStateException("Duplicate IBAN format for country " + code);
        }
    }

    /**
     * Single alternation pattern matching any cataloged country's IBAN shape.
     * Each country is wrapped in a non-capturing group.
     */
    public static String combinedPattern() {
        return COMBINED_PATTERN;
    }

    /**
     * Country code from the first two characters, if cataloged.
     */
    public static Optional<String> detectCountry(String iban) {
        if (iban == null || iban.length() < 2) {
            return Optional.empty();
        }
        String code = iban.substring(0, 2).toUpperCase(Locale.ROOT);
        return FORMATS.containsKey(code) ? Optional.of(code) : Optional.empty();
    }

    /**
     * Whether the IBAN has exactly the length of its detected country's format.
     * False for unknown countries.
     */
    public static boolean validateLength(String iban) {
        return detectCountry(iban)
                .map(code -> FORMATS.get(code).getLength() == iban.length())
                .orElse(false);
    }

    public static Optional<String> countryName(String iban) {
        return detectCountry(iban).map(code -> FORMATS.get(code).getCountryName());
    }

    public static Optional<String> exampleFor(String countryCode) {
        return formatFor(countryCode).map(IbanFormat::getExample);
    }

    public static Optional<IbanFormat> formatFor(String countryCode) {
        if (countryCode == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(FORMATS.get(countryCode.toUpperCase(Locale.ROOT)));
    }

    /**
     * Sorted ISO country codes of every cataloged format.
     */
    public static List<String> supportedCountries() {
        List<String> codes = new ArrayList<>(FORMATS.keySet());
        Collections.sort(codes);
        return Collections.unmodifiableList(codes);
    }

    /**
     * Upper-case and strip whitespace and separators. Null becomes "".
     */
    public static String normalize(String iban) {
        if (iban == null) {
            return "";
        }
        return NON_ALPHANUMERIC.matcher(iban.toUpperCase(Locale.ROOT)).replaceAll("");
    }

    /**
     * ISO 13616 MOD-97 check on a normalized IBAN.
     */
    public static boolean hasValidChecksum(String iban) {
        if (iban == null || iban.length() < 5) {
            return false;
        }
        String rearranged = iban.substring(4) + iban.substring(0, 4);
        int remainder = 0;
        for (int i = 0; i < rearranged.length(); i++) {
            char ch = Character.toUpperCase(rearranged.charAt(i));
            if (ch >= '0' && ch <= '9') {
                remainder = (remainder * 10 + (ch - '0')) % 97;
            } else if (ch >= 'A' && ch <= 'Z') {
                int value = ch - 'A' + 10;
                remainder = (remainder * 100 + value) % 97;
            } else {
                return false;
            }
        }
        return remainder == 1;
    }

    /**
     * First six and last four characters, for match reasons and logs.
     */
    public static String mask(String iban) {
        if (iban == null || iban.length() <= 10) {
            return iban;
        }
        return iban.substring(0, 6) + "..." + iban.substring(iban.length() - 4);
    }
}
