package app.kartoteka.exchange.service.validation;

import java.util.regex.Pattern;

public final class IdentifierChecksums {

    private static final int[] NIP_WEIGHTS = {6, 5, 7, 2, 3, 4, 5, 6, 7};
    private static final int[] REGON9_WEIGHTS = {8, 9, 2, 3, 4, 5, 6, 7};
    private static final int[] REGON14_WEIGHTS = {2, 4, 8, 5, 0, 9, 7, 3, 6, 1, 2, 4, 8};
    private static final int[] PESEL_WEIGHTS = {1, 3, 7, 9, 1, 3, 7, 9, 1, 3};

    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Pattern POSTAL_CODE = Pattern.compile("^\\d{2}-\\d{3}$");
    private static final Pattern PHONE = Pattern.compile("^\\+?\\d{9,15}$");
    private static final Pattern PHONE_FORMATTING = Pattern.compile("[\\s\\-().]");

    private IdentifierChecksums() {
    }

    public static boolean isValidNip(String value) {
        if (!isDigits(value, 10)) {
            return false;
        }
        int remainder = weightedSum(value, NIP_WEIGHTS) % 11;
        // remainder 10 has no check digit, such numbers are never issued
        return remainder != 10 && remainder == digit(value, 9);
    }

    public static boolean isValidRegon(String value) {
        if (isDigits(value, 9)) {
            return regonCheckDigit(value, REGON9_WEIGHTS) == digit(value, 8);
        }
        if (isDigits(value, 14)) {
            return isValidRegon(value.substring(0, 9))
                    && regonCheckDigit(value, REGON14_WEIGHTS) == digit(value, 13);
        }
        return false;
    }

    public static boolean isValidPesel(String value) {
        if (!isDigits(value, 11)) {
            return false;
        }
        int check = (10 - weightedSum(value, PESEL_WEIGHTS) % 10) % 10;
        return check == digit(value, 10);
    }

    public static boolean isValidEmail(String value) {
        return value != null && value.length() <= 255 && EMAIL.matcher(value).matches();
    }

    public static boolean isValidPostalCode(String value) {
        return value != null && POSTAL_CODE.matcher(value).matches();
    }

    public static boolean isValidPhone(String value) {
        return value != null && PHONE.matcher(PHONE_FORMATTING.matcher(value).replaceAll("")).matches();
    }

    private static int regonCheckDigit(String value, int[] weights) {
        return weightedSum(value, weights) % 11 % 10;
    }

    private static int weightedSum(String value, int[] weights) {
        int sum = 0;
        for (int i = 0; i < weights.length; i++) {
            sum += digit(value, i) * weights[i];
        }
        return sum;
    }

    private static int digit(String value, int index) {
        return value.charAt(index) - '0';
    }

    private static boolean isDigits(String value, int length) {
        if (value == null || value.length() != length) {
            return false;
        }
        for (int i = 0; i < length; i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
