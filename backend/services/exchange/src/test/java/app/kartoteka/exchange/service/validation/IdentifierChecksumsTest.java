package app.kartoteka.exchange.service.validation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IdentifierChecksumsTest {

    @Test
    void acceptsNipWithMatchingCheckDigit() {
        assertTrue(IdentifierChecksums.isValidNip("5270103391"));
    }

    @Test
    void rejectsNipWithWrongCheckDigitOrShape() {
        assertFalse(IdentifierChecksums.isValidNip("5270103392"));
        assertFalse(IdentifierChecksums.isValidNip("527010339"));
        assertFalse(IdentifierChecksums.isValidNip("527-010-33-91"));
        assertFalse(IdentifierChecksums.isValidNip(null));
    }

    @Test
    void rejectsEverySingleDigitCorruptionOfValidNip() {
        String valid = "5270103391";
        for (int position = 0; position < valid.length(); position++) {
            for (char digit = '0'; digit <= '9'; digit++) {
                if (digit == valid.charAt(position)) {
                    continue;
                }
                String corrupted = valid.substring(0, position) + digit + valid.substring(position + 1);
                assertFalse(IdentifierChecksums.isValidNip(corrupted), corrupted);
            }
        }
    }

    @Test
    void validatesBothRegonLengths() {
        assertTrue(IdentifierChecksums.isValidRegon("123456785"));
        assertTrue(IdentifierChecksums.isValidRegon("12345678512347"));
        assertFalse(IdentifierChecksums.isValidRegon("123456784"));
        assertFalse(IdentifierChecksums.isValidRegon("12345678512340"));
        assertFalse(IdentifierChecksums.isValidRegon("1234567851"));
    }

    @Test
    void longRegonRequiresValidShortPrefix() {
        assertFalse(IdentifierChecksums.isValidRegon("12345678412347"));
    }

    @Test
    void validatesPesel() {
        assertTrue(IdentifierChecksums.isValidPesel("44051401359"));
        assertFalse(IdentifierChecksums.isValidPesel("44051401358"));
        assertFalse(IdentifierChecksums.isValidPesel("4405140135"));
    }

    @Test
    void validatesContactFields() {
        assertTrue(IdentifierChecksums.isValidEmail("biuro@example.pl"));
        assertFalse(IdentifierChecksums.isValidEmail("biuro@example"));
        assertFalse(IdentifierChecksums.isValidEmail("biuro @example.pl"));

        assertTrue(IdentifierChecksums.isValidPostalCode("00-950"));
        assertFalse(IdentifierChecksums.isValidPostalCode("00950"));

        assertTrue(IdentifierChecksums.isValidPhone("+48 601 234 567"));
        assertTrue(IdentifierChecksums.isValidPhone("(22) 123-45-67"));
        assertFalse(IdentifierChecksums.isValidPhone("12345"));
    }
}
