package com.finch.security;

import com.finch.validation.FieldError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PasswordPolicy")
class PasswordPolicyTest {

    @Nested
    @DisplayName("validate()")
    class Validate {

        @Test
        @DisplayName("accepts a password satisfying every rule")
        void acceptsStrongPassword() {
            assertThat(PasswordPolicy.validate("SecurePass123!").hasErrors()).isFalse();
            assertThat(PasswordPolicy.isAcceptable("SecurePass123!")).isTrue();
        }

        @Test
        @DisplayName("reports every violation of 'weak' at once")
        void reportsAllViolations() {
            var errors = PasswordPolicy.validate("weak");

            assertThat(errors.errors())
                    .extracting(FieldError::message)
                    .containsExactly(
                            "must be at least 8 characters long",
                            "must contain at least one uppercase letter",
                            "must contain at least one number",
                            "must contain at least one special character");
            assertThat(errors.errors()).extracting(FieldError::field).containsOnly("password");
        }

        @Test
        @DisplayName("rejects passwords longer than 128 characters with a distinct message")
        void rejectsTooLong() {
            String password = "Aa1!" + "a".repeat(125);

            assertThat(PasswordPolicy.validate(password).render())
                    .isEqualTo("password: must be at most 128 characters long");
        }

        @Test
        @DisplayName("accepts exactly 8 and exactly 128 characters")
        void acceptsBoundaries() {
            assertThat(PasswordPolicy.isAcceptable("Aa1!aaaa")).isTrue();
            assertThat(PasswordPolicy.isAcceptable("Aa1!" + "a".repeat(124))).isTrue();
        }

        @Test
        @DisplayName("counts currency and math symbols as special characters")
        void unicodeSymbols() {
            assertThat(PasswordPolicy.isAcceptable("Pässwörd1€")).isTrue();
            assertThat(PasswordPolicy.isAcceptable("Password1+")).isTrue();
        }

        @Test
        @DisplayName("treats null as an empty password")
        void nullPassword() {
            assertThat(PasswordPolicy.validate(null).size()).isEqualTo(5);
        }
    }

    @Nested
    @DisplayName("score() and label()")
    class Scoring {

        @ParameterizedTest(name = "\"{0}\" scores {1} ({2})")
        @CsvSource({
                "Abc123!@#, 90, Very Strong",
                "password123, 50, Medium",
                "Password123, 75, Strong",
                "weak, 15, Very Weak",
                "SuperSecurePass123!@#, 100, Very Strong",
                "SecurePass123!, 100, Very Strong"
        })
        void scoresExamples(String password, int score, String label) {
            assertThat(PasswordPolicy.score(password)).isEqualTo(score);
            assertThat(PasswordPolicy.label(password)).isEqualTo(label);
        }

        @Test
        @DisplayName("never exceeds 100")
        void clampsAt100() {
            assertThat(PasswordPolicy.score("Aa1!Aa1!Aa1!Aa1!Aa1!")).isEqualTo(PasswordPolicy.MAX_SCORE);
        }

        @Test
        @DisplayName("passwords scoring exactly on a band boundary get that band")
        void exactBoundaries() {
            assertThat(PasswordPolicy.score("ABCDEFGHabcdefgh")).isEqualTo(80);
            assertThat(PasswordPolicy.strength("ABCDEFGHabcdefgh")).isEqualTo(PasswordStrength.VERY_STRONG);

            assertThat(PasswordPolicy.score("ABCDabcd")).isEqualTo(60);
            assertThat(PasswordPolicy.strength("ABCDabcd")).isEqualTo(PasswordStrength.STRONG);

            assertThat(PasswordPolicy.score("Ab")).isEqualTo(40);
            assertThat(PasswordPolicy.strength("Ab")).isEqualTo(PasswordStrength.MEDIUM);

            assertThat(PasswordPolicy.score("        ")).isEqualTo(20);
            assertThat(PasswordPolicy.strength("        ")).isEqualTo(PasswordStrength.WEAK);

            assertThat(PasswordPolicy.score("")).isZero();
            assertThat(PasswordPolicy.strength("")).isEqualTo(PasswordStrength.VERY_WEAK);
        }
    }

    @Nested
    @DisplayName("PasswordStrength.fromScore()")
    class FromScore {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
                "100, VERY_STRONG",
                "80, VERY_STRONG",
                "79, STRONG",
                "60, STRONG",
                "59, MEDIUM",
                "40, MEDIUM",
                "39, WEAK",
                "20, WEAK",
                "19, VERY_WEAK",
                "0, VERY_WEAK"
        })
        void bands(int score, PasswordStrength expected) {
            assertThat(PasswordStrength.fromScore(score)).isEqualTo(expected);
        }
    }
}
