package com.finch.validation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FieldValidators")
class FieldValidatorsTest {

    @Nested
    @DisplayName("required()")
    class Required {

        @Test
        @DisplayName("rejects null and blank values")
        void rejectsBlank() {
            var errors = new ValidationErrors();
            assertThat(FieldValidators.required(errors, "first_name", null)).isFalse();
            assertThat(FieldValidators.required(errors, "last_name", "   ")).isFalse();
            assertThat(errors.render())
                    .isEqualTo("first_name: first_name is required; last_name: last_name is required");
        }

        @Test
        @DisplayName("accepts non-blank values")
        void acceptsValue() {
            var errors = new ValidationErrors();
            assertThat(FieldValidators.required(errors, "first_name", "Ada")).isTrue();
            assertThat(errors.hasErrors()).isFalse();
        }
    }

    @Nested
    @DisplayName("email()")
    class Email {

        @Test
        @DisplayName("accepts a well-formed address")
        void acceptsValid() {
            var errors = new ValidationErrors();
            assertThat(FieldValidators.email(errors, "email", "ada@example.com")).isTrue();
            assertThat(errors.hasErrors()).isFalse();
        }

        @Test
        @DisplayName("rejects a malformed address")
        void rejectsMalformed() {
            var errors = new ValidationErrors();
            assertThat(FieldValidators.email(errors, "email", "ada@example")).isFalse();
            assertThat(errors.render()).isEqualTo("email: invalid email format");
        }

        @Test
        @DisplayName("rejects addresses longer than 254 characters")
        void rejectsTooLong() {
            var errors = new ValidationErrors();
            String local = "a".repeat(250);
            assertThat(FieldValidators.email(errors, "email", local + "@example.com")).isFalse();
            assertThat(errors.render()).contains("too long");
        }

        @Test
        @DisplayName("reports a missing address as required, only once")
        void missing() {
            var errors = new ValidationErrors();
            assertThat(FieldValidators.email(errors, "email", "")).isFalse();
            assertThat(errors.size()).isEqualTo(1);
            assertThat(errors.render()).isEqualTo("email: email is required");
        }
    }

    @Nested
    @DisplayName("name()")
    class Name {

        @Test
        @DisplayName("accepts letters, spaces, hyphens and apostrophes")
        void acceptsValid() {
            var errors = new ValidationErrors();
            assertThat(FieldValidators.name(errors, "last_name", "O'Neil-Smith Jr")).isTrue();
        }

        @Test
        @DisplayName("rejects digits")
        void rejectsDigits() {
            var errors = new ValidationErrors();
            assertThat(FieldValidators.name(errors, "first_name", "R2D2")).isFalse();
            assertThat(errors.render()).contains("can only contain letters");
        }

        @Test
        @DisplayName("rejects single-character names")
        void rejectsTooShort() {
            var errors = new ValidationErrors();
            assertThat(FieldValidators.name(errors, "first_name", "A")).isFalse();
            assertThat(errors.render())
                    .isEqualTo("first_name: first_name must be at least 2 characters long");
        }
    }
}
