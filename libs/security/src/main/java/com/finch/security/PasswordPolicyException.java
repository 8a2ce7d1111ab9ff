package com.finch.security;

import com.finch.validation.ValidationErrors;
import com.finch.validation.ValidationException;

/**
 * A password was refused by {@link PasswordPolicy}. Carries every violation found.
 */
public class PasswordPolicyException extends ValidationException {

    public PasswordPolicyException(ValidationErrors errors) {
        super(errors);
    }
}
