package com.oyemi.lexicon.validation;

import com.oyemi.lexicon.dto.CheckResult;

/**
 * One independent check over a stored lexicon. Checks share no state and may run in any order.
 */
public interface ValidationCheck {

    String name();

    /**
     * Advisory checks report issues but always pass.
     */
    default boolean advisory() {
        return false;
    }

    CheckResult check(ValidationContext context);
}
