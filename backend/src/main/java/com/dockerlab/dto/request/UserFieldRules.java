package com.dockerlab.dto.request;

final class UserFieldRules {

    /** local-part@domain.tld, no whitespace (Unicode spaces included). */
    static final String EMAIL_PATTERN = "(?U)^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$";

    static final String NON_BLANK_PATTERN = "(?sU).*\\S.*";

    private UserFieldRules() {}
}
