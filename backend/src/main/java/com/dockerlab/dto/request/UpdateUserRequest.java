package com.dockerlab.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update: absent (null) fields keep their stored value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateUserRequest {

    @Pattern(regexp = UserFieldRules.NON_BLANK_PATTERN, message = "Name must not be blank")
    @Size(max = 100, message = "Name must be at most 100 characters")
    private String name;

    @Pattern(regexp = UserFieldRules.EMAIL_PATTERN, message = "Invalid email format")
    @Size(max = 100, message = "Email must be at most 100 characters")
    private String email;

    @JsonIgnore
    @AssertTrue(message = "At least one field (name or email) is required for an update")
    public boolean isAnyFieldPresent() {
        return name != null || email != null;
    }
}
