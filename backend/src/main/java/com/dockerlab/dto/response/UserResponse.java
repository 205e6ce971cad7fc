package com.dockerlab.dto.response;

import com.dockerlab.model.User;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UserResponse {
    private boolean success;
    private String message;
    private User user;

    public static UserResponse of(User user) {
        return new UserResponse(true, null, user);
    }

    public static UserResponse of(String message, User user) {
        return new UserResponse(true, message, user);
    }
}
