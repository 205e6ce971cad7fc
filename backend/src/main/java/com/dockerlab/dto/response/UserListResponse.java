package com.dockerlab.dto.response;

import com.dockerlab.model.User;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserListResponse {
    private boolean success;
    private int count;
    private List<User> users;

    public static UserListResponse of(List<User> users) {
        return new UserListResponse(true, users.size(), users);
    }
}
