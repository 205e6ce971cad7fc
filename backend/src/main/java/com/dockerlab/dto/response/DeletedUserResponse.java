package com.dockerlab.dto.response;

import com.dockerlab.model.User;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeletedUserResponse {
    private boolean success;
    private String message;
    private User deletedUser;
}
