package com.dockerlab.dto.response;

import com.dockerlab.model.StoreProbe;
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
public class DbTestResponse {
    private boolean success;
    private StoreProbe data;
    private String message;
    private String error;
}
