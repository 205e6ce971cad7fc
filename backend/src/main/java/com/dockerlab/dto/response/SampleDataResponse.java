package com.dockerlab.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SampleDataResponse {
    private String message;
    private List<Item> items;
    private int total;
    private Instant generatedAt;

    public record Item(int id, String name, int value) {}
}
