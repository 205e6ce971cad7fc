package com.dockerlab.dto.response;

import com.dockerlab.model.Product;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductListResponse {
    private boolean success;
    private int count;
    private List<Product> products;

    public static ProductListResponse of(List<Product> products) {
        return new ProductListResponse(true, products.size(), products);
    }
}
