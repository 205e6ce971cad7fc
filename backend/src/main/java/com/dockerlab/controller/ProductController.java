package com.dockerlab.controller;

import com.dockerlab.dto.response.ProductListResponse;
import com.dockerlab.service.ProductService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

// ========== Product Controller ==========
@RestController
@RequestMapping("/products")
@RequiredArgsConstructor
@Tag(name = "Products", description = "Read-only product catalog")
public class ProductController {

    private final ProductService productService;

    @GetMapping
    @Operation(summary = "Get all products, newest first")
    public ResponseEntity<ProductListResponse> getAllProducts() {
        return ResponseEntity.ok(ProductListResponse.of(productService.getAllProducts()));
    }
}
