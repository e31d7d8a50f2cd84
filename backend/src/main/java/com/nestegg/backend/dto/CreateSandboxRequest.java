package com.nestegg.backend.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateSandboxRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 120)
    private String name;

    // Falls back to sandbox.default-initial-cash
    @DecimalMin(value = "0.01", message = "Initial cash must be greater than zero")
    private BigDecimal initialCash;
}
