package com.fleetmanager.analytics.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class VehicleRequest {

    @NotBlank(message = "Plate is required")
    private String plate;

    private String brand;

    private String vehicleType;
}
