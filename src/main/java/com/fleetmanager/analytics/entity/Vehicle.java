package com.fleetmanager.analytics.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Entity representing a Vehicle of the fleet
 */
@Entity
@Table(name = "vehicles")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Vehicle {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String plate;

    private String brand;

    private String vehicleType; // e.g., CAR, VAN, TRUCK

}
