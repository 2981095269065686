package com.fleetmanager.analytics.controller;

import com.fleetmanager.analytics.dto.ApiResponse;
import com.fleetmanager.analytics.dto.DriverRequest;
import com.fleetmanager.analytics.dto.VehicleRequest;
import com.fleetmanager.analytics.entity.Driver;
import com.fleetmanager.analytics.entity.Vehicle;
import com.fleetmanager.analytics.repository.DriverRepository;
import com.fleetmanager.analytics.repository.VehicleRepository;
import com.fleetmanager.analytics.service.CacheableDataService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for FleetController — registration and cache eviction.
 */
@ExtendWith(MockitoExtension.class)
class FleetControllerTest {

    @Mock private DriverRepository     driverRepository;
    @Mock private VehicleRepository    vehicleRepository;
    @Mock private CacheableDataService cacheableDataService;

    @InjectMocks
    private FleetController fleetController;

    @Test
    @DisplayName("New driver → 201 and the roster caches are evicted")
    void registerDriver_evictsCaches() {
        when(driverRepository.save(any())).thenAnswer(inv -> {
            Driver d = inv.getArgument(0);
            d.setId(4L);
            return d;
        });

        ResponseEntity<ApiResponse> response = fleetController.registerDriver(
                new DriverRequest("  Kostas ", "Ioannou", null));

        assertThat(response.getStatusCode().value()).isEqualTo(201);
        assertThat(((Driver) response.getBody().getData()).getName()).isEqualTo("Kostas");
        verify(cacheableDataService).evictFleetCaches();
    }

    @Test
    @DisplayName("Plate is normalised to upper case before saving")
    void registerVehicle_normalisesPlate() {
        when(vehicleRepository.existsByPlate("ABC-1001")).thenReturn(false);
        when(vehicleRepository.save(any())).thenAnswer(inv -> inv.getArgument(0));

        ResponseEntity<ApiResponse> response = fleetController.registerVehicle(
                new VehicleRequest(" abc-1001 ", "Fiat Doblo", "VAN"));

        assertThat(response.getStatusCode().value()).isEqualTo(201);
        ArgumentCaptor<Vehicle> captor = ArgumentCaptor.forClass(Vehicle.class);
        verify(vehicleRepository).save(captor.capture());
        assertThat(captor.getValue().getPlate()).isEqualTo("ABC-1001");
        verify(cacheableDataService).evictFleetCaches();
    }

    @Test
    @DisplayName("Duplicate plate → 400, nothing saved, caches untouched")
    void registerVehicle_duplicatePlate_badRequest() {
        when(vehicleRepository.existsByPlate("IKY-1234")).thenReturn(true);

        ResponseEntity<ApiResponse> response = fleetController.registerVehicle(
                new VehicleRequest("iky-1234", "Ford Transit", "VAN"));

        assertThat(response.getStatusCode().value()).isEqualTo(400);
        assertThat(response.getBody().isSuccess()).isFalse();
        assertThat(response.getBody().getMessage()).contains("IKY-1234");
        verify(vehicleRepository, never()).save(any());
        verifyNoInteractions(cacheableDataService);
    }
}
