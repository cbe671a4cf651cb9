package com.bbthechange.carshare.controller;

import com.bbthechange.carshare.dto.CarDTO;
import com.bbthechange.carshare.dto.HeartbeatResponse;
import com.bbthechange.carshare.dto.TelematicsUpdateRequest;
import com.bbthechange.carshare.exception.CarNotFoundException;
import com.bbthechange.carshare.exception.CommandNotFoundException;
import com.bbthechange.carshare.exception.UnauthorizedException;
import com.bbthechange.carshare.model.Car;
import com.bbthechange.carshare.model.CarCommand;
import com.bbthechange.carshare.model.CommandKind;
import com.bbthechange.carshare.model.Location;
import com.bbthechange.carshare.service.AuthService;
import com.bbthechange.carshare.service.CommandChannelService;
import com.bbthechange.carshare.service.FleetService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.security.servlet.SecurityAutoConfiguration;
import org.springframework.boot.autoconfigure.security.servlet.SecurityFilterAutoConfiguration;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = CarClientController.class, excludeAutoConfiguration = {
    SecurityAutoConfiguration.class,
    SecurityFilterAutoConfiguration.class,
    UserDetailsServiceAutoConfiguration.class
})
@TestPropertySource(locations = "classpath:application-test.properties")
@ActiveProfiles("test")
class CarClientControllerTest {

    private static final String VIN = "VIN-001";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AuthService authService;

    @MockitoBean
    private FleetService fleetService;

    @MockitoBean
    private CommandChannelService commandChannelService;

    @Test
    void register_ValidKey_ReturnsCarToken() throws Exception {
        // Given
        when(authService.registerCar(VIN, "test-car-key")).thenReturn("car-jwt");

        // When & Then
        mockMvc.perform(post("/car/register")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"vin\":\"VIN-001\",\"api_key\":\"test-car-key\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.vin").value(VIN))
                .andExpect(jsonPath("$.car_token").value("car-jwt"));
    }

    @Test
    void register_BadKey_ReturnsUnauthorized() throws Exception {
        when(authService.registerCar(VIN, "wrong")).thenThrow(new UnauthorizedException("Invalid car API key"));

        mockMvc.perform(post("/car/register")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"vin\":\"VIN-001\",\"apiKey\":\"wrong\"}"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void register_UnknownVin_ReturnsNotFound() throws Exception {
        when(authService.registerCar("VIN-404", "test-car-key")).thenThrow(new CarNotFoundException("Unknown VIN: VIN-404"));

        mockMvc.perform(post("/car/register")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"vin\":\"VIN-404\",\"api_key\":\"test-car-key\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("CAR_NOT_FOUND"));
    }

    @Test
    void heartbeat_WithTelematics_ReturnsPendingCount() throws Exception {
        // Given
        Car car = new Car(VIN, "Hatchback", new Location(47.1585, 27.6014));
        when(fleetService.heartbeat(eq(VIN), any(TelematicsUpdateRequest.class)))
                .thenReturn(new HeartbeatResponse(VIN, 2, new CarDTO(car)));

        // When & Then
        mockMvc.perform(post("/car/heartbeat")
                .requestAttr("vin", VIN)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"battery_pct\":80,\"engine_off\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.vin").value(VIN))
                .andExpect(jsonPath("$.pending_commands").value(2));

        verify(fleetService).heartbeat(eq(VIN),
                argThat(update -> Integer.valueOf(80).equals(update.getBatteryPct())));
    }

    @Test
    void heartbeat_WithoutCarSession_ReturnsUnauthorized() throws Exception {
        mockMvc.perform(post("/car/heartbeat").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isUnauthorized());

        verify(fleetService, never()).heartbeat(any(), any());
    }

    @Test
    void commands_ReturnsPendingInOrder() throws Exception {
        // Given
        CarCommand unlock = new CarCommand(VIN, CommandKind.UNLOCK);
        CarCommand query = new CarCommand(VIN, CommandKind.STATE_QUERY);
        when(commandChannelService.poll(VIN)).thenReturn(List.of(unlock, query));

        // When & Then
        mockMvc.perform(get("/car/commands").requestAttr("vin", VIN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.vin").value(VIN))
                .andExpect(jsonPath("$.commands.length()").value(2))
                .andExpect(jsonPath("$.commands[0].id").value(unlock.getId()))
                .andExpect(jsonPath("$.commands[0].action").value("unlock"))
                .andExpect(jsonPath("$.commands[1].action").value("state_query"))
                .andExpect(jsonPath("$.commands[0].created_at").exists());
    }

    @Test
    void ack_PendingCommand_ReturnsAckedCommand() throws Exception {
        // Given
        CarCommand unlock = new CarCommand(VIN, CommandKind.UNLOCK);
        unlock.acknowledge(true, "door actuator ok");
        when(commandChannelService.ack(VIN, unlock.getId(), true, "door actuator ok")).thenReturn(unlock);

        // When & Then
        mockMvc.perform(post("/car/ack")
                .requestAttr("vin", VIN)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"command_id\":\"" + unlock.getId() + "\",\"success\":true,\"note\":\" door actuator ok \"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.command.status").value("acked"))
                .andExpect(jsonPath("$.command.success").value(true))
                .andExpect(jsonPath("$.command.acked_at").exists());
    }

    @Test
    void ack_SuccessOmitted_DefaultsToTrue() throws Exception {
        CarCommand lock = new CarCommand(VIN, CommandKind.LOCK);
        lock.acknowledge(true, null);
        when(commandChannelService.ack(VIN, lock.getId(), true, null)).thenReturn(lock);

        mockMvc.perform(post("/car/ack")
                .requestAttr("vin", VIN)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"commandId\":\"" + lock.getId() + "\"}"))
                .andExpect(status().isOk());

        verify(commandChannelService).ack(VIN, lock.getId(), true, null);
    }

    @Test
    void ack_AlreadyAcked_ReturnsNotFound() throws Exception {
        when(commandChannelService.ack(VIN, "cmd-1", true, null))
                .thenThrow(new CommandNotFoundException("Command already acknowledged: cmd-1"));

        mockMvc.perform(post("/car/ack")
                .requestAttr("vin", VIN)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"command_id\":\"cmd-1\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("COMMAND_NOT_FOUND"));
    }

    @Test
    void ack_MissingCommandId_ReturnsBadRequest() throws Exception {
        mockMvc.perform(post("/car/ack")
                .requestAttr("vin", VIN)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"success\":true}"))
                .andExpect(status().isBadRequest());
    }
}
