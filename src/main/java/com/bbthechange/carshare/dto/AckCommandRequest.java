package com.bbthechange.carshare.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AckCommandRequest {

    @NotBlank(message = "command_id is required")
    @JsonProperty("command_id")
    @JsonAlias("commandId")
    private String commandId;

    private Boolean success;

    @Size(max = 500, message = "note cannot exceed 500 characters")
    private String note;

    @JsonIgnore
    public boolean isSuccessful() {
        return success == null || success;
    }

    public String getNote() {
        return note != null && !note.isBlank() ? note.trim() : null;
    }
}
