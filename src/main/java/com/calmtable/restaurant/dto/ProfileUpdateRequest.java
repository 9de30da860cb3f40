package com.calmtable.restaurant.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.Data;

/** Partial profile edit; a null field is left unchanged and an empty one clears it. */
@Data
public class ProfileUpdateRequest {
    @JsonProperty("first_name")
    @Size(max = 150)
    private String firstName;

    @JsonProperty("last_name")
    @Size(max = 150)
    private String lastName;

    @Size(max = 30)
    private String phone;
}
